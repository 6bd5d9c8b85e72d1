package nl.bytesoflife.proteintea;

/**
 * Thrown when co-product shares cannot be derived because the allocation
 * basis (total mass or total economic value) is zero.
 */
public class InvalidAllocationException extends IllegalArgumentException {

    private final String method;

    public InvalidAllocationException(String method, String message) {
        super(message);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
