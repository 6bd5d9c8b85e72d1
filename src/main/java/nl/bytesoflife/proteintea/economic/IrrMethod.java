package nl.bytesoflife.proteintea.economic;

/**
 * How an internal rate of return was obtained. The two differ materially for short projects.
 */
public enum IrrMethod {
    /**
     * Linearized estimate: average simple return per year on the investment.
     */
    APPROXIMATE,
    /**
     * Discount rate at which the net present value is zero, found by root solving.
     */
    EXACT
}
