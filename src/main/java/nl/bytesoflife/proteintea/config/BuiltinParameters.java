package nl.bytesoflife.proteintea.config;

import nl.bytesoflife.proteintea.technical.TechnicalParameters;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;

/**
 * Provides the default parameters bundled as classpath resources.
 */
public class BuiltinParameters {

    private static final ParameterLoader LOADER = new ParameterLoader();

    private static volatile EconomicParameters cachedEconomic;
    private static volatile EnvironmentalParameters cachedEnvironmental;
    private static volatile TechnicalParameters cachedTechnical;

    /**
     * Scenario A costs, 10% discount rate, 5.0 USD/kg selling price.
     */
    public static EconomicParameters economic() {
        if (cachedEconomic == null) {
            synchronized (BuiltinParameters.class) {
                if (cachedEconomic == null) {
                    cachedEconomic = load("/defaults/economic.properties", LOADER::economic);
                }
            }
        }
        return cachedEconomic;
    }

    /**
     * Hybrid allocation (economic weight 0.6) over protein isolate, starch and fiber.
     */
    public static EnvironmentalParameters environmental() {
        if (cachedEnvironmental == null) {
            synchronized (BuiltinParameters.class) {
                if (cachedEnvironmental == null) {
                    cachedEnvironmental = load("/defaults/environmental.properties", LOADER::environmental);
                }
            }
        }
        return cachedEnvironmental;
    }

    public static TechnicalParameters technical() {
        if (cachedTechnical == null) {
            synchronized (BuiltinParameters.class) {
                if (cachedTechnical == null) {
                    cachedTechnical = load("/defaults/technical.properties", LOADER::technical);
                }
            }
        }
        return cachedTechnical;
    }

    private static <T> T load(String resource, Function<Properties, T> parser) {
        try (InputStream is = BuiltinParameters.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            return parser.apply(LOADER.read(is));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed defaults in " + resource, e);
        }
    }
}
