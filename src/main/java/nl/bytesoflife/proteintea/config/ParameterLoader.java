package nl.bytesoflife.proteintea.config;

import nl.bytesoflife.proteintea.economic.CostInputs;
import nl.bytesoflife.proteintea.economic.sensitivity.SensitivityConfig;
import nl.bytesoflife.proteintea.environmental.allocation.AllocationMethod;
import nl.bytesoflife.proteintea.environmental.allocation.CoProduct;
import nl.bytesoflife.proteintea.technical.TechnicalParameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Reads parameter records from {@link Properties} with snake_case keys.
 * Missing or malformed entries raise {@link IllegalArgumentException} naming the key.
 */
public class ParameterLoader {

    public Properties read(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        return properties;
    }

    public EconomicParameters economic(Properties p) {
        CostInputs costs = new CostInputs(
                number(p, "equipment_cost"),
                number(p, "installation_factor"),
                number(p, "maintenance_cost"),
                number(p, "raw_material_cost_per_kg"),
                number(p, "utility_cost_per_kg"),
                number(p, "labor_cost_per_kg"),
                number(p, "indirect_costs_factor"),
                number(p, "production_volume_kg_per_year"),
                integer(p, "project_duration_years"));
        double sellingPrice = number(p, "selling_price_per_kg");
        SensitivityConfig sensitivity = new SensitivityConfig(
                sellingPrice,
                integer(p, "sensitivity.depreciation_years"),
                number(p, "sensitivity.perturbation"),
                number(p, "sensitivity.range"),
                integer(p, "sensitivity.steps"));
        return new EconomicParameters(costs, number(p, "discount_rate"), sellingPrice, sensitivity);
    }

    /**
     * Co-products are listed under {@code co_products} and described by
     * {@code co_product.<name>.mass_kg} and an optional {@code co_product.<name>.price_per_kg}.
     */
    public EnvironmentalParameters environmental(Properties p) {
        List<CoProduct> coProducts = new ArrayList<>();
        for (String name : string(p, "co_products").split(",")) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) continue;
            String prefix = "co_product." + trimmed + ".";
            Double price = p.containsKey(prefix + "price_per_kg") ? number(p, prefix + "price_per_kg") : null;
            coProducts.add(new CoProduct(trimmed, number(p, prefix + "mass_kg"), price));
        }
        return new EnvironmentalParameters(
                AllocationMethod.fromKey(string(p, "allocation_method")),
                number(p, "economic_weight"),
                coProducts);
    }

    public TechnicalParameters technical(Properties p) {
        return new TechnicalParameters(
                number(p, "input_mass_kg"),
                number(p, "protein_concentrate_mass_kg"),
                number(p, "initial_protein_content"),
                number(p, "output_protein_content"),
                number(p, "initial_moisture_content"),
                number(p, "final_moisture_content"),
                integer(p, "runs_per_year"));
    }

    private static String string(Properties p, String key) {
        String value = p.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing parameter: " + key);
        }
        return value.trim();
    }

    private static double number(Properties p, String key) {
        String value = string(p, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + key + " is not a number: " + value, e);
        }
    }

    private static int integer(Properties p, String key) {
        String value = string(p, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + key + " is not an integer: " + value, e);
        }
    }
}
