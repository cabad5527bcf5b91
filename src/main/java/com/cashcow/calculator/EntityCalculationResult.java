package com.cashcow.calculator;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Output of {@link CalculatorRegistry#calculateAll}: every calculator's value in dependency
 * order (failed calculators contribute 0.0) and the diagnostics for the failures.
 */
@Value
public class EntityCalculationResult {

    Map<String, Double> values;
    List<CalculationDiagnostic> diagnostics;

    public EntityCalculationResult(Map<String, Double> values, List<CalculationDiagnostic> diagnostics) {
        this.values = Collections.unmodifiableMap(values);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public double value(String calculatorName) {
        return values.getOrDefault(calculatorName, 0.0);
    }

    public boolean hasFailures() {
        return !diagnostics.isEmpty();
    }
}
