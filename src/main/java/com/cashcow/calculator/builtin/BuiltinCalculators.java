package com.cashcow.calculator.builtin;

import com.cashcow.calculator.CalculatorRegistry;

/**
 * Entry point that registers every built-in cash-flow calculator on a registry.
 */
public final class BuiltinCalculators {

    private BuiltinCalculators() {}

    public static CalculatorRegistry registerAll(CalculatorRegistry registry) {
        EmployeeCalculators.register(registry);
        FundingCalculators.register(registry);
        RevenueCalculators.register(registry);
        OperatingCostCalculators.register(registry);
        return registry;
    }
}
