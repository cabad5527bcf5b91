package com.cashcow.config;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.calculator.builtin.BuiltinCalculators;
import com.cashcow.captable.CapTableCalculator;
import com.cashcow.captable.CapTableCalculators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the calculator registry with every built-in calculator and checks its dependency
 * graph at startup, so a missing dependency or a cycle fails the context instead of the
 * first forecast.
 */
@Configuration
public class CalculatorConfig {

    private static final Logger log = LoggerFactory.getLogger(CalculatorConfig.class);

    @Bean
    public CalculatorRegistry calculatorRegistry(CapTableCalculator capTableCalculator) {
        CalculatorRegistry registry = BuiltinCalculators.registerAll(new CalculatorRegistry());
        CapTableCalculators.register(registry, capTableCalculator);
        registry.validateAll();
        log.info("Calculator registry initialized with {} calculators", registry.size());
        return registry;
    }
}
