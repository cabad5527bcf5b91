package com.cashcow.calculator;

import com.cashcow.domain.model.Entity;

/**
 * A pure function computing one named quantity for one entity in one period.
 *
 * <p>Implementations must not mutate the entity or the context. Values of declared
 * dependencies are read through {@link CalculationContext#dependencyValue(String)}.
 *
 * @param <E> the entity variant the function accepts
 */
@FunctionalInterface
public interface CalculatorFunction<E extends Entity> {

    double calculate(E entity, CalculationContext context);
}
