package com.cashcow.calculator;

import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import java.util.List;
import lombok.Getter;

/**
 * A calculator bound to an entity type: the function, the variant class it accepts, a
 * description, an optional cash-flow category and its ordered dependencies.
 */
@Getter
public final class CalculatorRegistration<E extends Entity> {

    private final EntityType entityType;
    private final String name;
    private final Class<E> entityClass;
    private final CalculatorFunction<E> function;
    private final String description;

    /** Null for informational calculators that do not feed the period row. */
    private final CashFlowCategory category;

    private final List<String> dependencies;

    public CalculatorRegistration(
            EntityType entityType,
            String name,
            Class<E> entityClass,
            CalculatorFunction<E> function,
            String description,
            CashFlowCategory category,
            List<String> dependencies) {
        this.entityType = entityType;
        this.name = name;
        this.entityClass = entityClass;
        this.function = function;
        this.description = description;
        this.category = category;
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Invokes the function for a matching entity. Entities of another variant yield 0.0.
     * Exceptions and non-finite results become failures instead of propagating.
     */
    public CalculatorOutcome invoke(Entity entity, CalculationContext context) {
        if (!entityClass.isInstance(entity)) {
            return CalculatorOutcome.success(0.0);
        }
        try {
            double value = function.calculate(entityClass.cast(entity), context);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return CalculatorOutcome.failure("Calculator " + name + " produced a non-finite value: " + value, null);
            }
            return CalculatorOutcome.success(value);
        } catch (RuntimeException e) {
            return CalculatorOutcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public boolean isCashFlow() {
        return category != null;
    }
}
