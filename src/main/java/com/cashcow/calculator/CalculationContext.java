package com.cashcow.calculator;

import com.cashcow.domain.model.Entity;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Immutable inputs for every calculator invocation in one period.
 *
 * <p>Built once per period. Dependency values are layered on with
 * {@link #withDependencyValues(Map)}, which returns a new context. The only shared state is
 * the memo behind {@link #sharedComputation(String, Supplier)}: expensive cross-entity
 * reductions (cap-table totals, for instance) are computed once per period and reused by
 * every entity in it.
 */
@Getter
public final class CalculationContext {

    public static final String DEFAULT_SCENARIO = "baseline";

    private final LocalDate asOfDate;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final String scenario;
    private final List<Entity> allEntities;
    private final Map<String, Object> parameters;
    private final Map<String, Double> dependencyValues;
    @Getter(AccessLevel.NONE)
    private final ConcurrentMap<String, Object> sharedCache;

    private CalculationContext(
            LocalDate asOfDate,
            LocalDate periodStart,
            LocalDate periodEnd,
            String scenario,
            List<Entity> allEntities,
            Map<String, Object> parameters,
            Map<String, Double> dependencyValues,
            ConcurrentMap<String, Object> sharedCache) {
        this.asOfDate = asOfDate;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.scenario = scenario;
        this.allEntities = allEntities;
        this.parameters = parameters;
        this.dependencyValues = dependencyValues;
        this.sharedCache = sharedCache;
    }

    /** Context for the calendar month starting at {@code periodStart}; as-of date is the month start. */
    public static CalculationContext forPeriod(
            LocalDate periodStart,
            LocalDate periodEnd,
            String scenario,
            List<? extends Entity> allEntities,
            Map<String, ?> parameters) {
        return new CalculationContext(
                periodStart,
                periodStart,
                periodEnd,
                scenario == null ? DEFAULT_SCENARIO : scenario,
                List.copyOf(allEntities),
                parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters)),
                Map.of(),
                new ConcurrentHashMap<>());
    }

    /** Single-date context, mostly for cap-table queries and tests. */
    public static CalculationContext asOf(LocalDate date, List<? extends Entity> allEntities) {
        return forPeriod(date, date, DEFAULT_SCENARIO, allEntities, Map.of());
    }

    public CalculationContext withDependencyValues(Map<String, Double> values) {
        return new CalculationContext(
                asOfDate,
                periodStart,
                periodEnd,
                scenario,
                allEntities,
                parameters,
                Map.copyOf(values),
                sharedCache);
    }

    /**
     * Value computed by a declared dependency for the current entity.
     *
     * @throws IllegalStateException if the dependency was not computed before this calculator
     */
    public double dependencyValue(String calculatorName) {
        Double value = dependencyValues.get(calculatorName);
        if (value == null) {
            throw new IllegalStateException("Dependency not available in context: " + calculatorName);
        }
        return value;
    }

    public Object parameter(String name, Object defaultValue) {
        Object value = parameters.get(name);
        return value == null ? defaultValue : value;
    }

    public double numericParameter(String name, double defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return defaultValue;
    }

    public <T extends Entity> List<T> entitiesOfType(Class<T> type) {
        return allEntities.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /** Computes {@code supplier} once per context family and returns the memoized value afterwards. */
    @SuppressWarnings("unchecked")
    public <T> T sharedComputation(String key, Supplier<T> supplier) {
        return (T) sharedCache.computeIfAbsent(key, k -> supplier.get());
    }
}
