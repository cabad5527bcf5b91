package com.cashcow.calculator;

import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import com.cashcow.exception.CalculationException;
import com.cashcow.exception.CalculatorConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of calculators keyed by (entity type, calculator name).
 *
 * <p>An explicit object, built once at startup and handed to the engine; tests build their
 * own. Registration replaces the per-type map copy-on-write, so lookups during a forecast
 * never see a half-applied registration. Re-registering a name overwrites it and drops the
 * cached dependency order for that type.
 *
 * <p>Partial-failure policy: {@link #calculateAll} never lets one calculator abort the batch.
 * A failed calculator contributes 0.0 and a {@link CalculationDiagnostic}. Configuration
 * errors (missing dependencies, cycles) are not contained and reach the caller.
 */
public class CalculatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(CalculatorRegistry.class);

    private final Map<EntityType, Map<String, CalculatorRegistration<?>>> calculators = new ConcurrentHashMap<>();
    private final DependencyResolver resolver = new DependencyResolver();

    public <E extends Entity> void register(
            EntityType type, String name, Class<E> entityClass, CalculatorFunction<E> function, String description) {
        register(type, name, entityClass, function, description, null, List.of());
    }

    public <E extends Entity> void register(
            EntityType type,
            String name,
            Class<E> entityClass,
            CalculatorFunction<E> function,
            String description,
            CashFlowCategory category,
            List<String> dependencies) {
        register(new CalculatorRegistration<>(type, name, entityClass, function, description, category, dependencies));
    }

    public synchronized void register(CalculatorRegistration<?> registration) {
        EntityType type = registration.getEntityType();
        Map<String, CalculatorRegistration<?>> updated =
                new LinkedHashMap<>(calculators.getOrDefault(type, Map.of()));
        if (updated.containsKey(registration.getName())) {
            log.debug("Overwriting calculator {}.{}", type.getKey(), registration.getName());
        }
        updated.put(registration.getName(), registration);
        calculators.put(type, Collections.unmodifiableMap(updated));
        resolver.invalidate(type);
    }

    /** The calculator function, or null when none is registered under that key. */
    public CalculatorFunction<?> get(EntityType type, String name) {
        CalculatorRegistration<?> registration = getRegistration(type, name);
        return registration == null ? null : registration.getFunction();
    }

    public CalculatorRegistration<?> getRegistration(EntityType type, String name) {
        return calculators.getOrDefault(type, Map.of()).get(name);
    }

    /** Calculators of a type in registration order. */
    public Map<String, CalculatorRegistration<?>> list(EntityType type) {
        return calculators.getOrDefault(type, Map.of());
    }

    public Map<EntityType, Map<String, CalculatorRegistration<?>>> listAll() {
        Map<EntityType, Map<String, CalculatorRegistration<?>>> all = new LinkedHashMap<>();
        for (EntityType type : EntityType.values()) {
            Map<String, CalculatorRegistration<?>> forType = list(type);
            if (!forType.isEmpty()) {
                all.put(type, forType);
            }
        }
        return all;
    }

    /** Calculators of a type in dependency order. */
    public List<String> resolveOrder(EntityType type) {
        return resolver.resolveOrder(type, list(type));
    }

    /**
     * Computes one calculator for an entity, computing its dependencies first.
     *
     * @throws CalculatorConfigurationException if the calculator is unknown or its graph is invalid
     * @throws CalculationException if the calculator or one of its dependencies fails
     */
    public double calculate(Entity entity, String calculatorName, CalculationContext context) {
        EntityType type = entity.getType();
        Map<String, CalculatorRegistration<?>> forType = list(type);
        if (!forType.containsKey(calculatorName)) {
            throw new CalculatorConfigurationException(
                    "No calculator " + calculatorName + " registered for " + type.getKey(),
                    Map.of("entityType", type.getKey(), "calculator", calculatorName));
        }
        Map<String, Double> values = new HashMap<>();
        for (String name : resolver.resolveFor(type, calculatorName, forType)) {
            CalculatorRegistration<?> registration = forType.get(name);
            CalculatorOutcome outcome = registration.invoke(entity, contextFor(registration, context, values));
            if (!outcome.isSuccess()) {
                throw new CalculationException(
                        "Calculator " + type.getKey() + "." + name + " failed for " + entity.getName() + ": "
                                + outcome.getErrorMessage(),
                        Map.of("entityType", type.getKey(), "calculator", name, "entity", String.valueOf(entity.getName())),
                        outcome.getCause());
            }
            values.put(name, outcome.getValue());
        }
        return values.get(calculatorName);
    }

    /**
     * Runs every calculator of the entity's type in dependency order.
     *
     * @throws CalculatorConfigurationException if the type's dependency graph is invalid
     */
    public EntityCalculationResult calculateAll(Entity entity, CalculationContext context) {
        EntityType type = entity.getType();
        Map<String, CalculatorRegistration<?>> forType = list(type);
        if (forType.isEmpty()) {
            return new EntityCalculationResult(Map.of(), List.of());
        }
        Map<String, Double> values = new LinkedHashMap<>();
        List<CalculationDiagnostic> diagnostics = new ArrayList<>(0);
        for (String name : resolver.resolveOrder(type, forType)) {
            CalculatorRegistration<?> registration = forType.get(name);
            CalculatorOutcome outcome = registration.invoke(entity, contextFor(registration, context, values));
            if (!outcome.isSuccess()) {
                log.warn(
                        "Calculator {}.{} failed for entity '{}' in period {}: {}",
                        type.getKey(),
                        name,
                        entity.getName(),
                        context.getPeriodStart(),
                        outcome.getErrorMessage());
                diagnostics.add(CalculationDiagnostic.builder()
                        .entityType(type)
                        .entityName(entity.getName())
                        .calculator(name)
                        .period(context.getPeriodStart())
                        .message(outcome.getErrorMessage())
                        .build());
            }
            values.put(name, outcome.valueOrZero());
        }
        return new EntityCalculationResult(values, diagnostics);
    }

    /**
     * Dependencies of a calculator, direct or transitive, that are not registered for the type.
     * Empty when the graph below the calculator is complete.
     *
     * @throws CalculatorConfigurationException if the calculator itself is not registered
     */
    public List<String> validateDependencies(EntityType type, String calculatorName) {
        Map<String, CalculatorRegistration<?>> forType = list(type);
        if (!forType.containsKey(calculatorName)) {
            throw new CalculatorConfigurationException(
                    "No calculator " + calculatorName + " registered for " + type.getKey(),
                    Map.of("entityType", type.getKey(), "calculator", calculatorName));
        }
        Set<String> missing = new LinkedHashSet<>();
        collectMissing(calculatorName, forType, new LinkedHashSet<>(), missing);
        return List.copyOf(missing);
    }

    /**
     * Resolves the dependency order of every registered type.
     *
     * @throws CalculatorConfigurationException on the first missing dependency or cycle
     */
    public void validateAll() {
        for (EntityType type : calculators.keySet()) {
            resolveOrder(type);
        }
    }

    public int size() {
        return calculators.values().stream().mapToInt(Map::size).sum();
    }

    private static CalculationContext contextFor(
            CalculatorRegistration<?> registration, CalculationContext context, Map<String, Double> computed) {
        if (registration.getDependencies().isEmpty()) {
            return context;
        }
        Map<String, Double> dependencyValues = new HashMap<>();
        for (String dependency : registration.getDependencies()) {
            dependencyValues.put(dependency, computed.getOrDefault(dependency, 0.0));
        }
        return context.withDependencyValues(dependencyValues);
    }

    private static void collectMissing(
            String name, Map<String, CalculatorRegistration<?>> forType, Set<String> visited, Set<String> missing) {
        if (!visited.add(name)) {
            return;
        }
        CalculatorRegistration<?> registration = forType.get(name);
        if (registration == null) {
            missing.add(name);
            return;
        }
        for (String dependency : registration.getDependencies()) {
            collectMissing(dependency, forType, visited, missing);
        }
    }
}
