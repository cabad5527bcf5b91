package com.cashcow.calculator;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.exception.CalculatorConfigurationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topological ordering of the calculators registered for one entity type.
 *
 * <p>Depth-first over registration order, so independent calculators keep the order they
 * were registered in and every calculator comes after its dependencies. The order is
 * computed once per entity type and cached until the registry changes.
 */
public class DependencyResolver {

    private final Map<EntityType, List<String>> orderCache = new ConcurrentHashMap<>();

    /**
     * Full dependency order for a type.
     *
     * @throws CalculatorConfigurationException on a missing dependency or a cycle
     */
    public List<String> resolveOrder(EntityType type, Map<String, CalculatorRegistration<?>> calculators) {
        return orderCache.computeIfAbsent(type, t -> computeOrder(t, calculators));
    }

    /** The target's transitive dependencies followed by the target, in resolved order. */
    public List<String> resolveFor(
            EntityType type, String target, Map<String, CalculatorRegistration<?>> calculators) {
        List<String> order = resolveOrder(type, calculators);
        Set<String> reachable = new HashSet<>();
        collectReachable(target, calculators, reachable);
        return order.stream().filter(reachable::contains).toList();
    }

    public void invalidate(EntityType type) {
        orderCache.remove(type);
    }

    private List<String> computeOrder(EntityType type, Map<String, CalculatorRegistration<?>> calculators) {
        List<String> order = new ArrayList<>(calculators.size());
        Set<String> done = new HashSet<>();
        LinkedHashSet<String> inProgress = new LinkedHashSet<>();
        for (String name : calculators.keySet()) {
            visit(type, name, calculators, done, inProgress, order);
        }
        return List.copyOf(order);
    }

    private void visit(
            EntityType type,
            String name,
            Map<String, CalculatorRegistration<?>> calculators,
            Set<String> done,
            LinkedHashSet<String> inProgress,
            List<String> order) {
        if (done.contains(name)) {
            return;
        }
        if (inProgress.contains(name)) {
            List<String> cycle = new ArrayList<>(inProgress);
            cycle = new ArrayList<>(cycle.subList(cycle.indexOf(name), cycle.size()));
            cycle.add(name);
            throw new CalculatorConfigurationException(
                    "Dependency cycle for " + type.getKey() + ": " + String.join(" -> ", cycle),
                    Map.of("entityType", type.getKey(), "cycle", cycle));
        }
        CalculatorRegistration<?> registration = calculators.get(name);
        inProgress.add(name);
        for (String dependency : registration.getDependencies()) {
            if (!calculators.containsKey(dependency)) {
                throw new CalculatorConfigurationException(
                        "Calculator " + type.getKey() + "." + name + " depends on unregistered calculator " + dependency,
                        Map.of("entityType", type.getKey(), "calculator", name, "missing", dependency));
            }
            visit(type, dependency, calculators, done, inProgress, order);
        }
        inProgress.remove(name);
        done.add(name);
        order.add(name);
    }

    private void collectReachable(
            String name, Map<String, CalculatorRegistration<?>> calculators, Set<String> reachable) {
        if (!reachable.add(name)) {
            return;
        }
        CalculatorRegistration<?> registration = calculators.get(name);
        if (registration == null) {
            return;
        }
        for (String dependency : registration.getDependencies()) {
            collectReachable(dependency, calculators, reachable);
        }
    }
}
