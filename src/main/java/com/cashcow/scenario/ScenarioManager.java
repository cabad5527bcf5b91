package com.cashcow.scenario;

import com.cashcow.cashflow.CashFlowEngine;
import com.cashcow.cashflow.CashFlowForecast;
import com.cashcow.cashflow.PeriodRow;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import com.cashcow.exception.ResourceNotFoundException;
import com.cashcow.store.EntityStore;
import com.cashcow.store.InMemoryEntityStore;
import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Holds named scenarios and runs forecasts under them.
 *
 * <p>Running a scenario filters and transforms the full entity set into a scenario-scoped
 * in-memory store and hands it to the {@link CashFlowEngine} together with the scenario's
 * assumptions. The manager adds no forecasting arithmetic of its own.
 *
 * <p>Forecasts are cached by the engine under the scenario name, so replacing a scenario
 * definition clears the engine cache.
 */
@Service
@EnableConfigurationProperties(ScenarioConfig.class)
public class ScenarioManager {

    private static final Logger log = LoggerFactory.getLogger(ScenarioManager.class);

    private final EntityStore entityStore;
    private final CashFlowEngine cashFlowEngine;
    private final ScenarioYamlRepository yamlRepository;
    private final ScenarioConfig config;

    /** Guarded by {@code this}; insertion ordered. */
    private final Map<String, Scenario> scenarios = new LinkedHashMap<>();

    public ScenarioManager(
            EntityStore entityStore,
            CashFlowEngine cashFlowEngine,
            ScenarioYamlRepository yamlRepository,
            ScenarioConfig config) {
        this.entityStore = entityStore;
        this.cashFlowEngine = cashFlowEngine;
        this.yamlRepository = yamlRepository;
        this.config = config;
    }

    @PostConstruct
    public void initialize() {
        if (config.isCreateDefaults()) {
            createDefaultScenarios();
        }
        if (config.getDirectory() != null && !config.getDirectory().isBlank()) {
            loadScenariosFromDirectory(Path.of(config.getDirectory()));
        }
        log.info("Scenario manager ready with {} scenarios: {}", scenarios.size(), listScenarios());
    }

    /** Registers or replaces a scenario. Replacing invalidates cached forecasts. */
    public void addScenario(Scenario scenario) {
        Scenario previous;
        synchronized (this) {
            previous = scenarios.put(scenario.getName(), scenario);
        }
        if (previous != null) {
            log.info("Replaced scenario '{}'", scenario.getName());
            cashFlowEngine.clearCache();
        }
    }

    /**
     * @throws ResourceNotFoundException if no scenario has that name
     */
    public synchronized Scenario getScenario(String name) {
        Scenario scenario = scenarios.get(name);
        if (scenario == null) {
            throw new ResourceNotFoundException("Scenario", name);
        }
        return scenario;
    }

    public synchronized boolean hasScenario(String name) {
        return scenarios.containsKey(name);
    }

    public synchronized List<String> listScenarios() {
        return List.copyOf(scenarios.keySet());
    }

    public void loadScenario(Path yamlPath) {
        addScenario(yamlRepository.load(yamlPath));
    }

    public void saveScenario(String name, Path yamlPath) {
        yamlRepository.save(getScenario(name), yamlPath);
    }

    public int loadScenariosFromDirectory(Path directory) {
        List<Scenario> loaded = yamlRepository.loadDirectory(directory);
        loaded.forEach(this::addScenario);
        log.info("Loaded {} scenarios from {}", loaded.size(), directory);
        return loaded.size();
    }

    /** Included entities of the list, each with the scenario applied. Inputs are not modified. */
    public List<Entity> applyScenario(String scenarioName, List<Entity> entities) {
        return applyScenario(getScenario(scenarioName), entities);
    }

    public List<Entity> applyScenario(Scenario scenario, List<Entity> entities) {
        List<Entity> result = new ArrayList<>(entities.size());
        for (Entity entity : entities) {
            if (scenario.shouldIncludeEntity(entity)) {
                result.add(scenario.applyToEntity(entity));
            }
        }
        return result;
    }

    /**
     * Forecast of the entity store under a scenario.
     *
     * @throws ResourceNotFoundException if no scenario has that name
     */
    public CashFlowForecast calculateScenario(String scenarioName, LocalDate startDate, LocalDate endDate) {
        Scenario scenario = getScenario(scenarioName);
        List<Entity> scoped = applyScenario(scenario, entityStore.findAll());
        log.debug("Scenario '{}' keeps {} entities", scenarioName, scoped.size());
        return cashFlowEngine.calculatePeriod(
                startDate, endDate, scenarioName, InMemoryEntityStore.of(scoped), scenario.assumptionsOrEmpty());
    }

    public Map<String, CashFlowForecast> compareScenarios(
            List<String> scenarioNames, LocalDate startDate, LocalDate endDate) {
        Map<String, CashFlowForecast> results = new LinkedHashMap<>();
        for (String name : scenarioNames) {
            results.put(name, calculateScenario(name, startDate, endDate));
        }
        return results;
    }

    /** One summary line per non-empty forecast, in the map's order. */
    public List<ScenarioSummary> createScenarioSummary(Map<String, CashFlowForecast> results) {
        List<ScenarioSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, CashFlowForecast> entry : results.entrySet()) {
            List<PeriodRow> rows = entry.getValue().getRows();
            if (rows.isEmpty()) {
                continue;
            }
            double revenue = 0.0;
            double expenses = 0.0;
            double net = 0.0;
            int positive = 0;
            int peakEmployees = 0;
            double peakRevenue = Double.NEGATIVE_INFINITY;
            double peakExpenses = Double.NEGATIVE_INFINITY;
            for (PeriodRow row : rows) {
                revenue += row.getTotalRevenue();
                expenses += row.getTotalExpenses();
                net += row.getNetCashFlow();
                if (row.getNetCashFlow() > 0) {
                    positive++;
                }
                peakEmployees = Math.max(peakEmployees, row.getActiveEmployees());
                peakRevenue = Math.max(peakRevenue, row.getTotalRevenue());
                peakExpenses = Math.max(peakExpenses, row.getTotalExpenses());
            }
            summaries.add(ScenarioSummary.builder()
                    .scenario(entry.getKey())
                    .totalRevenue(revenue)
                    .totalExpenses(expenses)
                    .netCashFlow(net)
                    .finalCashBalance(entry.getValue().finalCashBalance())
                    .averageMonthlyBurn(-net / rows.size())
                    .monthsCashPositive(positive)
                    .peakEmployees(peakEmployees)
                    .peakMonthlyRevenue(peakRevenue)
                    .peakMonthlyExpenses(peakExpenses)
                    .build());
        }
        return summaries;
    }

    // ---- defaults ----

    private void createDefaultScenarios() {
        // Identity: forecasts under "baseline" match plain forecasts of the store.
        addScenario(Scenario.builder()
                .name("baseline")
                .description("Current plan without adjustments")
                .build());

        addScenario(Scenario.builder()
                .name("optimistic")
                .description("Optimistic growth scenario")
                .assumptions(Map.of(
                        "revenue_growth_rate", 0.25,
                        Scenario.OVERHEAD_MULTIPLIER, 1.2,
                        Scenario.HIRING_DELAY_MONTHS, -1))
                .entityOverrides(List.of(
                        multiply(EntityType.SALE, "amount", 1.5),
                        multiply(EntityType.SERVICE, "monthly_amount", 1.2)))
                .build());

        addScenario(Scenario.builder()
                .name("conservative")
                .description("Conservative scenario with reduced growth")
                .assumptions(Map.of(
                        "revenue_growth_rate", 0.05,
                        Scenario.OVERHEAD_MULTIPLIER, 1.4,
                        Scenario.HIRING_DELAY_MONTHS, 2))
                .entityOverrides(List.of(
                        multiply(EntityType.SALE, "amount", 0.8),
                        multiply(EntityType.GRANT, "amount", 0.9)))
                .build());

        addScenario(Scenario.builder()
                .name("cash_preservation")
                .description("Preserve cash and reduce burn")
                .assumptions(Map.of(Scenario.OVERHEAD_MULTIPLIER, 1.1, Scenario.HIRING_DELAY_MONTHS, 6))
                .entityFilters(ScenarioFilters.builder()
                        .excludeTags(List.of("non_essential"))
                        .excludePatterns(List.of("bonus", "stipend"))
                        .build())
                .entityOverrides(List.of(
                        EntityOverride.builder()
                                .namePattern(".*bonus.*")
                                .field("bonus_performance_max")
                                .value(0.0)
                                .build(),
                        multiply(EntityType.FACILITY, "monthly_cost", 0.9)))
                .build());
    }

    private static EntityOverride multiply(EntityType type, String field, double multiplier) {
        return EntityOverride.builder()
                .entityType(type)
                .field(field)
                .multiplier(multiplier)
                .build();
    }
}
