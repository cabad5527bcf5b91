package com.cashcow.unit.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.calculator.builtin.BuiltinCalculators;
import com.cashcow.cashflow.CashFlowEngine;
import com.cashcow.cashflow.CashFlowEngineConfig;
import com.cashcow.cashflow.CashFlowForecast;
import com.cashcow.cashflow.PeriodRow;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.model.Employee;
import com.cashcow.domain.model.Entity;
import com.cashcow.domain.model.Facility;
import com.cashcow.domain.model.Software;
import com.cashcow.exception.ResourceNotFoundException;
import com.cashcow.observability.ForecastMetrics;
import com.cashcow.scenario.Scenario;
import com.cashcow.scenario.ScenarioConfig;
import com.cashcow.scenario.ScenarioManager;
import com.cashcow.scenario.ScenarioSummary;
import com.cashcow.scenario.ScenarioYamlRepository;
import com.cashcow.store.InMemoryEntityStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for ScenarioManager.
 *
 * <p>Verifies: default scenarios, lookup failures, baseline identity, filtered and
 * transformed forecasts, comparison summaries, cache invalidation and YAML loading.
 */
class ScenarioManagerTest {

    private static final LocalDate JAN_2024 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DEC_2024 = LocalDate.of(2024, 12, 31);

    private InMemoryEntityStore store;
    private CashFlowEngine engine;
    private ScenarioConfig config;
    private ScenarioManager manager;

    @BeforeEach
    void setUp() {
        CalculatorRegistry registry = BuiltinCalculators.registerAll(new CalculatorRegistry());
        store = new InMemoryEntityStore();
        engine = new CashFlowEngine(
                registry, store, new CashFlowEngineConfig(), new ForecastMetrics(new SimpleMeterRegistry()));
        config = new ScenarioConfig();
        manager = new ScenarioManager(store, engine, new ScenarioYamlRepository(), config);
        manager.initialize();

        store.add(Employee.builder().name("Alice").salary(60_000).startDate(JAN_2024).endDate(DEC_2024).build());
        store.add(Facility.builder().name("Office").monthlyCost(5_000).startDate(JAN_2024).endDate(DEC_2024).build());
        store.add(Software.builder().name("Team stipend").monthlyCost(300.0).startDate(JAN_2024)
                .tags(Set.of("non_essential")).build());
    }

    private static Path scenarioResources() throws Exception {
        return Path.of(ScenarioManagerTest.class.getResource("/scenarios/hiring_freeze.yaml").toURI()).getParent();
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("default scenarios are registered in order")
        void defaults() {
            assertThat(manager.listScenarios())
                    .containsExactly("baseline", "optimistic", "conservative", "cash_preservation");
        }

        @Test
        @DisplayName("defaults can be switched off")
        void noDefaults() {
            config.setCreateDefaults(false);
            ScenarioManager bare = new ScenarioManager(store, engine, new ScenarioYamlRepository(), config);
            bare.initialize();

            assertThat(bare.listScenarios()).isEmpty();
        }

        @Test
        @DisplayName("configured directory is loaded at startup")
        void configuredDirectory() throws Exception {
            config.setDirectory(scenarioResources().toString());
            ScenarioManager loaded = new ScenarioManager(store, engine, new ScenarioYamlRepository(), config);
            loaded.initialize();

            assertThat(loaded.hasScenario("hiring_freeze")).isTrue();
            assertThat(loaded.listScenarios()).hasSize(5);
        }

        @Test
        @DisplayName("unknown scenario name is a not-found error")
        void unknown() {
            assertThatThrownBy(() -> manager.getScenario("moonshot"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("moonshot")
                    .satisfies(e -> assertThat(((ResourceNotFoundException) e).getDetails())
                            .containsEntry("resourceType", "Scenario")
                            .containsEntry("name", "moonshot"));
            assertThatThrownBy(() -> manager.calculateScenario("moonshot", JAN_2024, DEC_2024))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("replacing a scenario clears cached forecasts")
        void replaceClearsCache() {
            engine.calculatePeriod(JAN_2024, DEC_2024, "baseline");
            assertThat(engine.cacheSize()).isEqualTo(1);

            manager.addScenario(Scenario.builder().name("baseline").description("Edited").build());

            assertThat(engine.cacheSize()).isZero();
            assertThat(manager.getScenario("baseline").getDescription()).isEqualTo("Edited");
        }

        @Test
        @DisplayName("adding a new scenario keeps the cache")
        void addKeepsCache() {
            engine.calculatePeriod(JAN_2024, DEC_2024, "baseline");

            manager.addScenario(Scenario.builder().name("fresh").build());

            assertThat(engine.cacheSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("a plain forecast under the scenario name does not leak into the scenario forecast")
        void plainForecastFirst() {
            CashFlowForecast plain = engine.calculatePeriod(JAN_2024, DEC_2024, "cash_preservation");

            CashFlowForecast scenario = manager.calculateScenario("cash_preservation", JAN_2024, DEC_2024);

            assertThat(plain.row(0).category(CashFlowCategory.FACILITY_COSTS)).isCloseTo(5_000.0, within(1e-9));
            assertThat(scenario.row(0).category(CashFlowCategory.FACILITY_COSTS)).isCloseTo(4_500.0, within(1e-9));
            assertThat(scenario.row(0).category(CashFlowCategory.SOFTWARE_COSTS)).isZero();
        }

        @Test
        @DisplayName("a scenario forecast does not leak into a later plain forecast")
        void scenarioForecastFirst() {
            manager.calculateScenario("cash_preservation", JAN_2024, DEC_2024);

            CashFlowForecast plain = engine.calculatePeriod(JAN_2024, DEC_2024, "cash_preservation");

            assertThat(plain.row(0).category(CashFlowCategory.FACILITY_COSTS)).isCloseTo(5_000.0, within(1e-9));
            assertThat(plain.row(0).category(CashFlowCategory.SOFTWARE_COSTS)).isCloseTo(300.0, within(1e-9));
        }

        @Test
        @DisplayName("scenario forecasts are recomputed against the current store")
        void scenarioForecastNotCached() {
            CashFlowForecast before = manager.calculateScenario("cash_preservation", JAN_2024, DEC_2024);
            store.add(Facility.builder().name("Lab").monthlyCost(1_000).startDate(JAN_2024).build());

            CashFlowForecast after = manager.calculateScenario("cash_preservation", JAN_2024, DEC_2024);

            assertThat(after).isNotSameAs(before);
            assertThat(after.row(0).category(CashFlowCategory.FACILITY_COSTS)).isCloseTo(5_400.0, within(1e-9));
            assertThat(engine.cacheSize()).isZero();
        }

        @Test
        @DisplayName("directory and file loading go through the YAML repository")
        void yamlLoading(@TempDir Path directory) throws Exception {
            assertThat(manager.loadScenariosFromDirectory(scenarioResources())).isEqualTo(1);

            Path saved = directory.resolve("copy.yaml");
            manager.saveScenario("hiring_freeze", saved);
            manager.addScenario(Scenario.builder().name("hiring_freeze").build());
            manager.loadScenario(saved);

            assertThat(manager.getScenario("hiring_freeze").assumptionsOrEmpty())
                    .containsEntry(Scenario.HIRING_DELAY_MONTHS, 3);
        }
    }

    @Nested
    @DisplayName("Forecasts")
    class Forecasts {

        @Test
        @DisplayName("baseline forecast equals the plain forecast")
        void baselineIdentity() {
            CashFlowForecast baseline = manager.calculateScenario("baseline", JAN_2024, DEC_2024);
            CashFlowForecast plain = engine.calculatePeriod(JAN_2024, DEC_2024, "plain");

            assertThat(baseline.getRows()).isEqualTo(plain.getRows());
        }

        @Test
        @DisplayName("cash preservation drops non-essential spend, delays hiring and trims facilities")
        void cashPreservation() {
            CashFlowForecast forecast = manager.calculateScenario("cash_preservation", JAN_2024, DEC_2024);

            List<PeriodRow> rows = forecast.getRows();
            assertThat(rows).hasSize(12);
            // Hire moves from January to July; facility at 90 percent; stipend excluded
            assertThat(rows.get(0).getTotalExpenses()).isCloseTo(4_500.0, within(1e-6));
            assertThat(rows.get(5).getActiveEmployees()).isZero();
            assertThat(rows.get(6).getActiveEmployees()).isEqualTo(1);
            assertThat(rows.get(6).getTotalExpenses()).isCloseTo(5_500.0 + 4_500.0, within(1e-6));
        }

        @Test
        @DisplayName("applying a scenario leaves the store untouched")
        void applyIsPure() {
            List<Entity> all = store.findAll();

            List<Entity> scoped = manager.applyScenario("cash_preservation", all);

            assertThat(scoped).hasSize(2).extracting(Entity::getName).containsExactlyInAnyOrder("Alice", "Office");
            assertThat(store.findAll()).hasSize(3);
            Employee alice = (Employee) all.stream().filter(e -> e.getName().equals("Alice")).findFirst().orElseThrow();
            assertThat(alice.getStartDate()).isEqualTo(JAN_2024);
            assertThat(alice.getOverheadMultiplier()).isNull();
        }

        @Test
        @DisplayName("comparison keeps the requested order")
        void compare() {
            Map<String, CashFlowForecast> results =
                    manager.compareScenarios(List.of("conservative", "baseline"), JAN_2024, DEC_2024);

            assertThat(results.keySet()).containsExactly("conservative", "baseline");
            assertThat(results.values()).allSatisfy(forecast -> assertThat(forecast.size()).isEqualTo(12));
        }

        @Test
        @DisplayName("summary lines aggregate each forecast and skip empty ones")
        void summaries() {
            Map<String, CashFlowForecast> results = new LinkedHashMap<>(
                    manager.compareScenarios(List.of("baseline"), JAN_2024, DEC_2024));
            results.put("empty", CashFlowForecast.builder()
                    .scenario("empty").rows(List.of()).diagnostics(List.of()).build());

            List<ScenarioSummary> summaries = manager.createScenarioSummary(results);

            assertThat(summaries).singleElement().satisfies(summary -> {
                assertThat(summary.getScenario()).isEqualTo("baseline");
                assertThat(summary.getTotalRevenue()).isZero();
                assertThat(summary.getTotalExpenses()).isCloseTo(12 * 10_300.0, within(1e-6));
                assertThat(summary.getAverageMonthlyBurn()).isCloseTo(10_300.0, within(1e-6));
                assertThat(summary.getMonthsCashPositive()).isZero();
                assertThat(summary.getPeakEmployees()).isEqualTo(1);
                assertThat(summary.getPeakMonthlyExpenses()).isCloseTo(10_300.0, within(1e-6));
            });
        }
    }
}
