package com.cashcow.unit.cashflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.calculator.builtin.BuiltinCalculators;
import com.cashcow.cashflow.CalculationSummary;
import com.cashcow.cashflow.CashFlowEngine;
import com.cashcow.cashflow.CashFlowEngineConfig;
import com.cashcow.cashflow.CashFlowForecast;
import com.cashcow.cashflow.CategoryBreakdown;
import com.cashcow.cashflow.PeriodRow;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Employee;
import com.cashcow.domain.model.Facility;
import com.cashcow.domain.model.Grant;
import com.cashcow.domain.model.Project;
import com.cashcow.domain.model.Sale;
import com.cashcow.domain.model.Software;
import com.cashcow.exception.InvalidDateRangeException;
import com.cashcow.observability.ForecastMetrics;
import com.cashcow.store.InMemoryEntityStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for CashFlowEngine.
 *
 * <p>Verifies: the worked 2024 example, row count and prefix-sum invariants, identical
 * output across sync, async and parallel strategies, caching, failure containment,
 * category aggregation and the calculation summary.
 */
class CashFlowEngineTest {

    private static final LocalDate JAN_2024 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DEC_2024 = LocalDate.of(2024, 12, 31);

    private CalculatorRegistry registry;
    private InMemoryEntityStore store;
    private CashFlowEngineConfig config;
    private MeterRegistry meterRegistry;
    private CashFlowEngine engine;
    private ExecutorService storeExecutor;

    @BeforeEach
    void setUp() {
        registry = BuiltinCalculators.registerAll(new CalculatorRegistry());
        storeExecutor = Executors.newFixedThreadPool(2);
        store = new InMemoryEntityStore(storeExecutor);
        config = new CashFlowEngineConfig();
        meterRegistry = new SimpleMeterRegistry();
        engine = new CashFlowEngine(registry, store, config, new ForecastMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdownNow();
    }

    private static Employee employee(String name, double salary, LocalDate start) {
        return Employee.builder().name(name).salary(salary).startDate(start).build();
    }

    private static Facility facility(String name, double monthlyCost) {
        return Facility.builder().name(name).monthlyCost(monthlyCost).startDate(JAN_2024).endDate(DEC_2024).build();
    }

    private void loadMixedEntities() {
        store.add(employee("Alice", 120_000, JAN_2024));
        store.add(employee("Bob", 96_000, LocalDate.of(2024, 4, 1)));
        store.add(facility("Office", 4_000));
        store.add(Software.builder().name("CAD").monthlyCost(250.0).startDate(JAN_2024).build());
        store.add(Grant.builder().name("SBIR").amount(120_000).startDate(JAN_2024).endDate(DEC_2024).build());
        store.add(Sale.builder().name("Pilot").amount(40_000).startDate(JAN_2024)
                .deliveryDate(LocalDate.of(2024, 5, 20)).build());
        store.add(Project.builder().name("Prototype").totalBudget(60_000).startDate(LocalDate.of(2024, 3, 1))
                .endDate(LocalDate.of(2024, 8, 31)).build());
    }

    @Nested
    @DisplayName("Synchronous forecast")
    class Synchronous {

        @Test
        @DisplayName("one employee and one facility burn 10000 a month through 2024")
        void workedExample() {
            config.setStartingCash(50_000);
            store.add(employee("Alice", 60_000, JAN_2024));
            store.add(facility("Office", 5_000));

            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

            assertThat(forecast.size()).isEqualTo(12);
            for (PeriodRow row : forecast.getRows()) {
                assertThat(row.getTotalExpenses()).isCloseTo(10_000.0, within(1e-9));
                assertThat(row.getTotalRevenue()).isZero();
                assertThat(row.getNetCashFlow()).isCloseTo(-10_000.0, within(1e-9));
                assertThat(row.category(CashFlowCategory.EMPLOYEE_COSTS)).isCloseTo(5_000.0, within(1e-9));
                assertThat(row.category(CashFlowCategory.FACILITY_COSTS)).isEqualTo(5_000.0);
                assertThat(row.getActiveEmployees()).isEqualTo(1);
            }
            assertThat(forecast.row(11).getCashBalance()).isCloseTo(50_000.0 - 120_000.0, within(1e-6));
            assertThat(forecast.finalCashBalance()).isCloseTo(-70_000.0, within(1e-6));
        }

        @Test
        @DisplayName("row count covers every calendar month touched by the range")
        void rowCount() {
            loadMixedEntities();

            CashFlowForecast forecast = engine.calculatePeriod(LocalDate.of(2023, 11, 15), LocalDate.of(2024, 2, 3));

            assertThat(forecast.getRows()).extracting(PeriodRow::getPeriod).containsExactly(
                    LocalDate.of(2023, 11, 1),
                    LocalDate.of(2023, 12, 1),
                    LocalDate.of(2024, 1, 1),
                    LocalDate.of(2024, 2, 1));
        }

        @Test
        @DisplayName("single-day range yields one row")
        void singleDay() {
            loadMixedEntities();

            assertThat(engine.calculatePeriod(JAN_2024, JAN_2024).size()).isEqualTo(1);
        }

        @Test
        @DisplayName("cash balance is starting cash plus the running net flow")
        void prefixSum() {
            config.setStartingCash(250_000);
            loadMixedEntities();

            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

            double running = 250_000;
            for (PeriodRow row : forecast.getRows()) {
                assertThat(row.getNetCashFlow())
                        .isCloseTo(row.getTotalRevenue() - row.getTotalExpenses(), within(1e-9));
                running += row.getNetCashFlow();
                assertThat(row.getCashBalance()).isCloseTo(running, within(1e-6));
            }
        }

        @Test
        @DisplayName("entities outside their dates contribute nothing")
        void activity() {
            loadMixedEntities();

            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

            assertThat(forecast.row(0).getActiveEmployees()).isEqualTo(1);
            assertThat(forecast.row(3).getActiveEmployees()).isEqualTo(2);
            assertThat(forecast.row(1).getActiveProjects()).isZero();
            assertThat(forecast.row(2).getActiveProjects()).isEqualTo(1);
            assertThat(forecast.row(2).category(CashFlowCategory.PROJECT_COSTS)).isEqualTo(10_000.0);
            assertThat(forecast.row(4).category(CashFlowCategory.SALES_REVENUE)).isEqualTo(40_000.0);
            assertThat(forecast.row(5).category(CashFlowCategory.SALES_REVENUE)).isZero();
            assertThat(forecast.row(8).category(CashFlowCategory.PROJECT_COSTS)).isZero();
        }

        @Test
        @DisplayName("growth rate is 0 when the base month is 0")
        void growthFromZero() {
            loadMixedEntities();

            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

            assertThat(forecast.row(0).getRevenueGrowthRate()).isZero();
            // Grant revenue only in April, grant plus the sale in May
            assertThat(forecast.row(4).getRevenueGrowthRate()).isCloseTo(400.0, within(1e-9));
        }

        @Test
        @DisplayName("empty store yields zero rows at the starting balance")
        void emptyStore() {
            config.setStartingCash(1_000);

            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, LocalDate.of(2024, 3, 31));

            assertThat(forecast.getRows()).hasSize(3).allSatisfy(row -> {
                assertThat(row.getTotalRevenue()).isZero();
                assertThat(row.getTotalExpenses()).isZero();
                assertThat(row.getCashBalance()).isEqualTo(1_000.0);
                assertThat(row.getRevenuePerEmployee()).isZero();
            });
        }

        @Test
        @DisplayName("start after end is rejected")
        void invalidRange() {
            assertThatThrownBy(() -> engine.calculatePeriod(DEC_2024, JAN_2024))
                    .isInstanceOf(InvalidDateRangeException.class);
            assertThatThrownBy(() -> engine.calculatePeriodAsync(DEC_2024, JAN_2024))
                    .isInstanceOf(InvalidDateRangeException.class);
            assertThatThrownBy(() -> engine.calculateParallel(DEC_2024, JAN_2024))
                    .isInstanceOf(InvalidDateRangeException.class);
        }

        @Test
        @DisplayName("starting_cash assumption overrides the configured starting cash")
        void startingCashAssumption() {
            config.setStartingCash(10_000);
            store.add(facility("Office", 1_000));

            CashFlowForecast forecast = engine.calculatePeriod(
                    JAN_2024, LocalDate.of(2024, 1, 31), "funded", store, Map.of("starting_cash", 500_000));

            assertThat(forecast.getStartingCash()).isEqualTo(500_000.0);
            assertThat(forecast.row(0).getCashBalance()).isEqualTo(499_000.0);
        }
    }

    @Nested
    @DisplayName("Strategy equivalence")
    class StrategyEquivalence {

        @Test
        @DisplayName("sync, async and parallel produce identical forecasts")
        void identicalForecasts() {
            config.setStartingCash(100_000);
            loadMixedEntities();

            CashFlowForecast sync = engine.calculatePeriod(JAN_2024, DEC_2024);
            CashFlowForecast async = engine.calculatePeriodAsync(JAN_2024, DEC_2024).join();
            CashFlowForecast parallel = engine.calculateParallel(JAN_2024, DEC_2024, 3);

            assertThat(async).isEqualTo(sync);
            assertThat(parallel).isEqualTo(sync);
        }

        @Test
        @DisplayName("parallel result does not depend on the worker count")
        void workerCountIrrelevant() {
            loadMixedEntities();

            CashFlowForecast one = engine.calculateParallel(JAN_2024, DEC_2024, 1);
            CashFlowForecast many = engine.calculateParallel(JAN_2024, DEC_2024, 16);

            assertThat(many).isEqualTo(one);
        }

        @Test
        @DisplayName("fewer than one worker is rejected")
        void invalidWorkers() {
            assertThatThrownBy(() -> engine.calculateParallel(JAN_2024, DEC_2024, 0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxWorkers");
        }

        @Test
        @DisplayName("each strategy is counted under its own tag")
        void strategyMetrics() {
            loadMixedEntities();

            engine.calculatePeriod(JAN_2024, DEC_2024);
            engine.calculatePeriodAsync(JAN_2024, DEC_2024).join();
            engine.calculateParallel(JAN_2024, DEC_2024, 2);

            for (String strategy : List.of("sync", "async", "parallel")) {
                assertThat(meterRegistry.get("forecast.calculations").tag("strategy", strategy)
                        .counter().count()).isEqualTo(1.0);
            }
        }
    }

    @Nested
    @DisplayName("Cache")
    class Cache {

        @Test
        @DisplayName("second identical call is served from the cache")
        void cacheHit() {
            loadMixedEntities();

            CashFlowForecast first = engine.calculatePeriod(JAN_2024, DEC_2024);
            CashFlowForecast second = engine.calculatePeriod(JAN_2024, DEC_2024);

            assertThat(second).isSameAs(first);
            assertThat(engine.cacheSize()).isEqualTo(1);
            assertThat(meterRegistry.get("forecast.cache.hits").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("scenario is part of the cache key")
        void scenarioInKey() {
            loadMixedEntities();

            engine.calculatePeriod(JAN_2024, DEC_2024, "baseline");
            engine.calculatePeriod(JAN_2024, DEC_2024, "other");

            assertThat(engine.cacheSize()).isEqualTo(2);
        }

        @Test
        @DisplayName("explicit source and assumptions bypass the cache")
        void explicitSourceNotCached() {
            InMemoryEntityStore small = InMemoryEntityStore.of(List.of(facility("Office", 1_000)));
            InMemoryEntityStore large = InMemoryEntityStore.of(List.of(facility("Office", 1_000), facility("Lab", 4_000)));

            CashFlowForecast first = engine.calculatePeriod(JAN_2024, DEC_2024, "x", small, Map.of("starting_cash", 5.0));
            CashFlowForecast second =
                    engine.calculatePeriod(JAN_2024, DEC_2024, "x", large, Map.of("starting_cash", 1_000_000.0));

            assertThat(second).isNotSameAs(first);
            assertThat(first.getStartingCash()).isEqualTo(5.0);
            assertThat(second.getStartingCash()).isEqualTo(1_000_000.0);
            assertThat(second.row(0).getTotalExpenses()).isCloseTo(5_000.0, within(1e-9));
            assertThat(engine.cacheSize()).isZero();
        }

        @Test
        @DisplayName("clearCache forces recomputation against the current store")
        void clearCache() {
            store.add(facility("Office", 1_000));
            CashFlowForecast before = engine.calculatePeriod(JAN_2024, DEC_2024);

            store.add(facility("Warehouse", 2_000));
            assertThat(engine.calculatePeriod(JAN_2024, DEC_2024)).isSameAs(before);

            engine.clearCache();
            CashFlowForecast after = engine.calculatePeriod(JAN_2024, DEC_2024);

            assertThat(engine.cacheSize()).isEqualTo(1);
            assertThat(after.row(0).getTotalExpenses()).isEqualTo(3_000.0);
        }
    }

    @Nested
    @DisplayName("Failure containment")
    class FailureContainment {

        @Test
        @DisplayName("a throwing calculator zeroes only its own contribution and is reported")
        void failingCalculator() {
            registry.register(EntityType.EMPLOYEE, "broken_bonus_calc", Employee.class, (e, c) -> {
                throw new IllegalStateException("bonus table missing");
            }, "Broken", CashFlowCategory.EMPLOYEE_COSTS, List.of());
            store.add(employee("Alice", 60_000, JAN_2024));
            store.add(facility("Office", 5_000));

            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, LocalDate.of(2024, 3, 31));

            assertThat(forecast.getRows()).allSatisfy(row ->
                    assertThat(row.getTotalExpenses()).isCloseTo(10_000.0, within(1e-9)));
            assertThat(forecast.getDiagnostics()).hasSize(3)
                    .allSatisfy(diagnostic -> assertThat(diagnostic.getCalculator()).isEqualTo("broken_bonus_calc"));
            assertThat(meterRegistry.get("calculator.failures").counter().count()).isEqualTo(3.0);
            assertThat(engine.getCalculationSummary(forecast).getCalculatorFailures()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("category breakdown splits revenue, expenses, summary and growth per month")
        void byCategory() {
            loadMixedEntities();
            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

            CategoryBreakdown breakdown = engine.aggregateByCategory(forecast);

            assertThat(breakdown.getRevenue()).hasSize(12);
            assertThat(breakdown.getRevenue().get(0).getValues())
                    .containsKeys("grant_revenue", "sales_revenue", "total_revenue")
                    .doesNotContainKey("employee_costs");
            assertThat(breakdown.getExpenses().get(0).value("total_expenses"))
                    .isEqualTo(forecast.row(0).getTotalExpenses());
            assertThat(breakdown.getSummary().get(11).value("cash_balance"))
                    .isEqualTo(forecast.finalCashBalance());
            assertThat(breakdown.getGrowth().get(4).value("revenue_growth_rate"))
                    .isEqualTo(forecast.row(4).getRevenueGrowthRate());
        }

        @Test
        @DisplayName("months are counted positive or negative by net cash flow")
        void summaryMonthCounts() {
            store.add(facility("Office", 1_000));
            store.add(Sale.builder().name("Deal").amount(3_000).startDate(LocalDate.of(2024, 2, 1)).build());
            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, LocalDate.of(2024, 3, 31));

            CalculationSummary summary = engine.getCalculationSummary(forecast);

            assertThat(summary.getMonthsCashPositive()).isEqualTo(1);
            assertThat(summary.getMonthsCashNegative()).isEqualTo(2);
            assertThat(summary.getAverageMonthlyBurn()).isCloseTo(0.0, within(1e-6));
        }

        @Test
        @DisplayName("summary totals agree with the rows")
        void summary() {
            config.setStartingCash(50_000);
            store.add(employee("Alice", 60_000, JAN_2024));
            store.add(facility("Office", 5_000));
            CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

            CalculationSummary summary = engine.getCalculationSummary(forecast);

            assertThat(summary.getPeriods()).isEqualTo(12);
            assertThat(summary.getTotalExpenses()).isCloseTo(120_000.0, within(1e-6));
            assertThat(summary.getNetCashFlow()).isCloseTo(-120_000.0, within(1e-6));
            assertThat(summary.getAverageMonthlyExpenses()).isCloseTo(10_000.0, within(1e-6));
            assertThat(summary.getMinimumCashBalance()).isCloseTo(-70_000.0, within(1e-6));
            assertThat(summary.getAverageMonthlyBurn()).isCloseTo(10_000.0, within(1e-6));
            // Balance stays positive for four months, but every month burns cash
            assertThat(summary.getMonthsCashPositive()).isZero();
            assertThat(summary.getMonthsCashNegative()).isEqualTo(12);
            assertThat(summary.getPeakEmployees()).isEqualTo(1);
        }
    }
}
