package com.cashcow.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.calculator.builtin.BuiltinCalculators;
import com.cashcow.captable.CapTableCalculator;
import com.cashcow.captable.CapTableCalculators;
import com.cashcow.captable.CapTableConfig;
import com.cashcow.captable.CapTableSummary;
import com.cashcow.captable.CapTableValidator;
import com.cashcow.cashflow.CashFlowEngine;
import com.cashcow.cashflow.CashFlowEngineConfig;
import com.cashcow.cashflow.CashFlowForecast;
import com.cashcow.cashflow.PeriodRow;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.ShareholderType;
import com.cashcow.domain.model.Employee;
import com.cashcow.domain.model.Facility;
import com.cashcow.domain.model.Grant;
import com.cashcow.domain.model.ShareClass;
import com.cashcow.domain.model.Shareholder;
import com.cashcow.kpi.Kpi;
import com.cashcow.kpi.KpiAlert;
import com.cashcow.kpi.KpiCalculator;
import com.cashcow.kpi.KpiConfig;
import com.cashcow.kpi.KpiReport;
import com.cashcow.observability.ForecastMetrics;
import com.cashcow.scenario.ScenarioConfig;
import com.cashcow.scenario.ScenarioManager;
import com.cashcow.scenario.ScenarioSummary;
import com.cashcow.scenario.ScenarioYamlRepository;
import com.cashcow.store.EntityFilter;
import com.cashcow.store.EntityStore;
import com.cashcow.store.InMemoryEntityStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Cross-service integration test for a full forecasting run.
 * Wires the real calculator registry (built-in and cap-table calculators), CashFlowEngine,
 * ScenarioManager, KpiCalculator and CapTableCalculator together over a mocked entity store
 * to verify: store -> per-month calculators -> period rows -> KPIs, scenario comparison,
 * and cap-table reporting over the same entity set.
 */
@ExtendWith(MockitoExtension.class)
class ForecastPipelineIntegrationTest {

    private static final LocalDate JAN_2024 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DEC_2024 = LocalDate.of(2024, 12, 31);

    @Mock
    private EntityStore entityStore;

    private InMemoryEntityStore backing;
    private CashFlowEngine engine;
    private ScenarioManager scenarioManager;
    private KpiCalculator kpiCalculator;
    private CapTableCalculator capTableCalculator;

    @BeforeEach
    void setUp() {
        backing = InMemoryEntityStore.of(List.of(
                Employee.builder().name("Alice").salary(120_000).startDate(JAN_2024).build(),
                Facility.builder().name("Lab").monthlyCost(5_000).startDate(JAN_2024).endDate(DEC_2024).build(),
                Grant.builder().name("NSF SBIR").amount(240_000).startDate(JAN_2024).endDate(DEC_2024).build(),
                ShareClass.builder().name("Common").className("common")
                        .sharesAuthorized(10_000_000).sharesIssued(6_000_000).startDate(JAN_2024).build(),
                Shareholder.builder().name("Alice").shareholderType(ShareholderType.FOUNDER)
                        .totalShares(6_000_000).shareClass("common").boardSeats(1).startDate(JAN_2024).build()));
        lenient().when(entityStore.query(any(EntityFilter.class)))
                .thenAnswer(invocation -> backing.query(invocation.getArgument(0)));
        lenient().when(entityStore.findAll()).thenAnswer(invocation -> backing.findAll());

        CapTableConfig capTableConfig = new CapTableConfig();
        capTableCalculator = new CapTableCalculator(capTableConfig, new CapTableValidator(capTableConfig));
        CalculatorRegistry registry = BuiltinCalculators.registerAll(new CalculatorRegistry());
        CapTableCalculators.register(registry, capTableCalculator);
        registry.validateAll();

        CashFlowEngineConfig engineConfig = new CashFlowEngineConfig();
        engineConfig.setStartingCash(100_000);
        engine = new CashFlowEngine(registry, entityStore, engineConfig, new ForecastMetrics(new SimpleMeterRegistry()));
        scenarioManager = new ScenarioManager(entityStore, engine, new ScenarioYamlRepository(), new ScenarioConfig());
        scenarioManager.initialize();
        kpiCalculator = new KpiCalculator(new KpiConfig());
    }

    @Test
    @DisplayName("forecast queries the store once per month and cap-table entities add no cash flow")
    void forecastFromStore() {
        CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

        verify(entityStore, times(12)).query(any(EntityFilter.class));
        assertThat(forecast.getDiagnostics()).isEmpty();
        for (PeriodRow row : forecast.getRows()) {
            assertThat(row.getTotalExpenses()).isCloseTo(15_000.0, within(1e-9));
            assertThat(row.category(CashFlowCategory.GRANT_REVENUE)).isCloseTo(20_000.0, within(1e-9));
            assertThat(row.getActiveEmployees()).isEqualTo(1);
        }
        assertThat(forecast.finalCashBalance()).isCloseTo(160_000.0, within(1e-6));
    }

    @Test
    @DisplayName("KPIs derived from the forecast reflect a funded, cash-positive plan")
    void kpisFromForecast() {
        CashFlowForecast forecast = engine.calculatePeriod(JAN_2024, DEC_2024);

        KpiReport kpis = kpiCalculator.calculateAllKpis(forecast.getRows(), forecast.getStartingCash());

        assertThat(kpis.isInfinite(Kpi.RUNWAY_MONTHS)).isTrue();
        assertThat(kpis.get(Kpi.BURN_RATE)).isZero();
        assertThat(kpis.get(Kpi.WORKING_CAPITAL)).isCloseTo(160_000.0, within(1e-6));
        assertThat(kpis.get(Kpi.FUNDING_DEPENDENCY)).isEqualTo(1.0);
        assertThat(kpiCalculator.getKpiAlerts(kpis))
                .extracting(KpiAlert::getMetric)
                .containsExactly(Kpi.REVENUE_CONCENTRATION_RISK);
    }

    @Test
    @DisplayName("conservative scenario trims grant revenue, delays the hire and loads overhead")
    void scenarioComparison() {
        Map<String, CashFlowForecast> results =
                scenarioManager.compareScenarios(List.of("baseline", "conservative"), JAN_2024, DEC_2024);

        CashFlowForecast baseline = results.get("baseline");
        CashFlowForecast conservative = results.get("conservative");
        assertThat(conservative.row(0).category(CashFlowCategory.GRANT_REVENUE)).isCloseTo(18_000.0, within(1e-9));
        assertThat(conservative.row(0).getActiveEmployees()).isZero();
        assertThat(conservative.row(2).category(CashFlowCategory.EMPLOYEE_COSTS)).isCloseTo(14_000.0, within(1e-9));
        assertThat(baseline.row(2).category(CashFlowCategory.EMPLOYEE_COSTS)).isCloseTo(10_000.0, within(1e-9));

        List<ScenarioSummary> summaries = scenarioManager.createScenarioSummary(results);
        assertThat(summaries).extracting(ScenarioSummary::getScenario).containsExactly("baseline", "conservative");
        assertThat(summaries.get(1).getTotalRevenue()).isLessThan(summaries.get(0).getTotalRevenue());
    }

    @Test
    @DisplayName("cap-table summary over the same entities the forecast used")
    void capTable() {
        CapTableSummary summary = capTableCalculator.generateCapTableSummary(backing.findAll(), null);

        assertThat(summary.getFullyDilutedShares()).isEqualTo(10_000_000L);
        assertThat(summary.getOwnershipByShareholder()).containsEntry("Alice", 0.6);
        assertThat(summary.getVotingControl()).containsEntry("Alice", 1.0);
        assertThat(summary.getFounderOwnership()).isEqualTo(0.6);
    }
}
