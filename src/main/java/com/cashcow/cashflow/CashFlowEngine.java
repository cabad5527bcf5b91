package com.cashcow.cashflow;

import com.cashcow.calculator.CalculationContext;
import com.cashcow.calculator.CalculationDiagnostic;
import com.cashcow.calculator.CalculatorRegistration;
import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.calculator.EntityCalculationResult;
import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.model.Employee;
import com.cashcow.domain.model.Entity;
import com.cashcow.domain.model.Project;
import com.cashcow.exception.CalculationException;
import com.cashcow.exception.InvalidDateRangeException;
import com.cashcow.observability.ForecastMetrics;
import com.cashcow.store.EntityFilter;
import com.cashcow.store.EntityStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Month-by-month cash flow forecast over the entity store.
 *
 * <p>For every calendar month in the range the engine queries the entities active on the
 * month start, runs every calculator of each entity through the {@link CalculatorRegistry},
 * and sums categorized results into the month's revenue and expense columns. Each month
 * is independent. The running cash balance is a prefix sum computed in one sequential pass
 * after all months are gathered, whichever strategy gathered them.
 *
 * <p>Three strategies produce identical forecasts:
 * <ul>
 *   <li>{@link #calculatePeriod}: synchronous, on the calling thread, served from the cache when possible</li>
 *   <li>{@link #calculatePeriodAsync}: a chain of {@link EntityStore#queryAsync} calls in month order</li>
 *   <li>{@link #calculateParallel}: months fanned out to a fixed worker pool and joined in month order</li>
 * </ul>
 *
 * <p>The cache is keyed by (start, end, scenario), has no TTL and is only cleared through
 * {@link #clearCache()}. Concurrent misses on the same key may both compute; the results are
 * identical, so the last write wins harmlessly.
 */
@Service
@EnableConfigurationProperties(CashFlowEngineConfig.class)
public class CashFlowEngine {

    private static final Logger log = LoggerFactory.getLogger(CashFlowEngine.class);

    static final String STARTING_CASH_ASSUMPTION = "starting_cash";

    private final CalculatorRegistry calculatorRegistry;
    private final EntityStore entityStore;
    private final CashFlowEngineConfig config;
    private final ForecastMetrics forecastMetrics;

    /** Caffeine cache: key = (start, end, scenario), value = forecast, size bound only. */
    private final Cache<ForecastCacheKey, CashFlowForecast> forecastCache;

    public CashFlowEngine(
            CalculatorRegistry calculatorRegistry,
            EntityStore entityStore,
            CashFlowEngineConfig config,
            ForecastMetrics forecastMetrics) {
        this.calculatorRegistry = calculatorRegistry;
        this.entityStore = entityStore;
        this.config = config;
        this.forecastMetrics = forecastMetrics;
        this.forecastCache =
                Caffeine.newBuilder().maximumSize(config.getCacheMaxSize()).build();
    }

    public CashFlowForecast calculatePeriod(LocalDate startDate, LocalDate endDate) {
        return calculatePeriod(startDate, endDate, config.getDefaultScenario());
    }

    /**
     * Forecast of the engine's own entity store. Results are cached by (start, end, scenario)
     * until {@link #clearCache()}.
     *
     * @throws InvalidDateRangeException if {@code startDate} is after {@code endDate}
     */
    public CashFlowForecast calculatePeriod(LocalDate startDate, LocalDate endDate, String scenario) {
        validateRange(startDate, endDate);
        ForecastCacheKey key = new ForecastCacheKey(startDate, endDate, scenario);
        CashFlowForecast cached = forecastCache.getIfPresent(key);
        if (cached != null) {
            log.debug("Forecast cache hit for {} to {} ({})", startDate, endDate, scenario);
            forecastMetrics.recordCacheHit();
            return cached;
        }
        CashFlowForecast forecast = compute(startDate, endDate, scenario, entityStore, Map.of());
        forecastCache.put(key, forecast);
        return forecast;
    }

    /**
     * Forecast over an explicit entity source, with assumptions passed to every calculator as
     * context parameters. The scenario manager runs scenarios through this overload. Never
     * cached: the source and assumptions are not part of the cache key.
     *
     * @throws InvalidDateRangeException if {@code startDate} is after {@code endDate}
     */
    public CashFlowForecast calculatePeriod(
            LocalDate startDate,
            LocalDate endDate,
            String scenario,
            EntityStore source,
            Map<String, Object> assumptions) {
        validateRange(startDate, endDate);
        return compute(startDate, endDate, scenario, source, assumptions);
    }

    private CashFlowForecast compute(
            LocalDate startDate,
            LocalDate endDate,
            String scenario,
            EntityStore source,
            Map<String, Object> assumptions) {
        long started = System.nanoTime();
        List<PeriodTotals> totals = new ArrayList<>();
        for (LocalDate month : MonthMath.monthStarts(startDate, endDate)) {
            List<Entity> active = source.query(EntityFilter.activeOn(month));
            totals.add(calculateMonth(month, active, scenario, assumptions));
        }
        CashFlowForecast forecast = assemble(startDate, endDate, scenario, assumptions, totals);
        finish("sync", forecast, started);
        return forecast;
    }

    public CompletableFuture<CashFlowForecast> calculatePeriodAsync(LocalDate startDate, LocalDate endDate) {
        return calculatePeriodAsync(startDate, endDate, config.getDefaultScenario());
    }

    /**
     * Asynchronous forecast. Suspends only on entity-store queries, which are chained in month
     * order; calculators run synchronously in the completion stage of each query.
     *
     * @throws InvalidDateRangeException immediately, if the range is invalid
     */
    public CompletableFuture<CashFlowForecast> calculatePeriodAsync(
            LocalDate startDate, LocalDate endDate, String scenario) {
        validateRange(startDate, endDate);
        long started = System.nanoTime();
        Map<String, Object> assumptions = Map.of();

        CompletableFuture<List<PeriodTotals>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (LocalDate month : MonthMath.monthStarts(startDate, endDate)) {
            chain = chain.thenCompose(gathered -> entityStore
                    .queryAsync(EntityFilter.activeOn(month))
                    .thenApply(active -> {
                        gathered.add(calculateMonth(month, active, scenario, assumptions));
                        return gathered;
                    }));
        }
        return chain.thenApply(totals -> {
            CashFlowForecast forecast = assemble(startDate, endDate, scenario, assumptions, totals);
            finish("async", forecast, started);
            return forecast;
        });
    }

    public CashFlowForecast calculateParallel(LocalDate startDate, LocalDate endDate) {
        return calculateParallel(startDate, endDate, config.getDefaultScenario(), config.getParallelWorkers());
    }

    public CashFlowForecast calculateParallel(LocalDate startDate, LocalDate endDate, int maxWorkers) {
        return calculateParallel(startDate, endDate, config.getDefaultScenario(), maxWorkers);
    }

    /**
     * Forecast with months computed concurrently on a pool of {@code maxWorkers} threads.
     * Each worker returns its own month totals; the caller reduces them in month order.
     *
     * @throws IllegalArgumentException if {@code maxWorkers} is less than 1
     * @throws InvalidDateRangeException if the range is invalid
     */
    public CashFlowForecast calculateParallel(
            LocalDate startDate, LocalDate endDate, String scenario, int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        validateRange(startDate, endDate);
        long started = System.nanoTime();
        Map<String, Object> assumptions = Map.of();
        List<LocalDate> months = MonthMath.monthStarts(startDate, endDate);

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(maxWorkers, months.size()), new CustomizableThreadFactory("forecast-worker-"));
        try {
            List<CompletableFuture<PeriodTotals>> futures = months.stream()
                    .map(month -> CompletableFuture.supplyAsync(
                            () -> calculateMonth(
                                    month, entityStore.query(EntityFilter.activeOn(month)), scenario, assumptions),
                            pool))
                    .toList();
            List<PeriodTotals> totals =
                    futures.stream().map(CompletableFuture::join).toList();
            CashFlowForecast forecast = assemble(startDate, endDate, scenario, assumptions, totals);
            finish("parallel", forecast, started);
            return forecast;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CalculationException(
                    "Parallel forecast failed: " + e.getMessage(),
                    Map.of("startDate", startDate, "endDate", endDate),
                    e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Regroups a forecast into revenue, expense, summary and growth sub-tables.
     */
    public CategoryBreakdown aggregateByCategory(CashFlowForecast forecast) {
        List<PeriodSlice> revenue = new ArrayList<>();
        List<PeriodSlice> expenses = new ArrayList<>();
        List<PeriodSlice> summary = new ArrayList<>();
        List<PeriodSlice> growth = new ArrayList<>();

        for (PeriodRow row : forecast.getRows()) {
            Map<String, Double> revenueColumns = new LinkedHashMap<>();
            for (CashFlowCategory category : CashFlowCategory.revenueCategories()) {
                revenueColumns.put(category.getColumn(), row.category(category));
            }
            revenueColumns.put("total_revenue", row.getTotalRevenue());
            revenue.add(new PeriodSlice(row.getPeriod(), revenueColumns));

            Map<String, Double> expenseColumns = new LinkedHashMap<>();
            for (CashFlowCategory category : CashFlowCategory.expenseCategories()) {
                expenseColumns.put(category.getColumn(), row.category(category));
            }
            expenseColumns.put("total_expenses", row.getTotalExpenses());
            expenses.add(new PeriodSlice(row.getPeriod(), expenseColumns));

            Map<String, Double> summaryColumns = new LinkedHashMap<>();
            summaryColumns.put("total_revenue", row.getTotalRevenue());
            summaryColumns.put("total_expenses", row.getTotalExpenses());
            summaryColumns.put("net_cash_flow", row.getNetCashFlow());
            summaryColumns.put("cash_balance", row.getCashBalance());
            summary.add(new PeriodSlice(row.getPeriod(), summaryColumns));

            Map<String, Double> growthColumns = new LinkedHashMap<>();
            growthColumns.put("revenue_growth_rate", row.getRevenueGrowthRate());
            growthColumns.put("expense_growth_rate", row.getExpenseGrowthRate());
            growth.add(new PeriodSlice(row.getPeriod(), growthColumns));
        }

        return CategoryBreakdown.builder()
                .revenue(List.copyOf(revenue))
                .expenses(List.copyOf(expenses))
                .summary(List.copyOf(summary))
                .growth(List.copyOf(growth))
                .build();
    }

    public CalculationSummary getCalculationSummary(CashFlowForecast forecast) {
        List<PeriodRow> rows = forecast.getRows();
        double totalRevenue = 0.0;
        double totalExpenses = 0.0;
        double minimumBalance = rows.isEmpty() ? forecast.getStartingCash() : Double.POSITIVE_INFINITY;
        int peakEmployees = 0;
        int peakProjects = 0;
        int positive = 0;
        int negative = 0;
        for (PeriodRow row : rows) {
            totalRevenue += row.getTotalRevenue();
            totalExpenses += row.getTotalExpenses();
            minimumBalance = Math.min(minimumBalance, row.getCashBalance());
            peakEmployees = Math.max(peakEmployees, row.getActiveEmployees());
            peakProjects = Math.max(peakProjects, row.getActiveProjects());
            if (row.getNetCashFlow() > 0) {
                positive++;
            } else if (row.getNetCashFlow() < 0) {
                negative++;
            }
        }
        int periods = rows.size();
        return CalculationSummary.builder()
                .periods(periods)
                .totalRevenue(totalRevenue)
                .totalExpenses(totalExpenses)
                .netCashFlow(totalRevenue - totalExpenses)
                .averageMonthlyRevenue(periods == 0 ? 0.0 : totalRevenue / periods)
                .averageMonthlyExpenses(periods == 0 ? 0.0 : totalExpenses / periods)
                .finalCashBalance(forecast.finalCashBalance())
                .minimumCashBalance(minimumBalance)
                .peakEmployees(peakEmployees)
                .peakProjects(peakProjects)
                .averageMonthlyBurn(periods == 0 ? 0.0 : (totalExpenses - totalRevenue) / periods)
                .monthsCashPositive(positive)
                .monthsCashNegative(negative)
                .calculatorFailures(forecast.getDiagnostics().size())
                .build();
    }

    public void clearCache() {
        forecastCache.invalidateAll();
        log.info("Forecast cache cleared");
    }

    public long cacheSize() {
        forecastCache.cleanUp();
        return forecastCache.estimatedSize();
    }

    public CalculatorRegistry getCalculatorRegistry() {
        return calculatorRegistry;
    }

    // ---- per month ----

    PeriodTotals calculateMonth(
            LocalDate month, List<Entity> active, String scenario, Map<String, Object> assumptions) {
        CalculationContext context =
                CalculationContext.forPeriod(month, MonthMath.endOfMonth(month), scenario, active, assumptions);
        Map<CashFlowCategory, Double> sums = new EnumMap<>(CashFlowCategory.class);
        List<CalculationDiagnostic> diagnostics = new ArrayList<>(0);
        int employees = 0;
        int projects = 0;

        for (Entity entity : active) {
            if (entity instanceof Employee) {
                employees++;
            } else if (entity instanceof Project) {
                projects++;
            }
            EntityCalculationResult result = calculatorRegistry.calculateAll(entity, context);
            diagnostics.addAll(result.getDiagnostics());
            Map<String, CalculatorRegistration<?>> registrations = calculatorRegistry.list(entity.getType());
            for (Map.Entry<String, Double> value : result.getValues().entrySet()) {
                CalculatorRegistration<?> registration = registrations.get(value.getKey());
                if (registration != null && registration.isCashFlow()) {
                    sums.merge(registration.getCategory(), value.getValue(), Double::sum);
                }
            }
        }

        Map<CashFlowCategory, Double> categories = new EnumMap<>(CashFlowCategory.class);
        double revenue = 0.0;
        double expenses = 0.0;
        for (CashFlowCategory category : CashFlowCategory.values()) {
            double amount = sums.getOrDefault(category, 0.0);
            categories.put(category, amount);
            if (category.isRevenue()) {
                revenue += amount;
            } else {
                expenses += amount;
            }
        }
        return new PeriodTotals(month, categories, revenue, expenses, employees, projects, diagnostics);
    }

    // ---- sequential reduction ----

    private CashFlowForecast assemble(
            LocalDate startDate,
            LocalDate endDate,
            String scenario,
            Map<String, Object> assumptions,
            List<PeriodTotals> totals) {
        double startingCash = startingCash(assumptions);
        List<PeriodRow> rows = new ArrayList<>(totals.size());
        List<CalculationDiagnostic> diagnostics = new ArrayList<>();
        double cumulative = 0.0;
        PeriodTotals previous = null;

        for (PeriodTotals month : totals) {
            double net = month.getTotalRevenue() - month.getTotalExpenses();
            cumulative += net;
            double headcount = Math.max(month.getActiveEmployees(), 1);
            double expenses = month.getTotalExpenses();
            rows.add(PeriodRow.builder()
                    .period(month.getPeriod())
                    .categories(month.getCategories())
                    .totalRevenue(month.getTotalRevenue())
                    .totalExpenses(expenses)
                    .netCashFlow(net)
                    .cumulativeCashFlow(cumulative)
                    .cashBalance(startingCash + cumulative)
                    .activeEmployees(month.getActiveEmployees())
                    .activeProjects(month.getActiveProjects())
                    .revenueGrowthRate(previous == null
                            ? 0.0
                            : percentChange(previous.getTotalRevenue(), month.getTotalRevenue()))
                    .expenseGrowthRate(previous == null
                            ? 0.0
                            : percentChange(previous.getTotalExpenses(), month.getTotalExpenses()))
                    .revenuePerEmployee(month.getTotalRevenue() / headcount)
                    .costPerEmployee(expenses / headcount)
                    .employeeCostPercentage(
                            percentOf(month.getCategories().get(CashFlowCategory.EMPLOYEE_COSTS), expenses))
                    .facilityCostPercentage(
                            percentOf(month.getCategories().get(CashFlowCategory.FACILITY_COSTS), expenses))
                    .projectCostPercentage(
                            percentOf(month.getCategories().get(CashFlowCategory.PROJECT_COSTS), expenses))
                    .build());
            diagnostics.addAll(month.getDiagnostics());
            previous = month;
        }

        return CashFlowForecast.builder()
                .startDate(startDate)
                .endDate(endDate)
                .scenario(scenario)
                .startingCash(startingCash)
                .rows(List.copyOf(rows))
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }

    private double startingCash(Map<String, Object> assumptions) {
        Object override = assumptions.get(STARTING_CASH_ASSUMPTION);
        if (override instanceof Number number) {
            return number.doubleValue();
        }
        return config.getStartingCash();
    }

    private void finish(String strategy, CashFlowForecast forecast, long startedNanos) {
        forecastMetrics.recordCalculation(strategy, System.nanoTime() - startedNanos);
        forecastMetrics.recordCalculatorFailures(forecast.getDiagnostics().size());
        log.debug(
                "Computed {} forecast {} to {} ({}): {} months, final balance {}, {} calculator failures",
                strategy,
                forecast.getStartDate(),
                forecast.getEndDate(),
                forecast.getScenario(),
                forecast.size(),
                forecast.finalCashBalance(),
                forecast.getDiagnostics().size());
    }

    private static void validateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            throw new InvalidDateRangeException(startDate, endDate);
        }
    }

    static double percentChange(double base, double current) {
        if (base == 0.0) {
            return 0.0;
        }
        return (current - base) / Math.abs(base) * 100.0;
    }

    static double percentOf(double part, double whole) {
        return whole == 0.0 ? 0.0 : part / whole * 100.0;
    }

    private record ForecastCacheKey(LocalDate startDate, LocalDate endDate, String scenario) {}
}
