package com.cashcow.kpi;

import com.cashcow.cashflow.PeriodRow;
import com.cashcow.domain.enums.AlertLevel;
import com.cashcow.domain.enums.CashFlowCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Derives summary metrics from a forecast's period rows.
 *
 * <p>A pure function of the rows and a starting cash balance: no entity access, no state.
 * Cash balances are recomputed as {@code startingCash + cumulativeCashFlow}, so the same rows
 * can be evaluated against different opening balances.
 *
 * <p>Every ratio is guarded: a zero denominator yields 0.0 and NaN is never returned.
 * Runway and months to breakeven are the only KPIs that may be infinite.
 */
@Component
@EnableConfigurationProperties(KpiConfig.class)
public class KpiCalculator {

    private static final Logger log = LoggerFactory.getLogger(KpiCalculator.class);

    private final KpiConfig config;

    public KpiCalculator(KpiConfig config) {
        this.config = config;
    }

    public KpiReport calculateAllKpis(List<PeriodRow> rows, double startingCash) {
        Map<Kpi, Double> kpis = new EnumMap<>(Kpi.class);
        if (rows.isEmpty()) {
            for (Kpi kpi : Kpi.values()) {
                kpis.put(kpi, 0.0);
            }
            kpis.put(Kpi.WORKING_CAPITAL, startingCash);
            return new KpiReport(kpis);
        }

        Columns columns = new Columns(rows, startingCash);
        putFinancial(kpis, columns, startingCash);
        putGrowth(kpis, columns);
        putOperational(kpis, columns);
        putEfficiency(kpis, columns, rows);
        putRisk(kpis, columns);

        log.debug(
                "Calculated {} KPIs over {} periods: runway {} months, burn {}",
                kpis.size(),
                rows.size(),
                kpis.get(Kpi.RUNWAY_MONTHS),
                kpis.get(Kpi.BURN_RATE));
        return new KpiReport(kpis);
    }

    /**
     * Threshold-based advisories, most severe first within each metric. Side-effect free.
     */
    public List<KpiAlert> getKpiAlerts(KpiReport kpis) {
        List<KpiAlert> alerts = new ArrayList<>();

        double runway = kpis.get(Kpi.RUNWAY_MONTHS);
        if (runway < config.getRunwayCriticalMonths()) {
            alerts.add(KpiAlert.builder()
                    .level(AlertLevel.CRITICAL)
                    .metric(Kpi.RUNWAY_MONTHS)
                    .message(String.format("Critical: only %.1f months of runway remaining", runway))
                    .recommendation("Immediate action required to reduce burn or raise funding")
                    .build());
        } else if (runway < config.getRunwayWarningMonths()) {
            alerts.add(KpiAlert.builder()
                    .level(AlertLevel.WARNING)
                    .metric(Kpi.RUNWAY_MONTHS)
                    .message(String.format("Warning: %.1f months of runway remaining", runway))
                    .recommendation("Begin fundraising or cost reduction planning")
                    .build());
        }

        double burnRate = kpis.get(Kpi.BURN_RATE);
        if (burnRate > config.getBurnRateWarning()) {
            alerts.add(KpiAlert.builder()
                    .level(AlertLevel.WARNING)
                    .metric(Kpi.BURN_RATE)
                    .message(String.format("High burn rate: %,.0f per month", burnRate))
                    .recommendation("Review cost structure and hiring plans")
                    .build());
        }

        double concentration = kpis.get(Kpi.REVENUE_CONCENTRATION_RISK);
        if (concentration > config.getRevenueConcentrationWarning()) {
            alerts.add(KpiAlert.builder()
                    .level(AlertLevel.WARNING)
                    .metric(Kpi.REVENUE_CONCENTRATION_RISK)
                    .message(String.format("High revenue concentration: %.1f%%", concentration * 100.0))
                    .recommendation("Diversify revenue sources to reduce risk")
                    .build());
        }

        double volatility = kpis.get(Kpi.CASH_FLOW_RISK);
        if (volatility > config.getCashFlowRiskInfo()) {
            alerts.add(KpiAlert.builder()
                    .level(AlertLevel.INFO)
                    .metric(Kpi.CASH_FLOW_RISK)
                    .message(String.format("High cash flow volatility: %.1f", volatility))
                    .recommendation("Consider smoothing revenue or expense timing")
                    .build());
        }
        return alerts;
    }

    /**
     * Rolling means and window-over-window growth for each month.
     *
     * @throws IllegalArgumentException if {@code window} is less than 1
     */
    public List<KpiTrendPoint> calculateKpiTrends(List<PeriodRow> rows, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1, got " + window);
        }
        List<KpiTrendPoint> trends = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            int from = Math.max(0, i - window + 1);
            List<PeriodRow> slice = rows.subList(from, i + 1);
            PeriodRow current = rows.get(i);
            PeriodRow earlier = i >= window ? rows.get(i - window) : null;
            trends.add(KpiTrendPoint.builder()
                    .period(current.getPeriod())
                    .fullWindow(slice.size() == window)
                    .revenueTrend(mean(slice, PeriodRow::getTotalRevenue))
                    .expenseTrend(mean(slice, PeriodRow::getTotalExpenses))
                    .burnTrend(mean(slice, row -> -row.getNetCashFlow()))
                    .revenueWindowGrowth(earlier == null
                            ? 0.0
                            : percentChange(earlier.getTotalRevenue(), current.getTotalRevenue()))
                    .expenseWindowGrowth(earlier == null
                            ? 0.0
                            : percentChange(earlier.getTotalExpenses(), current.getTotalExpenses()))
                    .efficiencyTrend(mean(slice, row -> row.getTotalRevenue() / Math.max(row.getActiveEmployees(), 1)))
                    .build());
        }
        return trends;
    }

    // ---- groups ----

    private void putFinancial(Map<Kpi, Double> kpis, Columns c, double startingCash) {
        kpis.put(Kpi.RUNWAY_MONTHS, runway(c, startingCash));
        kpis.put(Kpi.BURN_RATE, trailingBurn(c));
        kpis.put(Kpi.CURRENT_BURN_RATE, Math.abs(Math.min(0.0, c.net[c.n - 1])));

        double consumed = 0.0;
        for (double net : c.net) {
            if (net < 0) {
                consumed -= net;
            }
        }
        kpis.put(Kpi.CASH_EFFICIENCY, ratio(c.totalRevenue, consumed));
        kpis.put(Kpi.MONTHS_TO_BREAKEVEN, breakeven(c));
        kpis.put(Kpi.CASH_FLOW_VOLATILITY, finite(new DescriptiveStatistics(c.net).getStandardDeviation()));
        kpis.put(Kpi.WORKING_CAPITAL, c.balance[c.n - 1]);
    }

    private void putGrowth(Map<Kpi, Double> kpis, Columns c) {
        kpis.put(Kpi.REVENUE_GROWTH_RATE, c.n < 2 ? 0.0 : percentChange(c.revenue[c.n - 2], c.revenue[c.n - 1]));

        double trend = 0.0;
        if (c.n >= 3) {
            SimpleRegression regression = new SimpleRegression();
            for (int i = 0; i < c.n; i++) {
                regression.addData(i, c.revenue[i]);
            }
            trend = finite(regression.getSlope());
        }
        kpis.put(Kpi.REVENUE_TREND, trend);

        kpis.put(Kpi.AVERAGE_DEAL_SIZE, c.categoryTotal(CashFlowCategory.SALES_REVENUE) / c.n);

        double sourceTotal = c.revenueSourceTotal();
        double diversification = 0.0;
        if (sourceTotal > 0) {
            double herfindahl = 0.0;
            for (CashFlowCategory source : CashFlowCategory.revenueCategories()) {
                double share = c.categoryTotal(source) / sourceTotal;
                herfindahl += share * share;
            }
            diversification = 1.0 - herfindahl;
        }
        kpis.put(Kpi.REVENUE_DIVERSIFICATION, diversification);
    }

    private void putOperational(Map<Kpi, Double> kpis, Columns c) {
        DescriptiveStatistics team = new DescriptiveStatistics(c.employees);
        DescriptiveStatistics projects = new DescriptiveStatistics(c.projects);
        kpis.put(Kpi.AVERAGE_TEAM_SIZE, finite(team.getMean()));
        kpis.put(Kpi.PEAK_TEAM_SIZE, finite(team.getMax()));
        kpis.put(Kpi.TEAM_GROWTH_RATE, compoundGrowth(c.employees[0], c.employees[c.n - 1], c.n - 1));
        kpis.put(Kpi.AVERAGE_ACTIVE_PROJECTS, finite(projects.getMean()));
        kpis.put(Kpi.PEAK_ACTIVE_PROJECTS, finite(projects.getMax()));

        double projectCosts = c.categoryTotal(CashFlowCategory.PROJECT_COSTS);
        double technology = c.categoryTotal(CashFlowCategory.SOFTWARE_COSTS)
                + c.categoryTotal(CashFlowCategory.EQUIPMENT_COSTS);
        kpis.put(Kpi.RD_PERCENTAGE, ratio(projectCosts, c.totalExpenses) * 100.0);
        kpis.put(
                Kpi.FACILITY_COST_PERCENTAGE,
                ratio(c.categoryTotal(CashFlowCategory.FACILITY_COSTS), c.totalExpenses) * 100.0);
        kpis.put(Kpi.TECHNOLOGY_COST_PERCENTAGE, ratio(technology, c.totalExpenses) * 100.0);
    }

    private void putEfficiency(Map<Kpi, Double> kpis, Columns c, List<PeriodRow> rows) {
        kpis.put(Kpi.REVENUE_PER_EMPLOYEE, mean(rows, PeriodRow::getRevenuePerEmployee));
        kpis.put(Kpi.COST_PER_EMPLOYEE, mean(rows, PeriodRow::getCostPerEmployee));
        kpis.put(
                Kpi.EMPLOYEE_COST_EFFICIENCY,
                ratio(c.totalRevenue, c.categoryTotal(CashFlowCategory.EMPLOYEE_COSTS)));
        kpis.put(Kpi.PROJECT_COST_RATIO, ratio(c.categoryTotal(CashFlowCategory.PROJECT_COSTS), c.totalExpenses));

        double leverage = 0.0;
        if (c.n >= 2) {
            double revenueChange = meanFractionalChange(c.revenue);
            double expenseChange = meanFractionalChange(c.expenses);
            leverage = ratio(revenueChange, expenseChange);
        }
        kpis.put(Kpi.OPERATING_LEVERAGE, leverage);
    }

    private void putRisk(Map<Kpi, Double> kpis, Columns c) {
        DescriptiveStatistics net = new DescriptiveStatistics(c.net);
        kpis.put(Kpi.CASH_FLOW_RISK, ratio(finite(net.getStandardDeviation()), Math.abs(finite(net.getMean()))));

        double sourceTotal = c.revenueSourceTotal();
        double largest = 0.0;
        for (CashFlowCategory source : CashFlowCategory.revenueCategories()) {
            largest = Math.max(largest, c.categoryTotal(source));
        }
        kpis.put(Kpi.REVENUE_CONCENTRATION_RISK, ratio(largest, sourceTotal));

        double fixed = c.categoryTotal(CashFlowCategory.EMPLOYEE_COSTS)
                + c.categoryTotal(CashFlowCategory.FACILITY_COSTS);
        kpis.put(Kpi.COST_FLEXIBILITY, c.totalExpenses > 0 ? 1.0 - fixed / c.totalExpenses : 0.0);

        double external = c.categoryTotal(CashFlowCategory.GRANT_REVENUE)
                + c.categoryTotal(CashFlowCategory.INVESTMENT_REVENUE);
        kpis.put(Kpi.FUNDING_DEPENDENCY, ratio(external, c.totalRevenue));
    }

    // ---- runway and breakeven ----

    /**
     * Months until cash runs out. When the balance crosses zero inside the table through a
     * negative month, the crossing is interpolated within that month. Otherwise the final
     * balance is divided by the magnitude of the trailing mean net flow; a non-negative trailing
     * net flow means infinite runway.
     *
     * <p>The divisor is not {@code burn_rate}: that KPI averages only the months that burned
     * cash, so a trailing window of -10k, +30k, -10k reports a 10k burn rate with infinite
     * runway.
     */
    private double runway(Columns c, double startingCash) {
        double previousBalance = startingCash;
        for (int i = 0; i < c.n; i++) {
            if (c.balance[i] <= 0 && c.net[i] < 0) {
                return i + Math.max(0.0, previousBalance) / Math.abs(c.net[i]);
            }
            previousBalance = c.balance[i];
        }
        double trailingNet = trailingMeanNet(c);
        if (trailingNet >= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, c.balance[c.n - 1] / Math.abs(trailingNet));
    }

    private double breakeven(Columns c) {
        for (int i = 0; i < c.n; i++) {
            if (c.cumulative[i] >= 0) {
                return i + 1;
            }
        }
        double trailingNet = trailingMeanNet(c);
        if (c.n < 2 || trailingNet <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return c.n + Math.abs(c.cumulative[c.n - 1]) / trailingNet;
    }

    /** Mean magnitude of the negative months within the trailing window; 0 if none. */
    private double trailingBurn(Columns c) {
        int from = Math.max(0, c.n - trailingWindow());
        double sum = 0.0;
        int count = 0;
        for (int i = from; i < c.n; i++) {
            if (c.net[i] < 0) {
                sum += -c.net[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private double trailingMeanNet(Columns c) {
        int from = Math.max(0, c.n - trailingWindow());
        double sum = 0.0;
        for (int i = from; i < c.n; i++) {
            sum += c.net[i];
        }
        return sum / (c.n - from);
    }

    private int trailingWindow() {
        return Math.max(1, config.getTrailingWindowMonths());
    }

    // ---- helpers ----

    private static double meanFractionalChange(double[] series) {
        double sum = 0.0;
        for (int i = 1; i < series.length; i++) {
            sum += series[i - 1] == 0.0 ? 0.0 : (series[i] - series[i - 1]) / series[i - 1];
        }
        return sum / series.length;
    }

    private static double compoundGrowth(double start, double end, int periods) {
        if (periods <= 0 || start <= 0 || end < 0) {
            return 0.0;
        }
        return finite((Math.pow(end / start, 1.0 / periods) - 1.0) * 100.0);
    }

    private static double mean(List<PeriodRow> rows, ToDoubleFunction<PeriodRow> column) {
        if (rows.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (PeriodRow row : rows) {
            sum += column.applyAsDouble(row);
        }
        return sum / rows.size();
    }

    static double percentChange(double base, double current) {
        return base == 0.0 ? 0.0 : (current - base) / Math.abs(base) * 100.0;
    }

    static double ratio(double numerator, double denominator) {
        return denominator == 0.0 ? 0.0 : finite(numerator / denominator);
    }

    private static double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
    }

    /** Column arrays extracted once from the rows. */
    private static final class Columns {

        final int n;
        final double[] revenue;
        final double[] expenses;
        final double[] net;
        final double[] cumulative;
        final double[] balance;
        final double[] employees;
        final double[] projects;
        final Map<CashFlowCategory, Double> categoryTotals = new EnumMap<>(CashFlowCategory.class);
        final double totalRevenue;
        final double totalExpenses;

        Columns(List<PeriodRow> rows, double startingCash) {
            n = rows.size();
            revenue = new double[n];
            expenses = new double[n];
            net = new double[n];
            cumulative = new double[n];
            balance = new double[n];
            employees = new double[n];
            projects = new double[n];
            double revenueSum = 0.0;
            double expenseSum = 0.0;
            double running = 0.0;
            for (int i = 0; i < n; i++) {
                PeriodRow row = rows.get(i);
                revenue[i] = row.getTotalRevenue();
                expenses[i] = row.getTotalExpenses();
                net[i] = row.getNetCashFlow();
                running += net[i];
                cumulative[i] = running;
                balance[i] = startingCash + running;
                employees[i] = row.getActiveEmployees();
                projects[i] = row.getActiveProjects();
                revenueSum += revenue[i];
                expenseSum += expenses[i];
                for (CashFlowCategory category : CashFlowCategory.values()) {
                    categoryTotals.merge(category, row.category(category), Double::sum);
                }
            }
            totalRevenue = revenueSum;
            totalExpenses = expenseSum;
        }

        double categoryTotal(CashFlowCategory category) {
            return categoryTotals.getOrDefault(category, 0.0);
        }

        double revenueSourceTotal() {
            double total = 0.0;
            for (CashFlowCategory source : CashFlowCategory.revenueCategories()) {
                total += categoryTotal(source);
            }
            return total;
        }
    }
}
