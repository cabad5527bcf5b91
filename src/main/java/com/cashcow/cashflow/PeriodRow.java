package com.cashcow.cashflow;

import com.cashcow.domain.enums.CashFlowCategory;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One calendar month of the forecast.
 *
 * <p>{@code netCashFlow = totalRevenue - totalExpenses}; {@code cashBalance} is the starting
 * cash plus the running sum of net cash flow up to and including this month. Growth rates and
 * percentages are in percent and are 0 when their base is 0.
 */
@Value
@Builder
public class PeriodRow {

    LocalDate period;
    Map<CashFlowCategory, Double> categories;
    double totalRevenue;
    double totalExpenses;
    double netCashFlow;
    double cumulativeCashFlow;
    double cashBalance;
    int activeEmployees;
    int activeProjects;
    double revenueGrowthRate;
    double expenseGrowthRate;
    double revenuePerEmployee;
    double costPerEmployee;
    double employeeCostPercentage;
    double facilityCostPercentage;
    double projectCostPercentage;

    public double category(CashFlowCategory category) {
        return categories.getOrDefault(category, 0.0);
    }

    /** Column name to value, category columns first, for reporting. */
    public Map<String, Object> asColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("period", period);
        for (CashFlowCategory category : CashFlowCategory.values()) {
            columns.put(category.getColumn(), category(category));
        }
        columns.put("total_revenue", totalRevenue);
        columns.put("total_expenses", totalExpenses);
        columns.put("net_cash_flow", netCashFlow);
        columns.put("cumulative_cash_flow", cumulativeCashFlow);
        columns.put("cash_balance", cashBalance);
        columns.put("active_employees", activeEmployees);
        columns.put("active_projects", activeProjects);
        columns.put("revenue_growth_rate", revenueGrowthRate);
        columns.put("expense_growth_rate", expenseGrowthRate);
        columns.put("revenue_per_employee", revenuePerEmployee);
        columns.put("cost_per_employee", costPerEmployee);
        columns.put("employee_cost_percentage", employeeCostPercentage);
        columns.put("facility_cost_percentage", facilityCostPercentage);
        columns.put("project_cost_percentage", projectCostPercentage);
        return columns;
    }
}
