package com.cashcow.domain.enums;

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Breakdown columns of a period row. A calculator declares at most one category at
 * registration; its result is summed into that column and, through the column's kind,
 * into total revenue or total expenses.
 *
 * <p>Declaration order is the summation order, which keeps totals bit-identical across
 * execution strategies.
 */
@Getter
@RequiredArgsConstructor
public enum CashFlowCategory {
    EMPLOYEE_COSTS("employee_costs", CategoryKind.EXPENSE),
    FACILITY_COSTS("facility_costs", CategoryKind.EXPENSE),
    SOFTWARE_COSTS("software_costs", CategoryKind.EXPENSE),
    EQUIPMENT_COSTS("equipment_costs", CategoryKind.EXPENSE),
    PROJECT_COSTS("project_costs", CategoryKind.EXPENSE),
    GRANT_REVENUE("grant_revenue", CategoryKind.REVENUE),
    INVESTMENT_REVENUE("investment_revenue", CategoryKind.REVENUE),
    SALES_REVENUE("sales_revenue", CategoryKind.REVENUE),
    SERVICE_REVENUE("service_revenue", CategoryKind.REVENUE);

    private final String column;
    private final CategoryKind kind;

    public boolean isRevenue() {
        return kind == CategoryKind.REVENUE;
    }

    public static List<CashFlowCategory> revenueCategories() {
        return Arrays.stream(values()).filter(CashFlowCategory::isRevenue).toList();
    }

    public static List<CashFlowCategory> expenseCategories() {
        return Arrays.stream(values()).filter(c -> !c.isRevenue()).toList();
    }
}
