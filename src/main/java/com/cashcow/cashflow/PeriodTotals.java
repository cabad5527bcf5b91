package com.cashcow.cashflow;

import com.cashcow.calculator.CalculationDiagnostic;
import com.cashcow.domain.enums.CashFlowCategory;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Independent result of one month: category sums, head counts and diagnostics. Carries no
 * running balance; the prefix sum is computed after all months are gathered.
 */
@Value
class PeriodTotals {

    LocalDate period;
    Map<CashFlowCategory, Double> categories;
    double totalRevenue;
    double totalExpenses;
    int activeEmployees;
    int activeProjects;
    List<CalculationDiagnostic> diagnostics;
}
