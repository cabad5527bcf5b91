package com.cashcow.cashflow;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CalculationSummary {

    int periods;
    double totalRevenue;
    double totalExpenses;
    double netCashFlow;
    double averageMonthlyRevenue;
    double averageMonthlyExpenses;

    /** Mean of expenses minus revenue per month; negative when the period is cash generating. */
    double averageMonthlyBurn;

    double finalCashBalance;
    double minimumCashBalance;
    int peakEmployees;
    int peakProjects;

    /** Months with a strictly positive net cash flow. Break-even months count as neither. */
    int monthsCashPositive;

    int monthsCashNegative;
    int calculatorFailures;
}
