package com.cashcow.scenario;

import lombok.Builder;
import lombok.Value;

/**
 * One line of a scenario comparison.
 */
@Value
@Builder
public class ScenarioSummary {

    String scenario;
    double totalRevenue;
    double totalExpenses;
    double netCashFlow;
    double finalCashBalance;
    double averageMonthlyBurn;

    /** Months with a positive net cash flow. */
    int monthsCashPositive;

    int peakEmployees;
    double peakMonthlyRevenue;
    double peakMonthlyExpenses;
}
