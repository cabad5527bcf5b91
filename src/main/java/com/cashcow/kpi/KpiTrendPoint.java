package com.cashcow.kpi;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Rolling view of one month. Means cover the window ending at this month, or fewer months
 * at the start of the table ({@code fullWindow} is false there). Window growth compares with
 * the month one window earlier and is 0 without such a month or when its value is 0.
 */
@Value
@Builder
public class KpiTrendPoint {

    LocalDate period;
    boolean fullWindow;
    double revenueTrend;
    double expenseTrend;
    double burnTrend;
    double revenueWindowGrowth;
    double expenseWindowGrowth;
    double efficiencyTrend;
}
