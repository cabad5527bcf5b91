package com.cashcow.kpi;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the KpiCalculator under the {@code cashcow.kpi} prefix.
 *
 * <ul>
 *   <li>{@code trailingWindowMonths} -- months averaged for burn rate and runway</li>
 *   <li>{@code runwayCriticalMonths}, {@code runwayWarningMonths} -- runway alert thresholds</li>
 *   <li>{@code burnRateWarning} -- monthly burn above which a warning is raised</li>
 *   <li>{@code revenueConcentrationWarning} -- share of the largest revenue source that warns</li>
 *   <li>{@code cashFlowRiskInfo} -- coefficient of variation of net cash flow that informs</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cashcow.kpi")
public class KpiConfig {

    private int trailingWindowMonths = 3;
    private double runwayCriticalMonths = 3.0;
    private double runwayWarningMonths = 6.0;
    private double burnRateWarning = 100_000.0;
    private double revenueConcentrationWarning = 0.8;
    private double cashFlowRiskInfo = 2.0;
}
