package com.cashcow.kpi;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Every metric {@link KpiCalculator} derives from a period table, in report order.
 */
@Getter
@RequiredArgsConstructor
public enum Kpi {
    RUNWAY_MONTHS("runway_months", KpiGroup.FINANCIAL),
    BURN_RATE("burn_rate", KpiGroup.FINANCIAL),
    CURRENT_BURN_RATE("current_burn_rate", KpiGroup.FINANCIAL),
    CASH_EFFICIENCY("cash_efficiency", KpiGroup.FINANCIAL),
    MONTHS_TO_BREAKEVEN("months_to_breakeven", KpiGroup.FINANCIAL),
    CASH_FLOW_VOLATILITY("cash_flow_volatility", KpiGroup.FINANCIAL),
    WORKING_CAPITAL("working_capital", KpiGroup.FINANCIAL),

    REVENUE_GROWTH_RATE("revenue_growth_rate", KpiGroup.GROWTH),
    REVENUE_TREND("revenue_trend", KpiGroup.GROWTH),
    AVERAGE_DEAL_SIZE("average_deal_size", KpiGroup.GROWTH),
    REVENUE_DIVERSIFICATION("revenue_diversification", KpiGroup.GROWTH),

    AVERAGE_TEAM_SIZE("average_team_size", KpiGroup.OPERATIONAL),
    PEAK_TEAM_SIZE("peak_team_size", KpiGroup.OPERATIONAL),
    TEAM_GROWTH_RATE("team_growth_rate", KpiGroup.OPERATIONAL),
    AVERAGE_ACTIVE_PROJECTS("average_active_projects", KpiGroup.OPERATIONAL),
    PEAK_ACTIVE_PROJECTS("peak_active_projects", KpiGroup.OPERATIONAL),
    RD_PERCENTAGE("rd_percentage", KpiGroup.OPERATIONAL),
    FACILITY_COST_PERCENTAGE("facility_cost_percentage", KpiGroup.OPERATIONAL),
    TECHNOLOGY_COST_PERCENTAGE("technology_cost_percentage", KpiGroup.OPERATIONAL),

    REVENUE_PER_EMPLOYEE("revenue_per_employee", KpiGroup.EFFICIENCY),
    COST_PER_EMPLOYEE("cost_per_employee", KpiGroup.EFFICIENCY),
    EMPLOYEE_COST_EFFICIENCY("employee_cost_efficiency", KpiGroup.EFFICIENCY),
    PROJECT_COST_RATIO("project_cost_ratio", KpiGroup.EFFICIENCY),
    OPERATING_LEVERAGE("operating_leverage", KpiGroup.EFFICIENCY),

    CASH_FLOW_RISK("cash_flow_risk", KpiGroup.RISK),
    REVENUE_CONCENTRATION_RISK("revenue_concentration_risk", KpiGroup.RISK),
    COST_FLEXIBILITY("cost_flexibility", KpiGroup.RISK),
    FUNDING_DEPENDENCY("funding_dependency", KpiGroup.RISK);

    private final String key;
    private final KpiGroup group;
}
