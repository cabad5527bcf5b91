package com.cashcow.kpi;

public enum KpiGroup {
    FINANCIAL,
    GROWTH,
    OPERATIONAL,
    EFFICIENCY,
    RISK
}
