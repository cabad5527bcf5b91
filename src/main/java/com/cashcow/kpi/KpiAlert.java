package com.cashcow.kpi;

import com.cashcow.domain.enums.AlertLevel;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KpiAlert {

    AlertLevel level;
    Kpi metric;
    String message;
    String recommendation;
}
