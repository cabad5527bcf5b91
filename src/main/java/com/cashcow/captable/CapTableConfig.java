package com.cashcow.captable;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "cashcow.captable")
public class CapTableConfig {

    /** When true, summaries are refused for cap tables with validation errors. */
    private boolean strictValidation = false;

    /** Utilization above this fraction of authorized shares is reported as a warning. */
    private double highUtilizationWarning = 0.95;
}
