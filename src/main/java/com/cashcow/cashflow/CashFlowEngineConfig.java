package com.cashcow.cashflow;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the CashFlowEngine under the {@code cashcow.engine} prefix.
 *
 * <ul>
 *   <li>{@code startingCash} -- cash balance before the first forecast month</li>
 *   <li>{@code parallelWorkers} -- pool size of {@link CashFlowEngine#calculateParallel} when not given</li>
 *   <li>{@code cacheMaxSize} -- forecasts kept in the result cache</li>
 *   <li>{@code defaultScenario} -- scenario label of forecasts run without one</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cashcow.engine")
public class CashFlowEngineConfig {

    private double startingCash = 0.0;
    private int parallelWorkers = 4;
    private long cacheMaxSize = 100;
    private String defaultScenario = "baseline";
}
