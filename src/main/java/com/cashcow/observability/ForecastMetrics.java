package com.cashcow.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the forecast engine.
 *
 * <ul>
 *   <li><b>forecast.calculations</b> (counter, tag {@code strategy}): forecasts computed, by sync/async/parallel</li>
 *   <li><b>forecast.cache.hits</b> (counter): forecasts served from the result cache</li>
 *   <li><b>calculator.failures</b> (counter): calculator invocations replaced by 0.0</li>
 *   <li><b>forecast.duration</b> (timer): wall time of a forecast computation</li>
 * </ul>
 */
@Component
public class ForecastMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter cacheHitCounter;
    private final Counter calculatorFailureCounter;
    private final Timer forecastTimer;

    public ForecastMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.cacheHitCounter = Counter.builder("forecast.cache.hits")
                .description("Forecasts served from the result cache")
                .register(meterRegistry);
        this.calculatorFailureCounter = Counter.builder("calculator.failures")
                .description("Calculator invocations that failed and contributed 0.0")
                .register(meterRegistry);
        this.forecastTimer = Timer.builder("forecast.duration")
                .description("Wall time of a forecast computation")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    public void recordCalculation(String strategy, long elapsedNanos) {
        Counter.builder("forecast.calculations")
                .description("Forecasts computed")
                .tag("strategy", strategy)
                .register(meterRegistry)
                .increment();
        forecastTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    public void recordCalculatorFailures(int failures) {
        if (failures > 0) {
            calculatorFailureCounter.increment(failures);
        }
    }

    // Expose for testing
    Counter getCacheHitCounter() {
        return cacheHitCounter;
    }

    Counter getCalculatorFailureCounter() {
        return calculatorFailureCounter;
    }
}
