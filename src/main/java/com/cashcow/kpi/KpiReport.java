package com.cashcow.kpi;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * KPI values in {@link Kpi} order. Values are finite except runway and months to breakeven,
 * which are {@link Double#POSITIVE_INFINITY} when the business never runs out of cash or
 * never breaks even.
 */
public final class KpiReport {

    private final Map<Kpi, Double> values;

    KpiReport(Map<Kpi, Double> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public double get(Kpi kpi) {
        return values.getOrDefault(kpi, 0.0);
    }

    public boolean isInfinite(Kpi kpi) {
        return Double.isInfinite(get(kpi));
    }

    public Map<Kpi, Double> getValues() {
        return values;
    }

    public Map<String, Double> asMap() {
        Map<String, Double> byKey = new LinkedHashMap<>();
        values.forEach((kpi, value) -> byKey.put(kpi.getKey(), value));
        return byKey;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KpiReport other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "KpiReport" + asMap();
    }
}
