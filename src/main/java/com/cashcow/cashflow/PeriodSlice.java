package com.cashcow.cashflow;

import java.time.LocalDate;
import java.util.Map;
import lombok.Value;

/** A subset of a period row's columns, keyed by column name. */
@Value
public class PeriodSlice {

    LocalDate period;
    Map<String, Double> values;

    public double value(String column) {
        return values.getOrDefault(column, 0.0);
    }
}
