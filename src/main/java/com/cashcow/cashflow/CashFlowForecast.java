package com.cashcow.cashflow;

import com.cashcow.calculator.CalculationDiagnostic;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Ordered period table of a forecast plus the diagnostics of calculators that failed
 * while producing it.
 */
@Value
@Builder
public class CashFlowForecast {

    LocalDate startDate;
    LocalDate endDate;
    String scenario;
    double startingCash;
    List<PeriodRow> rows;
    List<CalculationDiagnostic> diagnostics;

    public int size() {
        return rows.size();
    }

    public PeriodRow row(int index) {
        return rows.get(index);
    }

    public PeriodRow lastRow() {
        return rows.get(rows.size() - 1);
    }

    public double finalCashBalance() {
        return rows.isEmpty() ? startingCash : lastRow().getCashBalance();
    }
}
