package com.cashcow.captable;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Consolidated ownership view of a cap table. Every fraction is rounded to four decimals.
 */
@Value
@Builder
public class CapTableSummary {

    long totalSharesOutstanding;
    long totalSharesAuthorized;
    long fullyDilutedShares;
    Map<String, Double> ownershipByShareholder;
    Map<String, Double> ownershipByClass;
    Map<String, Double> votingControl;
    Map<String, Double> boardControl;
    Map<String, ShareClassBreakdown> shareClasses;

    /** Null when the cap table has no funding rounds. */
    ValuationMetrics valuation;

    double liquidationPreferenceOverhang;
    double founderOwnership;
    double employeeOwnership;
    double investorOwnership;

    public static CapTableSummary empty() {
        return CapTableSummary.builder()
                .ownershipByShareholder(Map.of())
                .ownershipByClass(Map.of())
                .votingControl(Map.of())
                .boardControl(Map.of())
                .shareClasses(Map.of())
                .build();
    }

    public boolean isEmpty() {
        return ownershipByShareholder.isEmpty() && shareClasses.isEmpty();
    }
}
