package com.cashcow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Billing cadence of a facility. Quarterly bills land in January, April, July and
 * October; annual bills land in January.
 */
@Getter
@RequiredArgsConstructor
public enum PaymentFrequency {
    MONTHLY("monthly", 1),
    QUARTERLY("quarterly", 3),
    ANNUAL("annual", 12);

    @JsonValue
    private final String key;

    private final int monthsPerPayment;

    public boolean isBillingMonth(int monthOfYear) {
        return (monthOfYear - 1) % monthsPerPayment == 0;
    }

    @JsonCreator
    public static PaymentFrequency fromKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment frequency: " + key));
    }
}
