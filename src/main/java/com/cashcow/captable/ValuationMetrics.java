package com.cashcow.captable;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Valuation as of the most recent funding round.
 */
@Value
@Builder
public class ValuationMetrics {

    String roundName;
    String roundType;
    LocalDate roundDate;
    double preMoneyValuation;
    double postMoneyValuation;
    Double sharePrice;
}
