package com.cashcow.domain.model;

import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A priced financing round. Either valuation may be omitted; the other is derived from
 * {@code postMoney = preMoney + amountRaised}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class FundingRound extends Entity {

    private static final double ROUND_MATH_TOLERANCE = 0.01;

    private String roundType;
    private double amountRaised;
    private Double preMoneyValuation;
    private Double postMoneyValuation;
    private Long sharesIssued;
    private Double pricePerShare;
    private String shareClass;
    private String leadInvestor;
    private LocalDate closingDate;
    private int boardSeatsGranted;

    @Override
    public EntityType getType() {
        return EntityType.FUNDING_ROUND;
    }

    public long sharesIssuedOrZero() {
        return sharesIssued == null ? 0L : sharesIssued;
    }

    public double computedPreMoneyValuation() {
        if (preMoneyValuation != null) {
            return preMoneyValuation;
        }
        if (postMoneyValuation != null) {
            return postMoneyValuation - amountRaised;
        }
        return 0.0;
    }

    public double computedPostMoneyValuation() {
        if (postMoneyValuation != null) {
            return postMoneyValuation;
        }
        if (preMoneyValuation != null) {
            return preMoneyValuation + amountRaised;
        }
        return 0.0;
    }

    /** Date the round is ordered by: closing date, else start date. */
    public LocalDate effectiveDate() {
        return closingDate != null ? closingDate : getStartDate();
    }

    /** Human-readable inconsistencies between valuations, share count and price. Empty when consistent. */
    public List<String> validateRoundMath() {
        List<String> errors = new ArrayList<>();
        if (preMoneyValuation != null && postMoneyValuation != null) {
            double expected = preMoneyValuation + amountRaised;
            if (Math.abs(postMoneyValuation - expected) > ROUND_MATH_TOLERANCE) {
                errors.add("Post-money valuation " + postMoneyValuation
                        + " does not equal pre-money plus amount raised " + expected);
            }
        }
        if (sharesIssued != null && pricePerShare != null) {
            double expected = sharesIssued * pricePerShare;
            if (Math.abs(expected - amountRaised) > ROUND_MATH_TOLERANCE) {
                errors.add("Shares issued times price per share " + expected
                        + " does not equal amount raised " + amountRaised);
            }
        }
        return errors;
    }
}
