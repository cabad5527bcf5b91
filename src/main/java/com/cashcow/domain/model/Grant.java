package com.cashcow.domain.model;

import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Non-dilutive funding. Without a payment schedule the amount is disbursed evenly over the
 * grant's months; an open-ended grant is spread over {@value #DEFAULT_GRANT_MONTHS} months.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Grant extends Entity {

    public static final int DEFAULT_GRANT_MONTHS = 24;

    private double amount;
    private String agency;
    private String program;
    private List<ScheduledPayment> paymentSchedule;
    private List<Milestone> milestones;
    private Double indirectCostRate;

    @Override
    public EntityType getType() {
        return EntityType.GRANT;
    }

    public double calculateMonthlyDisbursement(LocalDate asOfDate) {
        if (!isActive(asOfDate)) {
            return 0.0;
        }
        if (paymentSchedule != null && !paymentSchedule.isEmpty()) {
            return paymentsInMonth(paymentSchedule, asOfDate);
        }
        int months = getEndDate() == null
                ? DEFAULT_GRANT_MONTHS
                : MonthMath.monthSpanInclusive(getStartDate(), getEndDate());
        return amount / months;
    }

    static double paymentsInMonth(List<ScheduledPayment> schedule, LocalDate asOfDate) {
        double total = 0.0;
        for (ScheduledPayment payment : schedule) {
            if (MonthMath.sameMonth(payment.getDate(), asOfDate)) {
                total += payment.getAmount();
            }
        }
        return total;
    }
}
