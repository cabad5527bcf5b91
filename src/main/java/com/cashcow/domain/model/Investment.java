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
 * Equity or debt financing received. Paid as a lump sum in the start month unless a
 * disbursement schedule splits it into tranches.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Investment extends Entity {

    private double amount;
    private String investor;
    private String roundName;
    private Double valuation;
    private List<ScheduledPayment> disbursementSchedule;

    @Override
    public EntityType getType() {
        return EntityType.INVESTMENT;
    }

    public double calculateMonthlyDisbursement(LocalDate asOfDate) {
        if (!isActive(asOfDate)) {
            return 0.0;
        }
        if (disbursementSchedule != null && !disbursementSchedule.isEmpty()) {
            return Grant.paymentsInMonth(disbursementSchedule, asOfDate);
        }
        return MonthMath.sameMonth(getStartDate(), asOfDate) ? amount : 0.0;
    }
}
