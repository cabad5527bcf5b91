package com.cashcow.domain.model;

import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Sale extends Entity {

    private double amount;
    private String customer;
    private String product;
    private Integer quantity;
    private Double unitPrice;
    private LocalDate deliveryDate;
    private List<ScheduledPayment> paymentSchedule;

    @Override
    public EntityType getType() {
        return EntityType.SALE;
    }

    /** Scheduled payments when present, otherwise the full amount in the delivery month. */
    public double calculateMonthlyRevenue(LocalDate asOfDate) {
        if (!isActive(asOfDate)) {
            return 0.0;
        }
        if (paymentSchedule != null && !paymentSchedule.isEmpty()) {
            return Grant.paymentsInMonth(paymentSchedule, asOfDate);
        }
        LocalDate recognised = deliveryDate != null ? deliveryDate : getStartDate();
        return MonthMath.sameMonth(recognised, asOfDate) ? amount : 0.0;
    }
}
