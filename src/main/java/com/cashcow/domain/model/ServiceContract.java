package com.cashcow.domain.model;

import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Recurring service revenue. Priced by a flat monthly amount, by hourly rate times hours,
 * or by a total contract value spread over the contract's months.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ServiceContract extends Entity {

    private Double monthlyAmount;
    private Double hourlyRate;
    private Double hoursPerMonth;
    private Double contractValue;
    private Integer minimumCommitmentMonths;
    private String customer;
    private String serviceType;

    @Override
    public EntityType getType() {
        return EntityType.SERVICE;
    }

    public double calculateMonthlyRevenue(LocalDate asOfDate) {
        if (!isActive(asOfDate)) {
            return 0.0;
        }
        if (monthlyAmount != null) {
            return monthlyAmount;
        }
        if (hourlyRate != null && hoursPerMonth != null) {
            return hourlyRate * hoursPerMonth;
        }
        if (contractValue != null) {
            int months = getEndDate() == null ? 12 : MonthMath.monthSpanInclusive(getStartDate(), getEndDate());
            return contractValue / months;
        }
        return 0.0;
    }
}
