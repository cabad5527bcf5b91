package com.cashcow.domain.model;

import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Software extends Entity {

    private Double monthlyCost;

    /** Annual subscriptions are expensed as annualCost / 12 and take precedence. */
    private Double annualCost;

    private Integer licenseCount;
    private String vendor;

    @Override
    public EntityType getType() {
        return EntityType.SOFTWARE;
    }

    public double calculateMonthlyCost(LocalDate asOfDate) {
        if (!isActive(asOfDate)) {
            return 0.0;
        }
        if (annualCost != null) {
            return annualCost / 12.0;
        }
        return monthlyCost == null ? 0.0 : monthlyCost;
    }
}
