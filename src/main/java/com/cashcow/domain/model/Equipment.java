package com.cashcow.domain.model;

import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Purchased hardware. The purchase is a one-time outflow; depreciation is an accounting
 * figure and never a cash movement.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Equipment extends Entity {

    private double cost;

    /** Falls back to startDate when absent. */
    private LocalDate purchaseDate;

    private Integer depreciationYears;
    private Double residualValue;
    private Double maintenanceCostAnnual;
    private Double supportContractAnnual;
    private String vendor;
    private String category;

    @Override
    public EntityType getType() {
        return EntityType.EQUIPMENT;
    }

    public LocalDate purchaseDateOrStart() {
        return purchaseDate != null ? purchaseDate : getStartDate();
    }

    public double purchaseCostDue(LocalDate asOfDate) {
        return MonthMath.sameMonth(purchaseDateOrStart(), asOfDate) ? cost : 0.0;
    }

    public double calculateMonthlyMaintenance() {
        double annual = (maintenanceCostAnnual == null ? 0.0 : maintenanceCostAnnual)
                + (supportContractAnnual == null ? 0.0 : supportContractAnnual);
        return annual / 12.0;
    }

    /** Straight line over depreciationYears, zero before purchase and after the depreciation life. */
    public double calculateMonthlyDepreciation(LocalDate asOfDate) {
        if (depreciationYears == null || depreciationYears <= 0) {
            return 0.0;
        }
        LocalDate purchased = purchaseDateOrStart();
        int elapsed = MonthMath.monthsElapsed(purchased, asOfDate);
        int lifeMonths = depreciationYears * 12;
        if (elapsed < 0 || elapsed >= lifeMonths) {
            return 0.0;
        }
        double residual = residualValue == null ? 0.0 : residualValue;
        return Math.max(0.0, cost - residual) / lifeMonths;
    }
}
