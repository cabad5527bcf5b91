package com.cashcow.domain.model;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.enums.PaymentFrequency;
import java.time.LocalDate;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Office, lab or test site. {@code monthlyCost} is the rent per month regardless of billing
 * cadence; quarterly and annual billing concentrate it into the billing months.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Facility extends Entity {

    private double monthlyCost;
    private String location;
    private Integer sizeSqft;
    private Double utilitiesMonthly;
    private Double insuranceAnnual;
    private PaymentFrequency paymentFrequency;

    @Override
    public EntityType getType() {
        return EntityType.FACILITY;
    }

    public PaymentFrequency paymentFrequencyOrDefault() {
        return paymentFrequency == null ? PaymentFrequency.MONTHLY : paymentFrequency;
    }

    /** Rent due in the month of {@code asOfDate}. */
    public double rentDue(LocalDate asOfDate) {
        PaymentFrequency frequency = paymentFrequencyOrDefault();
        if (!frequency.isBillingMonth(asOfDate.getMonthValue())) {
            return 0.0;
        }
        return monthlyCost * frequency.getMonthsPerPayment();
    }

    /** Utilities, insurance and the optional security_monthly and maintenance_monthly attributes. */
    public double monthlyRunningCosts() {
        double total = utilitiesMonthly == null ? 0.0 : utilitiesMonthly;
        if (insuranceAnnual != null) {
            total += insuranceAnnual / 12.0;
        }
        total += Math.max(0.0, getNumber("security_monthly", 0.0));
        total += Math.max(0.0, getNumber("maintenance_monthly", 0.0));
        return total;
    }

    public double calculateMonthlyCost(LocalDate asOfDate) {
        if (!isActive(asOfDate)) {
            return 0.0;
        }
        return rentDue(asOfDate) + monthlyRunningCosts();
    }
}
