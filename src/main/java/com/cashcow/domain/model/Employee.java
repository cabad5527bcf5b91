package com.cashcow.domain.model;

import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import java.util.Map;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A person on payroll. Salary is annual; benefits and allowances are monthly amounts
 * keyed by label (for example {@code health: 500}).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Employee extends Entity {

    public static final double DEFAULT_OVERHEAD_MULTIPLIER = 1.0;
    public static final int DEFAULT_VESTING_YEARS = 4;
    public static final int DEFAULT_CLIFF_YEARS = 1;

    private double salary;
    private String position;
    private String department;

    /** Fully loaded cost factor on salary. Null means not set; treated as 1.0. */
    private Double overheadMultiplier;

    private Map<String, Double> benefits;
    private Map<String, Double> allowances;

    private boolean equityEligible;
    private Long equityShares;
    private LocalDate equityStartDate;
    private Integer vestingYears;
    private Integer cliffYears;
    private Integer equityVestYears;

    /** Fraction of salary, e.g. 0.15. */
    private Double bonusPerformanceMax;

    private Double bonusMilestonesMax;
    private String payFrequency;

    @Override
    public EntityType getType() {
        return EntityType.EMPLOYEE;
    }

    public double monthlySalary() {
        return salary / 12.0;
    }

    public double overheadMultiplierOrDefault() {
        return overheadMultiplier == null ? DEFAULT_OVERHEAD_MULTIPLIER : overheadMultiplier;
    }

    public double monthlyOverhead() {
        return monthlySalary() * (overheadMultiplierOrDefault() - 1.0);
    }

    /** Benefits plus allowances for one month. */
    public double monthlyBenefits() {
        return sum(benefits) + sum(allowances);
    }

    public double calculateTotalCost() {
        return monthlySalary() + monthlyOverhead() + monthlyBenefits();
    }

    public int vestingYearsOrDefault() {
        return vestingYears == null || vestingYears <= 0 ? DEFAULT_VESTING_YEARS : vestingYears;
    }

    public int cliffYearsOrDefault() {
        return cliffYears == null || cliffYears < 0 ? DEFAULT_CLIFF_YEARS : cliffYears;
    }

    public LocalDate equityStartOrHireDate() {
        return equityStartDate != null ? equityStartDate : getStartDate();
    }

    private static double sum(Map<String, Double> amounts) {
        if (amounts == null) {
            return 0.0;
        }
        double total = 0.0;
        for (Double amount : amounts.values()) {
            if (amount != null) {
                total += amount;
            }
        }
        return total;
    }
}
