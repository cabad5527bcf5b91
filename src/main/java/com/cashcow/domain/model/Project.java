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
 * An R&amp;D effort with a fixed budget burned evenly across its months. Projects without
 * an end date have no defined burn.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Project extends Entity {

    private double totalBudget;
    private List<Milestone> milestones;
    private List<String> teamMembers;

    /** planned, active, on-hold, completed, cancelled. */
    private String status;

    @Override
    public EntityType getType() {
        return EntityType.PROJECT;
    }

    public double calculateMonthlyBurnRate(LocalDate asOfDate) {
        if (!isActive(asOfDate) || getEndDate() == null) {
            return 0.0;
        }
        return totalBudget / MonthMath.monthSpanInclusive(getStartDate(), getEndDate());
    }

    public double milestoneBudgetDue(LocalDate asOfDate) {
        if (milestones == null) {
            return 0.0;
        }
        double total = 0.0;
        for (Milestone milestone : milestones) {
            if (MonthMath.sameMonth(milestone.getDate(), asOfDate)) {
                total += milestone.getAmount();
            }
        }
        return total;
    }
}
