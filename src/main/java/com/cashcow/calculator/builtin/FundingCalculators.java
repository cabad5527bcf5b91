package com.cashcow.calculator.builtin;

import com.cashcow.calculator.CalculationContext;
import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Grant;
import com.cashcow.domain.model.Investment;
import com.cashcow.domain.model.Milestone;
import java.util.List;

/**
 * Grant and investment inflows.
 */
public final class FundingCalculators {

    public static final String DISBURSEMENT = "disbursement_calc";
    public static final String MILESTONE = "milestone_calc";

    private FundingCalculators() {}

    static void register(CalculatorRegistry registry) {
        registry.register(EntityType.GRANT, DISBURSEMENT, Grant.class,
                (grant, context) -> grant.calculateMonthlyDisbursement(context.getAsOfDate()),
                "Monthly grant disbursement", CashFlowCategory.GRANT_REVENUE, List.of());
        registry.register(EntityType.GRANT, MILESTONE, Grant.class,
                FundingCalculators::grantMilestones, "Milestone payments due this month");
        registry.register(EntityType.INVESTMENT, DISBURSEMENT, Investment.class,
                (investment, context) -> investment.calculateMonthlyDisbursement(context.getAsOfDate()),
                "Investment cash received this month", CashFlowCategory.INVESTMENT_REVENUE, List.of());
    }

    /** Amount of milestones falling in this month. Informational; disbursement already covers the cash. */
    static double grantMilestones(Grant grant, CalculationContext context) {
        if (!grant.isActive(context.getAsOfDate()) || grant.getMilestones() == null) {
            return 0.0;
        }
        double total = 0.0;
        for (Milestone milestone : grant.getMilestones()) {
            if (MonthMath.sameMonth(milestone.getDate(), context.getAsOfDate())) {
                total += milestone.getAmount();
            }
        }
        return total;
    }
}
