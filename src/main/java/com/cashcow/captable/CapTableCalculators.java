package com.cashcow.captable;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.FundingRound;
import com.cashcow.domain.model.ShareClass;
import com.cashcow.domain.model.Shareholder;

/**
 * Registers the cap-table calculators. None of them carries a cash-flow category, so they
 * never enter period totals.
 */
public final class CapTableCalculators {

    public static final String OWNERSHIP_PERCENTAGE = "ownership_percentage";
    public static final String VOTING_CONTROL = "voting_control";
    public static final String BOARD_CONTROL = "board_control";
    public static final String VESTED_SHARES = "vested_shares";
    public static final String UTILIZATION_RATE = "utilization_rate";
    public static final String DILUTION_PERCENTAGE = "dilution_percentage";

    private CapTableCalculators() {}

    public static CalculatorRegistry register(CalculatorRegistry registry, CapTableCalculator calculator) {
        registry.register(EntityType.SHAREHOLDER, OWNERSHIP_PERCENTAGE, Shareholder.class,
                (shareholder, context) -> calculator.fullyDilutedOwnership(shareholder, calculator.snapshot(context)),
                "Fully diluted ownership fraction");
        registry.register(EntityType.SHAREHOLDER, VOTING_CONTROL, Shareholder.class,
                (shareholder, context) -> calculator.votingPercentage(shareholder, calculator.snapshot(context)),
                "Share of total voting power");
        registry.register(EntityType.SHAREHOLDER, BOARD_CONTROL, Shareholder.class,
                calculator::calculateBoardControlPercentage,
                "Share of board seats");
        registry.register(EntityType.SHAREHOLDER, VESTED_SHARES, Shareholder.class,
                (shareholder, context) -> shareholder.calculateVestedShares(context.getAsOfDate()),
                "Shares vested as of the period");
        registry.register(EntityType.SHARE_CLASS, UTILIZATION_RATE, ShareClass.class,
                calculator::calculateShareClassUtilization,
                "Issued over authorized shares");
        registry.register(EntityType.FUNDING_ROUND, DILUTION_PERCENTAGE, FundingRound.class,
                (round, context) -> calculator.calculateDilutionImpact(round, context).getDilutionPercentage(),
                "Dilution of existing holders by the round");
        return registry;
    }
}
