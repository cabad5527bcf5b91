package com.cashcow.domain.model;

import com.cashcow.domain.enums.EntityType;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A class of stock ("common", "series_a"). Shareholders reference it by {@link #className}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ShareClass extends Entity {

    public static final double DEFAULT_PAR_VALUE = 0.001;
    public static final double MAX_LIQUIDATION_PREFERENCE = 10.0;

    private String className;
    private long sharesAuthorized;
    private long sharesIssued;
    private Double parValue;

    /** Multiple of par returned ahead of junior classes, 0 to 10. Null means 1x. */
    private Double liquidationPreference;

    private boolean participating;

    /** Cap on total participating proceeds as a multiple of the preference. Null means uncapped. */
    private Double participationCap;

    private Double votingRightsPerShare;
    private Integer seniorityRank;

    @Override
    public EntityType getType() {
        return EntityType.SHARE_CLASS;
    }

    public double parValueOrDefault() {
        return parValue == null ? DEFAULT_PAR_VALUE : parValue;
    }

    public double liquidationPreferenceOrDefault() {
        return liquidationPreference == null ? 1.0 : liquidationPreference;
    }

    public double votingRightsOrDefault() {
        return votingRightsPerShare == null ? 1.0 : votingRightsPerShare;
    }

    public int seniorityRankOrDefault() {
        return seniorityRank == null ? 0 : seniorityRank;
    }

    /** Fraction of authorized shares issued; 0 when nothing is authorized. */
    public double utilizationRate() {
        return sharesAuthorized <= 0 ? 0.0 : (double) sharesIssued / sharesAuthorized;
    }

    public double totalPreferenceAmount() {
        return liquidationPreferenceOrDefault() * parValueOrDefault() * sharesIssued;
    }

    /**
     * Proceeds to {@code sharesHeld} of this class at a given exit value.
     *
     * <p>Non-participating holders take the larger of their preference and their pro-rata
     * share. Participating holders take the preference plus a pro-rata share of what is left,
     * limited by the participation cap when one is set.
     */
    public double calculateLiquidationProceeds(double exitValue, long sharesHeld) {
        if (sharesHeld <= 0 || sharesIssued <= 0) {
            return 0.0;
        }
        double preferencePerShare = liquidationPreferenceOrDefault() * parValueOrDefault();
        double preference = preferencePerShare * sharesHeld;
        double proRata = ((double) sharesHeld / sharesIssued) * exitValue;
        if (!participating) {
            return Math.max(preference, proRata);
        }
        double remaining = Math.max(0.0, exitValue - totalPreferenceAmount());
        double total = preference + ((double) sharesHeld / sharesIssued) * remaining;
        if (participationCap != null && participationCap > 0) {
            total = Math.min(total, preference * participationCap);
        }
        return total;
    }
}
