package com.cashcow.captable;

import lombok.Builder;
import lombok.Value;

/**
 * Effect of a funding round on the existing holders. Fractions are unrounded.
 */
@Value
@Builder
public class DilutionImpact {

    double dilutionPercentage;
    double newInvestorOwnership;
    long preRoundShares;
    long postRoundShares;
    long sharesIssued;
}
