package com.cashcow.captable;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ShareClassBreakdown {

    String className;
    long sharesAuthorized;
    long sharesIssued;

    /** Shares held by shareholders referencing the class. */
    long sharesOutstanding;

    /** Outstanding over authorized, rounded. */
    double utilizationRate;

    double liquidationPreference;
    double votingRightsPerShare;
}
