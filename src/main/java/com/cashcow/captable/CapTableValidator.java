package com.cashcow.captable;

import com.cashcow.domain.model.Entity;
import com.cashcow.domain.model.FundingRound;
import com.cashcow.domain.model.ShareClass;
import com.cashcow.domain.model.Shareholder;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Structural checks on a cap table.
 *
 * <p>The calculator treats broken references as zero contributions so a single bad record
 * never fails a whole computation. This validator is where those records are reported:
 * <ul>
 *   <li>Shareholder: negative shares or board seats, a cliff longer than the vesting period</li>
 *   <li>Share class: issued above authorized, liquidation preference outside 0 to 10x,
 *       negative voting rights, a participation cap on a non-participating class</li>
 *   <li>Funding round: post-money and price-per-share arithmetic</li>
 *   <li>Cross-entity: unknown or duplicate share class names, holdings above authorized</li>
 * </ul>
 */
@Component
public class CapTableValidator {

    private final CapTableConfig config;

    public CapTableValidator(CapTableConfig config) {
        this.config = config;
    }

    public CapTableValidationReport validate(List<? extends Entity> entities) {
        List<CapTableIssue> issues = new ArrayList<>();
        Set<String> seenClasses = new HashSet<>();
        for (Entity entity : entities) {
            if (entity instanceof ShareClass shareClass && !seenClasses.add(shareClass.getClassName())) {
                issues.add(error(shareClass, "class_name",
                        "Duplicate share class '" + shareClass.getClassName() + "'",
                        "Rename one of the share classes"));
            }
        }

        CapTableSnapshot snapshot = CapTableSnapshot.of(entities);
        for (ShareClass shareClass : snapshot.getShareClasses().values()) {
            validateShareClass(shareClass, issues);
        }
        for (Shareholder shareholder : snapshot.getShareholders()) {
            validateShareholder(shareholder, snapshot, issues);
        }
        for (FundingRound round : snapshot.getFundingRounds()) {
            validateFundingRound(round, snapshot, issues);
        }
        validateAuthorizationLimits(snapshot, issues);
        return new CapTableValidationReport(issues);
    }

    private void validateShareholder(Shareholder shareholder, CapTableSnapshot snapshot, List<CapTableIssue> issues) {
        if (shareholder.getTotalShares() < 0) {
            issues.add(error(shareholder, "total_shares", "Total shares cannot be negative", null));
        }
        if (shareholder.getBoardSeats() < 0) {
            issues.add(error(shareholder, "board_seats", "Board seats cannot be negative", null));
        }
        if (shareholder.getCliffMonths() != null && shareholder.getVestingMonths() != null
                && shareholder.getCliffMonths() > shareholder.getVestingMonths()) {
            issues.add(warning(shareholder, "cliff_months",
                    "Cliff of " + shareholder.getCliffMonths() + " months exceeds vesting period of "
                            + shareholder.getVestingMonths() + " months",
                    "Shorten the cliff or extend vesting"));
        }
        String className = shareholder.shareClassOrDefault();
        if (!snapshot.getShareClasses().containsKey(className)) {
            issues.add(error(shareholder, "share_class",
                    "Referenced share class '" + className + "' not found",
                    "Create share class '" + className + "' or update reference"));
        }
    }

    private void validateShareClass(ShareClass shareClass, List<CapTableIssue> issues) {
        if (shareClass.getSharesIssued() > shareClass.getSharesAuthorized()) {
            issues.add(error(shareClass, "shares_issued",
                    "Issued shares " + shareClass.getSharesIssued() + " exceed authorized "
                            + shareClass.getSharesAuthorized(),
                    "Increase authorized shares"));
        }
        double preference = shareClass.liquidationPreferenceOrDefault();
        if (preference < 0 || preference > ShareClass.MAX_LIQUIDATION_PREFERENCE) {
            issues.add(error(shareClass, "liquidation_preference",
                    "Liquidation preference " + preference + "x is outside 0x to 10x", null));
        }
        if (shareClass.votingRightsOrDefault() < 0) {
            issues.add(error(shareClass, "voting_rights_per_share", "Voting rights cannot be negative", null));
        }
        if (!shareClass.isParticipating() && shareClass.getParticipationCap() != null) {
            issues.add(warning(shareClass, "participation_cap",
                    "Participation cap is ignored on a non-participating class", "Remove the cap"));
        }
    }

    private void validateFundingRound(FundingRound round, CapTableSnapshot snapshot, List<CapTableIssue> issues) {
        if (round.getAmountRaised() < 0) {
            issues.add(error(round, "amount_raised", "Amount raised cannot be negative", null));
        }
        for (String message : round.validateRoundMath()) {
            issues.add(error(round, "valuation", message, "Correct the round terms"));
        }
        if (round.getShareClass() != null && !snapshot.getShareClasses().containsKey(round.getShareClass())) {
            issues.add(error(round, "share_class",
                    "Referenced share class '" + round.getShareClass() + "' not found",
                    "Create share class '" + round.getShareClass() + "' or update reference"));
        }
    }

    private void validateAuthorizationLimits(CapTableSnapshot snapshot, List<CapTableIssue> issues) {
        for (Map.Entry<String, ShareClass> entry : snapshot.getShareClasses().entrySet()) {
            ShareClass shareClass = entry.getValue();
            long held = snapshot.sharesInClass(entry.getKey());
            long authorized = shareClass.getSharesAuthorized();
            if (held > authorized) {
                issues.add(error(shareClass, "shares_authorized",
                        "Shareholders hold " + held + " shares but only " + authorized + " are authorized",
                        "Increase authorized shares"));
            } else if (authorized > 0 && (double) held / authorized > config.getHighUtilizationWarning()) {
                issues.add(warning(shareClass, "shares_authorized",
                        String.format("Share class utilization %.1f%% is very high", 100.0 * held / authorized),
                        "Consider authorizing more shares"));
            }
        }
    }

    private static CapTableIssue error(Entity entity, String field, String message, String suggestion) {
        return issue(IssueSeverity.ERROR, entity, field, message, suggestion);
    }

    private static CapTableIssue warning(Entity entity, String field, String message, String suggestion) {
        return issue(IssueSeverity.WARNING, entity, field, message, suggestion);
    }

    private static CapTableIssue issue(
            IssueSeverity severity, Entity entity, String field, String message, String suggestion) {
        return CapTableIssue.builder()
                .severity(severity)
                .entityName(entity.getName())
                .field(field)
                .message(message)
                .suggestion(suggestion)
                .build();
    }
}
