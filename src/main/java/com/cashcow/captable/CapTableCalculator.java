package com.cashcow.captable;

import com.cashcow.calculator.CalculationContext;
import com.cashcow.domain.enums.ShareholderType;
import com.cashcow.domain.model.Entity;
import com.cashcow.domain.model.FundingRound;
import com.cashcow.domain.model.ShareClass;
import com.cashcow.domain.model.Shareholder;
import com.cashcow.exception.CapTableValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ownership, voting, board and dilution math over shareholders, share classes and funding rounds.
 *
 * <p>All fractions are returned at full precision; {@link #roundPercentage(double)} is applied
 * only when a {@link CapTableSummary} is assembled.
 *
 * <p>Shareholders referencing an unknown share class contribute nothing to voting power.
 * Such references are reported by {@link CapTableValidator}; the calculator never fails on
 * them. With {@code cashcow.captable.strict-validation} enabled,
 * {@link #generateCapTableSummary} refuses cap tables that carry validation errors.
 */
@Component
@EnableConfigurationProperties(CapTableConfig.class)
public class CapTableCalculator {

    private static final Logger log = LoggerFactory.getLogger(CapTableCalculator.class);

    static final String SNAPSHOT_KEY = "captable.snapshot";

    private static final Set<ShareholderType> EMPLOYEE_POOL_TYPES =
            EnumSet.of(ShareholderType.EMPLOYEE, ShareholderType.OTHER);

    private final CapTableConfig config;
    private final CapTableValidator validator;

    public CapTableCalculator(CapTableConfig config, CapTableValidator validator) {
        this.config = config;
        this.validator = validator;
    }

    /** Snapshot of the context's entities, built once per context family. */
    public CapTableSnapshot snapshot(CalculationContext context) {
        return context.sharedComputation(SNAPSHOT_KEY, () -> CapTableSnapshot.of(context.getAllEntities()));
    }

    // ========================
    // SHARE COUNTS
    // ========================

    public Map<String, Long> calculateTotalSharesByClass(List<Shareholder> shareholders) {
        Map<String, Long> byClass = new LinkedHashMap<>();
        for (Shareholder shareholder : shareholders) {
            byClass.merge(shareholder.shareClassOrDefault(), shareholder.getTotalShares(), Long::sum);
        }
        return byClass;
    }

    public long calculateTotalSharesFullyDiluted(List<Shareholder> shareholders, List<ShareClass> shareClasses) {
        return CapTableSnapshot.of(shareholders, shareClasses).getFullyDilutedShares();
    }

    // ========================
    // OWNERSHIP
    // ========================

    public double calculateFullyDilutedOwnership(
            Shareholder shareholder, List<Shareholder> shareholders, List<ShareClass> shareClasses) {
        return fullyDilutedOwnership(shareholder, CapTableSnapshot.of(shareholders, shareClasses));
    }

    public double fullyDilutedOwnership(Shareholder shareholder, CapTableSnapshot snapshot) {
        return ratio(shareholder.getTotalShares(), snapshot.getFullyDilutedShares());
    }

    public double calculateBasicOwnership(Shareholder shareholder, long totalIssuedShares) {
        return ratio(shareholder.getTotalShares(), totalIssuedShares);
    }

    // ========================
    // CONTROL
    // ========================

    public double calculateVotingPercentage(
            Shareholder shareholder, Map<String, ShareClass> shareClasses, List<Shareholder> shareholders) {
        double total = 0.0;
        for (Shareholder other : shareholders) {
            total += CapTableSnapshot.votingPower(other, shareClasses);
        }
        return ratio(CapTableSnapshot.votingPower(shareholder, shareClasses), total);
    }

    public double votingPercentage(Shareholder shareholder, CapTableSnapshot snapshot) {
        return ratio(snapshot.votingPower(shareholder), snapshot.getTotalVotingPower());
    }

    public double calculateBoardControlPercentage(Shareholder shareholder, CalculationContext context) {
        return boardControl(shareholder, snapshot(context));
    }

    public double boardControl(Shareholder shareholder, CapTableSnapshot snapshot) {
        return ratio(shareholder.getBoardSeats(), snapshot.getTotalBoardSeats());
    }

    public double calculateShareClassUtilization(ShareClass shareClass, CalculationContext context) {
        return shareClass.utilizationRate();
    }

    // ========================
    // DILUTION
    // ========================

    /**
     * Effect of issuing the round's shares on top of every current shareholder's holdings.
     * For P existing shares and S new shares the dilution is S / (P + S).
     */
    public DilutionImpact calculateDilutionImpact(FundingRound round, CalculationContext context) {
        return dilutionImpact(round, snapshot(context).getTotalSharesOutstanding());
    }

    public DilutionImpact dilutionImpact(FundingRound round, long preRoundShares) {
        long issued = round.sharesIssuedOrZero();
        long postRoundShares = preRoundShares + issued;
        double dilution = issued > 0 ? ratio(issued, postRoundShares) : 0.0;
        return DilutionImpact.builder()
                .dilutionPercentage(dilution)
                .newInvestorOwnership(dilution)
                .preRoundShares(preRoundShares)
                .postRoundShares(postRoundShares)
                .sharesIssued(issued)
                .build();
    }

    // ========================
    // ROLLUPS
    // ========================

    public double getFounderOwnershipPercentage(CapTableSnapshot snapshot) {
        return ownershipOfTypes(snapshot, EnumSet.of(ShareholderType.FOUNDER));
    }

    /** Employees together with the option pool and other unallocated holders. */
    public double getEmployeeOwnershipPercentage(CapTableSnapshot snapshot) {
        return ownershipOfTypes(snapshot, EMPLOYEE_POOL_TYPES);
    }

    public double getInvestorOwnershipPercentage(CapTableSnapshot snapshot) {
        return ownershipOfTypes(snapshot, EnumSet.of(ShareholderType.INVESTOR));
    }

    private double ownershipOfTypes(CapTableSnapshot snapshot, Set<ShareholderType> types) {
        long shares = 0L;
        for (Shareholder shareholder : snapshot.getShareholders()) {
            if (types.contains(shareholder.shareholderTypeOrDefault())) {
                shares += shareholder.getTotalShares();
            }
        }
        return ratio(shares, snapshot.getFullyDilutedShares());
    }

    // ========================
    // SUMMARY
    // ========================

    /**
     * Consolidated view over every shareholder, share class and funding round in
     * {@code entities}. An empty cap table yields {@link CapTableSummary#empty()}.
     *
     * @throws CapTableValidationException in strict mode when the cap table has validation errors
     */
    public CapTableSummary generateCapTableSummary(List<? extends Entity> entities, CalculationContext context) {
        CapTableSnapshot snapshot = context != null && entities == context.getAllEntities()
                ? snapshot(context)
                : CapTableSnapshot.of(entities);
        if (snapshot.isEmpty()) {
            return CapTableSummary.empty();
        }
        if (config.isStrictValidation()) {
            CapTableValidationReport report = validator.validate(entities);
            if (!report.isValid()) {
                List<String> errors = report.getErrors().stream().map(CapTableIssue::toString).toList();
                log.warn("Cap table rejected with {} validation errors", errors.size());
                throw new CapTableValidationException(
                        "Cap table has " + errors.size() + " validation errors", Map.of("errors", errors));
            }
        }

        Map<String, Double> ownership = new LinkedHashMap<>();
        Map<String, Double> voting = new LinkedHashMap<>();
        Map<String, Double> board = new LinkedHashMap<>();
        Map<String, Double> ownershipByClass = new LinkedHashMap<>();
        for (String className : snapshot.getShareClasses().keySet()) {
            ownershipByClass.put(className, 0.0);
        }
        for (Shareholder shareholder : snapshot.getShareholders()) {
            double owned = fullyDilutedOwnership(shareholder, snapshot);
            ownership.merge(shareholder.getName(), owned, Double::sum);
            voting.merge(shareholder.getName(), votingPercentage(shareholder, snapshot), Double::sum);
            board.merge(shareholder.getName(), boardControl(shareholder, snapshot), Double::sum);
            ownershipByClass.merge(shareholder.shareClassOrDefault(), owned, Double::sum);
        }

        Map<String, ShareClassBreakdown> classes = new LinkedHashMap<>();
        double overhang = 0.0;
        for (ShareClass shareClass : snapshot.getShareClasses().values()) {
            long outstanding = snapshot.sharesInClass(shareClass.getClassName());
            classes.put(shareClass.getClassName(), ShareClassBreakdown.builder()
                    .className(shareClass.getClassName())
                    .sharesAuthorized(shareClass.getSharesAuthorized())
                    .sharesIssued(shareClass.getSharesIssued())
                    .sharesOutstanding(outstanding)
                    .utilizationRate(roundPercentage(ratio(outstanding, shareClass.getSharesAuthorized())))
                    .liquidationPreference(shareClass.liquidationPreferenceOrDefault())
                    .votingRightsPerShare(shareClass.votingRightsOrDefault())
                    .build());
            overhang += outstanding * shareClass.liquidationPreferenceOrDefault() * shareClass.parValueOrDefault();
        }

        return CapTableSummary.builder()
                .totalSharesOutstanding(snapshot.getTotalSharesOutstanding())
                .totalSharesAuthorized(snapshot.getTotalSharesAuthorized())
                .fullyDilutedShares(snapshot.getFullyDilutedShares())
                .ownershipByShareholder(rounded(ownership))
                .ownershipByClass(rounded(ownershipByClass))
                .votingControl(rounded(voting))
                .boardControl(rounded(board))
                .shareClasses(classes)
                .valuation(latestValuation(snapshot.getFundingRounds()))
                .liquidationPreferenceOverhang(overhang)
                .founderOwnership(roundPercentage(getFounderOwnershipPercentage(snapshot)))
                .employeeOwnership(roundPercentage(getEmployeeOwnershipPercentage(snapshot)))
                .investorOwnership(roundPercentage(getInvestorOwnershipPercentage(snapshot)))
                .build();
    }

    private static ValuationMetrics latestValuation(List<FundingRound> rounds) {
        return rounds.stream()
                .filter(round -> round.effectiveDate() != null)
                .max(Comparator.comparing(FundingRound::effectiveDate))
                .map(round -> ValuationMetrics.builder()
                        .roundName(round.getName())
                        .roundType(round.getRoundType())
                        .roundDate(round.effectiveDate())
                        .preMoneyValuation(round.computedPreMoneyValuation())
                        .postMoneyValuation(round.computedPostMoneyValuation())
                        .sharePrice(round.getPricePerShare())
                        .build())
                .orElse(null);
    }

    // ========================
    // ROUNDING
    // ========================

    /** Four decimal places, half up. Applied to reported values only. */
    public static double roundPercentage(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    private static Map<String, Double> rounded(Map<String, Double> values) {
        return values.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        entry -> roundPercentage(Objects.requireNonNullElse(entry.getValue(), 0.0)),
                        (a, b) -> a,
                        LinkedHashMap::new));
    }

    private static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
