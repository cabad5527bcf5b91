package com.cashcow.captable;

import com.cashcow.domain.model.Entity;
import com.cashcow.domain.model.FundingRound;
import com.cashcow.domain.model.ShareClass;
import com.cashcow.domain.model.Shareholder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Cap-table aggregates built in one pass over an entity list.
 *
 * <p>Every per-shareholder fraction divides by one of these totals, so computing them once
 * keeps a summary over n shareholders linear. Share classes are keyed by class name; a
 * duplicate name keeps the first definition.
 */
@Getter
public final class CapTableSnapshot {

    private final List<Shareholder> shareholders;
    private final Map<String, ShareClass> shareClasses;
    private final List<FundingRound> fundingRounds;
    private final Map<String, Long> sharesByClass;
    private final long totalSharesOutstanding;
    private final long totalSharesAuthorized;
    private final long fullyDilutedShares;
    private final double totalVotingPower;
    private final long totalBoardSeats;

    private CapTableSnapshot(
            List<Shareholder> shareholders,
            Map<String, ShareClass> shareClasses,
            List<FundingRound> fundingRounds) {
        this.shareholders = Collections.unmodifiableList(shareholders);
        this.shareClasses = Collections.unmodifiableMap(shareClasses);
        this.fundingRounds = Collections.unmodifiableList(fundingRounds);

        Map<String, Long> byClass = new LinkedHashMap<>();
        long outstanding = 0L;
        double voting = 0.0;
        long seats = 0L;
        for (Shareholder shareholder : shareholders) {
            byClass.merge(shareholder.shareClassOrDefault(), shareholder.getTotalShares(), Long::sum);
            outstanding += shareholder.getTotalShares();
            voting += votingPower(shareholder, shareClasses);
            seats += shareholder.getBoardSeats();
        }
        this.sharesByClass = Collections.unmodifiableMap(byClass);
        this.totalSharesOutstanding = outstanding;
        this.totalVotingPower = voting;
        this.totalBoardSeats = seats;

        long authorized = 0L;
        for (ShareClass shareClass : shareClasses.values()) {
            authorized += shareClass.getSharesAuthorized();
        }
        this.totalSharesAuthorized = authorized;
        this.fullyDilutedShares = fullyDiluted(byClass, shareClasses);
    }

    public static CapTableSnapshot of(List<? extends Entity> entities) {
        List<Shareholder> shareholders = new ArrayList<>();
        Map<String, ShareClass> classes = new LinkedHashMap<>();
        List<FundingRound> rounds = new ArrayList<>();
        for (Entity entity : entities) {
            if (entity instanceof Shareholder shareholder) {
                shareholders.add(shareholder);
            } else if (entity instanceof ShareClass shareClass) {
                classes.putIfAbsent(shareClass.getClassName(), shareClass);
            } else if (entity instanceof FundingRound round) {
                rounds.add(round);
            }
        }
        return new CapTableSnapshot(shareholders, classes, rounds);
    }

    public static CapTableSnapshot of(List<Shareholder> shareholders, List<ShareClass> shareClasses) {
        Map<String, ShareClass> classes = new LinkedHashMap<>();
        for (ShareClass shareClass : shareClasses) {
            classes.putIfAbsent(shareClass.getClassName(), shareClass);
        }
        return new CapTableSnapshot(new ArrayList<>(shareholders), classes, new ArrayList<>());
    }

    public boolean isEmpty() {
        return shareholders.isEmpty() && shareClasses.isEmpty() && fundingRounds.isEmpty();
    }

    public long sharesInClass(String className) {
        return sharesByClass.getOrDefault(className, 0L);
    }

    /** Votes carried by a shareholder; 0 when the referenced class is unknown. */
    public double votingPower(Shareholder shareholder) {
        return votingPower(shareholder, shareClasses);
    }

    static double votingPower(Shareholder shareholder, Map<String, ShareClass> shareClasses) {
        ShareClass shareClass = shareClasses.get(shareholder.shareClassOrDefault());
        if (shareClass == null) {
            return 0.0;
        }
        return shareholder.getTotalShares() * shareClass.votingRightsOrDefault();
    }

    /**
     * Sum over every class (held or defined) of the larger of its holdings and its authorized
     * count.
     */
    static long fullyDiluted(Map<String, Long> sharesByClass, Map<String, ShareClass> shareClasses) {
        long total = 0L;
        for (Map.Entry<String, Long> entry : sharesByClass.entrySet()) {
            ShareClass shareClass = shareClasses.get(entry.getKey());
            long authorized = shareClass == null ? 0L : shareClass.getSharesAuthorized();
            total += Math.max(entry.getValue(), authorized);
        }
        for (Map.Entry<String, ShareClass> entry : shareClasses.entrySet()) {
            if (!sharesByClass.containsKey(entry.getKey())) {
                total += entry.getValue().getSharesAuthorized();
            }
        }
        return total;
    }
}
