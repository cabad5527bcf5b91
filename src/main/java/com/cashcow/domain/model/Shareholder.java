package com.cashcow.domain.model;

import com.cashcow.domain.MonthMath;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.enums.ShareholderType;
import java.time.LocalDate;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Shareholder extends Entity {

    public static final String DEFAULT_SHARE_CLASS = "common";

    private ShareholderType shareholderType;
    private long totalShares;

    /** References {@link ShareClass#getClassName()}. Null means "common". */
    private String shareClass;

    private int boardSeats;
    private String email;
    private String title;

    private LocalDate acquisitionDate;
    private Integer cliffMonths;
    private Integer vestingMonths;

    /** Explicit vested count; overrides the schedule when set. */
    private Long vestedShares;

    @Override
    public EntityType getType() {
        return EntityType.SHAREHOLDER;
    }

    public String shareClassOrDefault() {
        return shareClass == null || shareClass.isBlank() ? DEFAULT_SHARE_CLASS : shareClass;
    }

    public ShareholderType shareholderTypeOrDefault() {
        return shareholderType == null ? ShareholderType.OTHER : shareholderType;
    }

    public boolean hasType(ShareholderType type) {
        return shareholderTypeOrDefault() == type;
    }

    /**
     * Vested shares on {@code asOfDate}. Without a vesting schedule all shares are vested.
     * Nothing vests before the cliff; vesting is linear by whole months afterwards.
     */
    public long calculateVestedShares(LocalDate asOfDate) {
        if (vestedShares != null) {
            return Math.min(vestedShares, totalShares);
        }
        if (acquisitionDate == null || vestingMonths == null || vestingMonths <= 0) {
            return totalShares;
        }
        int elapsed = MonthMath.monthsElapsed(acquisitionDate, asOfDate);
        int cliff = cliffMonths == null ? 0 : cliffMonths;
        if (elapsed < cliff || elapsed < 0) {
            return 0L;
        }
        if (elapsed >= vestingMonths) {
            return totalShares;
        }
        return (long) (totalShares * ((double) elapsed / vestingMonths));
    }
}
