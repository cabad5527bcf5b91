package com.cashcow.cashflow;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A forecast regrouped into revenue, expense, summary and growth sub-tables. Produced from
 * existing rows without recomputation.
 */
@Value
@Builder
public class CategoryBreakdown {

    List<PeriodSlice> revenue;
    List<PeriodSlice> expenses;
    List<PeriodSlice> summary;
    List<PeriodSlice> growth;
}
