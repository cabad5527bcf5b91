package com.cashcow.domain.model;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A dated cash movement on a grant, investment or sale schedule. Recognised in the
 * calendar month that contains {@link #date}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPayment {

    private LocalDate date;
    private double amount;
    private String description;
}
