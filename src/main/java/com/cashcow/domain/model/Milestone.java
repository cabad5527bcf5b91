package com.cashcow.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A dated deliverable on a grant (amount paid on completion) or a project (budget spent
 * in the milestone month).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    private String name;
    @JsonAlias("planned_date")
    private LocalDate date;

    @JsonAlias("budget")
    private double amount;

    /** planned, active, completed. Free text; only "completed" is interpreted. */
    private String status;

    @JsonIgnore
    public boolean isCompleted() {
        return "completed".equalsIgnoreCase(status);
    }
}
