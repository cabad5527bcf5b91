package com.cashcow.captable;

import java.util.List;
import lombok.Getter;

/**
 * All findings for one cap table. Valid when no finding has {@link IssueSeverity#ERROR}.
 */
@Getter
public class CapTableValidationReport {

    private final List<CapTableIssue> issues;

    CapTableValidationReport(List<CapTableIssue> issues) {
        this.issues = List.copyOf(issues);
    }

    public boolean isValid() {
        return issues.stream().noneMatch(CapTableIssue::isError);
    }

    public List<CapTableIssue> getErrors() {
        return bySeverity(IssueSeverity.ERROR);
    }

    public List<CapTableIssue> getWarnings() {
        return bySeverity(IssueSeverity.WARNING);
    }

    private List<CapTableIssue> bySeverity(IssueSeverity severity) {
        return issues.stream().filter(issue -> issue.getSeverity() == severity).toList();
    }
}
