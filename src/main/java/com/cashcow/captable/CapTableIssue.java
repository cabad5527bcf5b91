package com.cashcow.captable;

import lombok.Builder;
import lombok.Getter;

/**
 * A single finding of {@link CapTableValidator}.
 */
@Getter
@Builder
public class CapTableIssue {

    private final IssueSeverity severity;

    /** Name of the entity the finding is about. */
    private final String entityName;

    private final String field;
    private final String message;
    private final String suggestion;

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + entityName + "." + field + ": " + message;
    }
}
