package com.cashcow.calculator;

import com.cashcow.domain.enums.EntityType;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Record of a calculator whose failure was replaced by 0.0. Carried on the forecast so a
 * misconfigured entity is visible to callers and not only in the logs.
 */
@Value
@Builder
public class CalculationDiagnostic {

    EntityType entityType;
    String entityName;
    String calculator;
    LocalDate period;
    String message;
}
