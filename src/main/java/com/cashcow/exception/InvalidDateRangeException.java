package com.cashcow.exception;

import java.time.LocalDate;
import java.util.Map;

public class InvalidDateRangeException extends BaseException {

    public InvalidDateRangeException(LocalDate startDate, LocalDate endDate) {
        super(
                ErrorCode.INVALID_DATE_RANGE,
                String.format("Invalid date range: start %s is after end %s", startDate, endDate),
                Map.of("startDate", String.valueOf(startDate), "endDate", String.valueOf(endDate)));
    }
}
