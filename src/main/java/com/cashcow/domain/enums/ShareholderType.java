package com.cashcow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ShareholderType {
    FOUNDER("founder"),
    EMPLOYEE("employee"),
    INVESTOR("investor"),
    ADVISOR("advisor"),
    CONSULTANT("consultant"),
    // Option pools and unallocated grants
    OTHER("other");

    @JsonValue
    private final String key;

    @JsonCreator
    public static ShareholderType fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown shareholder type: " + key));
    }
}
