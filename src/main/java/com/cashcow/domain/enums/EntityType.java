package com.cashcow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of entity kinds the engine knows how to forecast. The key is the lowercase
 * tag used by entity files, scenario overrides and calculator registration.
 */
@Getter
@RequiredArgsConstructor
public enum EntityType {
    EMPLOYEE("employee"),
    GRANT("grant"),
    INVESTMENT("investment"),
    SALE("sale"),
    SERVICE("service"),
    FACILITY("facility"),
    SOFTWARE("software"),
    EQUIPMENT("equipment"),
    PROJECT("project"),
    SHARE_CLASS("share_class"),
    SHAREHOLDER("shareholder"),
    FUNDING_ROUND("funding_round");

    @JsonValue
    private final String key;

    /**
     * Resolves a type from its key, case-insensitively.
     *
     * @throws IllegalArgumentException if the key names no known entity type
     */
    @JsonCreator
    public static EntityType fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + key));
    }
}
