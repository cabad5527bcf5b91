package com.cashcow.exception;

import java.util.Map;

/** A named scenario or other registered item was looked up but does not exist. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String name) {
        super(ErrorCode.NOT_FOUND,
                String.format("%s '%s' does not exist", resourceType, name),
                Map.of("resourceType", resourceType, "name", name));
    }
}
