package com.strategylab.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " not found: " + identifier,
                Map.of("resource", resourceType, "id", String.valueOf(identifier)));
    }
}
