package com.purchasingpower.graphrag.exception;

import lombok.Getter;

@Getter
public class NotFoundException extends GraphRagException {

    private final String entityId;

    public NotFoundException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }
}
