package com.nevis.pdfscan.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }
}
