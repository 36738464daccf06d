package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.UUID;

public record SyncWarning(
    UUID id,
    String recordId,
    String recordName,
    String message,
    String code,
    Instant timestamp
) {}
