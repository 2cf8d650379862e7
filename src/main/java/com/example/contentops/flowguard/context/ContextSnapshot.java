package com.example.contentops.flowguard.context;

import java.time.Instant;
import java.util.Map;

/**
 * Write-once copy of a session context taken after a stage.
 *
 * @param stageId     stage that produced this state, {@code initial} for the first snapshot
 * @param data        deep copy with binary fields removed
 * @param contentHash MD5 over the key-sorted JSON form of {@code data}
 * @param sizeBytes   length of that JSON form
 */
public record ContextSnapshot(String stageId, Map<String, Object> data, String contentHash, long sizeBytes,
                              Instant takenAt) {
}
