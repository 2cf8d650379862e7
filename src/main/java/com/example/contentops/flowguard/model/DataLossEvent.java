package com.example.contentops.flowguard.model;

import java.time.Instant;

/**
 * A critical context field that a stage neither received nor re-emitted.
 *
 * @param field          name of the critical field
 * @param lastKnownValue value the field held in the tracked context before the stage
 * @param stageId        stage at which the field went missing
 * @param detectedAt     when the loss was recorded
 */
public record DataLossEvent(String field, Object lastKnownValue, String stageId, Instant detectedAt) {
}
