package com.example.contentops.flowguard.model;

import com.example.contentops.flowguard.util.PayloadUtils;

import java.time.Instant;
import java.util.Map;

public record AutoFixRecord(
        String stageId,
        String fixType,
        boolean retryNeeded,
        Map<String, Object> detail,
        Instant appliedAt
) {

    public AutoFixRecord {
        detail = PayloadUtils.immutableCopy(detail);
    }
}
