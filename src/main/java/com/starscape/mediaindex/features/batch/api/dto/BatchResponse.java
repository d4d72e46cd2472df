package com.starscape.mediaindex.features.batch.api.dto;

import com.starscape.mediaindex.features.batch.domain.BatchResult;

public record BatchResponse(
    int code,
    String message,
    int count
) {
    public static BatchResponse ok(BatchResult result) {
        return new BatchResponse(200, result.message(), result.count());
    }
}
