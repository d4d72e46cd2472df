package com.starscape.mediaindex.features.primaryfile.api.dto;

public record PrimaryFileResponse(
    String photoUid,
    String fileUid
) {}
