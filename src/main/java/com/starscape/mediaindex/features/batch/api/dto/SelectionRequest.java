package com.starscape.mediaindex.features.batch.api.dto;

import com.starscape.mediaindex.features.batch.domain.Selection;

import java.util.List;

/**
 * Request body for batch commands: {"photos":[...],"albums":[...],"labels":[...]}.
 * Missing lists are treated as empty.
 */
public record SelectionRequest(
    List<String> photos,
    List<String> albums,
    List<String> labels
) {
    public Selection toSelection() {
        return new Selection(photos, albums, labels);
    }
}
