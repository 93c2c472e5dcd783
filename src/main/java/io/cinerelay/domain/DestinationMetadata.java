package io.cinerelay.domain;

import java.util.List;

/**
 * Metadata handed to the sink with the upload. Opaque to the pipeline.
 */
public record DestinationMetadata(
        String title,
        String description,
        List<String> tags,
        String categoryId,
        String privacyStatus
) {
    public DestinationMetadata {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be blank");
        }
        description = description != null ? description : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
        categoryId = categoryId != null ? categoryId : "1";
        privacyStatus = privacyStatus != null ? privacyStatus : "public";
    }
}
