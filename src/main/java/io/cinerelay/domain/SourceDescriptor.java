package io.cinerelay.domain;

import java.net.URI;

/**
 * Where a job's payload comes from.
 *
 * @param sourceId  stable identifier used for the dedupe ledger (the catalog link)
 * @param url       resolved payload URL
 * @param sizeLabel declared size as reported by the catalog, display only
 * @param provider  source-provider tag (gdrive, pix, ...)
 */
public record SourceDescriptor(
        String sourceId,
        URI url,
        String sizeLabel,
        String provider
) {
    public SourceDescriptor {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId cannot be blank");
        }
        if (url == null) {
            throw new IllegalArgumentException("url cannot be null");
        }
        sizeLabel = sizeLabel != null ? sizeLabel : "";
        provider = provider != null ? provider : "";
    }
}
