package io.cinerelay.catalog;

import java.net.URI;

/**
 * A mirror for one download option, e.g. {@code gdrive} or {@code cloud}.
 */
public record SourceLink(String name, URI url) {
}
