package io.cinerelay.catalog;

import java.util.List;

public record MovieDetails(
        String title,
        String year,
        String rating,
        String duration,
        String tag,
        String directors,
        String poster,
        List<DownloadOption> downloads
) {

    public MovieDetails {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be blank");
        }
        downloads = downloads != null ? List.copyOf(downloads) : List.of();
    }
}
