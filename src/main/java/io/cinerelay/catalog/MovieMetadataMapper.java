package io.cinerelay.catalog;

import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.domain.SourceDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds job inputs from catalog data.
 */
public final class MovieMetadataMapper {

    static final int MAX_TITLE_LENGTH = 100;

    private MovieMetadataMapper() {
    }

    public static DestinationMetadata toDestination(MovieDetails movie) {
        String title = movie.title().length() > MAX_TITLE_LENGTH
                ? movie.title().substring(0, MAX_TITLE_LENGTH)
                : movie.title();

        StringBuilder description = new StringBuilder(movie.title()).append("\n\n");
        description.append("⭐ Rating: ").append(movie.rating()).append('\n');
        description.append("📅 Year: ").append(movie.year()).append('\n');
        description.append("⏱️ Duration: ").append(movie.duration()).append('\n');
        description.append("🗣️ Language: ").append(movie.tag()).append('\n');
        description.append("🎥 ").append(movie.directors()).append("\n\n");
        description.append(hashtags(movie));

        List<String> tags = new ArrayList<>();
        for (String tag : List.of(movie.tag(), "Movie", movie.year(), "Cinema", "Film")) {
            if (tag != null && !tag.isBlank()) {
                tags.add(tag);
            }
        }

        return new DestinationMetadata(title, description.toString(), tags, "1", "public");
    }

    /**
     * @param catalogLink the movie's catalog page, recorded in the dedupe ledger on success
     */
    public static SourceDescriptor toSource(String catalogLink, DownloadSources sources, SourceLink link) {
        return new SourceDescriptor(catalogLink, link.url(), sources.size(), link.name());
    }

    private static String hashtags(MovieDetails movie) {
        return Stream.of(movie.tag(), "Movie", movie.year())
                .filter(t -> t != null && !t.isBlank())
                .map(t -> "#" + t.replace(" ", ""))
                .collect(Collectors.joining(" "));
    }
}
