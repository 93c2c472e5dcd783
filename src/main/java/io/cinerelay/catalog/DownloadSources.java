package io.cinerelay.catalog;

import java.util.List;
import java.util.Optional;

public record DownloadSources(String size, List<SourceLink> links) {

    public DownloadSources {
        size = size != null ? size : "";
        links = links != null ? List.copyOf(links) : List.of();
    }

    public Optional<SourceLink> byName(String name) {
        return links.stream().filter(l -> l.name().equalsIgnoreCase(name)).findFirst();
    }
}
