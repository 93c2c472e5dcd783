package io.cinerelay.catalog;

import io.cinerelay.error.CatalogException;

import java.util.List;

/**
 * Lookup API used to turn a search query into a payload URL. No retries: every failure surfaces as {@link CatalogException}.
 */
public interface CatalogClient {

    int MAX_RESULTS = 10;

    /**
     * @return at most {@link #MAX_RESULTS} entries, empty when nothing matched
     */
    List<CatalogEntry> search(String query) throws CatalogException;

    MovieDetails getDetails(String link) throws CatalogException;

    DownloadSources getSources(String downloadLink) throws CatalogException;
}
