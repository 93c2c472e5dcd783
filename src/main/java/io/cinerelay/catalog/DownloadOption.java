package io.cinerelay.catalog;

public record DownloadOption(String quality, String size, String link) {
}
