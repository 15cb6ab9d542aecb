package dev.lyricscache.client;

import dev.lyricscache.api.CacheListing;

import java.util.List;

public record ListingResult(boolean success, List<CacheListing> entries, int count, String errorMessage) {
    static ListingResult of(List<CacheListing> entries) {
        return new ListingResult(true, List.copyOf(entries), entries.size(), null);
    }

    static ListingResult failure(String message) {
        return new ListingResult(false, List.of(), 0, message);
    }
}
