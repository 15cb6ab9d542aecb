package dev.lyricscache.eviction;

/**
 * Outcome of one eviction run.
 *
 * @param success       false when the store failed mid-run; counts then describe what completed
 * @param initialCount  entries before the run
 * @param deletedOld    entries removed by the age phase
 * @param deletedExcess entries removed by the count phase
 * @param finalCount    entries after the run
 * @param totalBytes    stored bytes after the run
 * @param error         failure message, null on success
 */
public record EvictionStats(
        boolean success,
        long initialCount,
        int deletedOld,
        int deletedExcess,
        long finalCount,
        long totalBytes,
        String error
) {
    public static EvictionStats empty() {
        return new EvictionStats(true, 0, 0, 0, 0, 0, null);
    }

    public static EvictionStats failure(String error) {
        return new EvictionStats(false, 0, 0, 0, 0, 0, error);
    }

    public int totalDeleted() {
        return deletedOld + deletedExcess;
    }

    public double approximateSizeKb() {
        return totalBytes / 1024.0;
    }
}
