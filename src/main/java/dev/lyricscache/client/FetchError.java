package dev.lyricscache.client;

/**
 * Why a client call returned no data.
 */
public enum FetchError {
    /** The external collaborator found nothing for the key and nothing is cached. */
    NOT_FOUND,
    /** The external collaborator failed (network, rate limit, bad response). */
    PROVIDER_ERROR,
    /** The cache backend failed on an operation whose result the caller asked for. */
    STORE_ERROR
}
