package org.stianloader.picocache;

/**
 * The reasons for which {@link SourceCache#ensureCachedResult(String, java.nio.file.Path, boolean, boolean, java.time.Duration)}
 * can fail. None of them are retried by the cache itself.
 */
public enum FailureKind {

    /**
     * The repository reported that no source archive exists for the key, or the availability check itself failed.
     */
    UNAVAILABLE,

    /**
     * The download of the archive failed.
     */
    TRANSFER_FAILED,

    /**
     * The archive contained absolute paths, ".." segments, links or special files. It was not extracted.
     */
    UNSAFE_ARCHIVE,

    /**
     * The archive could not be read or written to disk.
     */
    EXTRACTION_FAILED,

    /**
     * The archive was extracted but contained no payload files.
     */
    EMPTY_ARCHIVE,

    /**
     * The entry exists but is not valid and repairing stale entries was not permitted.
     * The entry has not been modified.
     */
    STALE_ENTRY,

    /**
     * Moving the new entry into place failed. See {@link CacheFailure#requiresOperatorAttention()}
     * to tell whether the previous entry could be restored.
     */
    PUBLISH_FAILED,

    /**
     * The lock of the key could not be obtained in time.
     */
    LOCK_TIMEOUT,

    /**
     * Any other filesystem error, for example while creating the cache directories.
     */
    IO_ERROR;
}
