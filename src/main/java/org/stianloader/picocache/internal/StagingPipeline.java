package org.stianloader.picocache.internal;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picocache.CacheFailure;
import org.stianloader.picocache.CacheLayout;
import org.stianloader.picocache.CacheResult;
import org.stianloader.picocache.FailureKind;
import org.stianloader.picocache.archive.SafeArchiveExtractor;
import org.stianloader.picocache.archive.UnsafeArchiveException;
import org.stianloader.picocache.logging.LoggingAdapter;
import org.stianloader.picocache.repo.SourceRepository;
import org.stianloader.picocache.validate.EntryValidator;

/**
 * Builds a new cache entry next to the old one and swaps it in.
 *
 * <p>The stages are run in order: the existing entry is checked, the archive is fetched into a fresh staging directory,
 * extracted, checked for payload files, marked as complete and finally published by renaming. Every failure aborts the
 * remaining stages. The staging directory is removed on every path out of {@link #run(CacheLayout, String, boolean, boolean)}.
 *
 * <p>Callers must hold the lock of the key for the whole duration of {@link #run(CacheLayout, String, boolean, boolean)}.
 * The entry is only ever modified through renames during the publish stage, so concurrent readers observe either
 * the previous tree, the new tree or, for the instant between the two renames, no entry at all.
 */
public class StagingPipeline {

    private static final String ARCHIVE_FILE_NAME = "source.archive";
    private static final String EXTRACTED_DIRECTORY_NAME = "extracted";

    /**
     * Signals that a stage failed. Never escapes {@link StagingPipeline#run(CacheLayout, String, boolean, boolean)}.
     */
    private static final class StageException extends Exception {
        private static final long serialVersionUID = -3716931245102931755L;

        @NotNull
        private final transient CacheFailure failure;

        StageException(@NotNull CacheFailure failure) {
            super(failure.getMessage(), null, false, false);
            this.failure = failure;
        }

        StageException(@NotNull FailureKind kind, @NotNull String message, @Nullable Throwable cause) {
            this(CacheFailure.of(kind, message, cause));
        }
    }

    @NotNull
    private final SourceRepository repository;
    @NotNull
    private final SafeArchiveExtractor extractor;
    @NotNull
    private final EntryValidator validator;
    @NotNull
    private final PathMover mover;
    @NotNull
    private final Executor executor;
    @NotNull
    private final LoggingAdapter logger;

    public StagingPipeline(@NotNull SourceRepository repository, @NotNull SafeArchiveExtractor extractor, @NotNull EntryValidator validator,
            @NotNull PathMover mover, @NotNull Executor executor, @NotNull LoggingAdapter logger) {
        this.repository = Objects.requireNonNull(repository, "repository may not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor may not be null");
        this.validator = Objects.requireNonNull(validator, "validator may not be null");
        this.mover = Objects.requireNonNull(mover, "mover may not be null");
        this.executor = Objects.requireNonNull(executor, "executor may not be null");
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    /**
     * Runs the pipeline for a single key.
     *
     * @param layout The layout of the cache root. Its directories must exist.
     * @param key The key
     * @param useCache Whether an existing valid entry may be returned as-is
     * @param repairStale Whether an existing invalid entry may be replaced when useCache is set
     * @return The result, never an exception
     */
    @NotNull
    public CacheResult run(@NotNull CacheLayout layout, @NotNull String key, boolean useCache, boolean repairStale) {
        Path entry = layout.getEntry(key);

        if (useCache && Files.exists(entry, LinkOption.NOFOLLOW_LINKS)) {
            if (this.validator.isValid(entry)) {
                this.logger.info(StagingPipeline.class, "Using cached entry {}", entry);
                return CacheResult.hit(entry);
            } else if (!repairStale) {
                CacheFailure failure = CacheFailure.of(FailureKind.STALE_ENTRY, "Entry " + entry + " is incomplete or stale and repairing was not permitted");
                this.logger.warn(StagingPipeline.class, "{}", failure);
                return CacheResult.failed(entry, failure);
            }
            this.logger.info(StagingPipeline.class, "Entry {} is incomplete or stale, rebuilding it", entry);
        }

        Path staging = null;
        try {
            this.checkOwnership(entry, key);
            this.probe(key);
            try {
                staging = Files.createTempDirectory(layout.getStagingDirectory(), layout.getStagingPrefix(key));
            } catch (IOException e) {
                throw new StageException(FailureKind.IO_ERROR, "Unable to create staging directory in " + layout.getStagingDirectory(), e);
            }
            this.logger.debug(StagingPipeline.class, "Staging key '{}' in {}", key, staging);
            Path archive = this.fetch(key, staging);
            Path extracted = this.extract(archive, staging);
            this.validateAndMark(extracted, key);
            this.publish(layout, key, extracted);
            this.logger.info(StagingPipeline.class, "Published key '{}' to {}", key, entry);
            return CacheResult.published(entry);
        } catch (StageException e) {
            CacheFailure failure = e.failure;
            if (failure.requiresOperatorAttention()) {
                this.logger.error(StagingPipeline.class, "Manual cleanup required for key '{}': {}", key, failure);
            } else {
                this.logger.warn(StagingPipeline.class, "Unable to cache key '{}': {}", key, failure);
            }
            return CacheResult.failed(entry, failure);
        } finally {
            if (staging != null && !FileUtil.deleteQuietly(staging, this.logger)) {
                this.logger.warn(StagingPipeline.class, "Staging directory {} could not be fully removed", staging);
            }
        }
    }

    private void checkOwnership(@NotNull Path entry, @NotNull String key) throws StageException {
        Optional<Path> foreignMarker;
        try {
            foreignMarker = this.validator.findForeignMarker(entry, key);
        } catch (IOException e) {
            throw new StageException(FailureKind.IO_ERROR, "Unable to inspect existing entry " + entry, e);
        }
        if (foreignMarker.isPresent()) {
            throw new StageException(FailureKind.STALE_ENTRY, "Entry " + entry + " holds the completed entry of another key ("
                    + foreignMarker.get() + "), refusing to replace it", null);
        }
    }

    private void probe(@NotNull String key) throws StageException {
        Boolean available;
        try {
            available = ConcurrencyUtil.await(this.repository.isAvailable(key, this.executor));
        } catch (Exception e) {
            throw new StageException(FailureKind.UNAVAILABLE, "Unable to check availability of key '" + key + "' at " + this.repository.getRepositoryId(), e);
        }
        if (!Boolean.TRUE.equals(available)) {
            throw new StageException(FailureKind.UNAVAILABLE, "Repository " + this.repository.getRepositoryId() + " has no source archive for key '" + key + "'", null);
        }
    }

    @NotNull
    private Path fetch(@NotNull String key, @NotNull Path staging) throws StageException {
        byte[] data;
        try {
            data = ConcurrencyUtil.await(this.repository.getSource(key, this.executor));
        } catch (Exception e) {
            throw new StageException(FailureKind.TRANSFER_FAILED, "Unable to download key '" + key + "' from " + this.repository.getRepositoryId(), e);
        }
        if (data == null) {
            throw new StageException(FailureKind.TRANSFER_FAILED, "Repository " + this.repository.getRepositoryId() + " returned no data for key '" + key + "'", null);
        }

        Path archive = staging.resolve(StagingPipeline.ARCHIVE_FILE_NAME);
        try {
            Files.write(archive, data);
        } catch (IOException e) {
            throw new StageException(FailureKind.IO_ERROR, "Unable to store downloaded archive at " + archive, e);
        }
        return archive;
    }

    @NotNull
    private Path extract(@NotNull Path archive, @NotNull Path staging) throws StageException {
        Path extracted = staging.resolve(StagingPipeline.EXTRACTED_DIRECTORY_NAME);
        try {
            Files.createDirectory(extracted);
            this.extractor.extract(archive, extracted);
        } catch (UnsafeArchiveException e) {
            throw new StageException(FailureKind.UNSAFE_ARCHIVE, e.getMessage(), e);
        } catch (IOException e) {
            throw new StageException(FailureKind.EXTRACTION_FAILED, "Unable to extract " + archive, e);
        }
        return extracted;
    }

    private void validateAndMark(@NotNull Path extracted, @NotNull String key) throws StageException {
        if (!this.validator.containsPayload(extracted)) {
            throw new StageException(FailureKind.EMPTY_ARCHIVE, "Archive of key '" + key + "' contains no *" + this.validator.getPayloadSuffix() + " files", null);
        }
        try {
            this.validator.writeMarker(extracted, key);
        } catch (IOException e) {
            throw new StageException(FailureKind.IO_ERROR, "Unable to write completion marker into " + extracted, e);
        }
    }

    private void publish(@NotNull CacheLayout layout, @NotNull String key, @NotNull Path extracted) throws StageException {
        Path entry = layout.getEntry(key);
        Path backup = null;
        if (Files.exists(entry, LinkOption.NOFOLLOW_LINKS)) {
            Path candidate = layout.newBackupLocation(key);
            try {
                this.mover.move(entry, candidate);
            } catch (IOException e) {
                throw new StageException(FailureKind.PUBLISH_FAILED, "Unable to move previous entry " + entry + " aside, it was left in place", e);
            }
            backup = candidate;
            this.logger.debug(StagingPipeline.class, "Moved previous entry {} to {}", entry, backup);
        }

        try {
            this.mover.move(extracted, entry);
        } catch (IOException e) {
            if (backup == null) {
                throw new StageException(FailureKind.PUBLISH_FAILED, "Unable to move new tree into " + entry, e);
            }
            try {
                this.mover.move(backup, entry);
            } catch (IOException rollbackException) {
                CacheFailure rollback = CacheFailure.of(FailureKind.PUBLISH_FAILED, "Unable to restore previous entry from " + backup, rollbackException);
                throw new StageException(new CacheFailure(FailureKind.PUBLISH_FAILED, "Unable to move new tree into " + entry, e, rollback));
            }
            throw new StageException(FailureKind.PUBLISH_FAILED, "Unable to move new tree into " + entry + ", previous entry was restored", e);
        }

        if (backup != null && !FileUtil.deleteQuietly(backup, this.logger)) {
            this.logger.warn(StagingPipeline.class, "Previous entry of key '{}' could not be fully removed from {}", key, backup);
        }
    }
}
