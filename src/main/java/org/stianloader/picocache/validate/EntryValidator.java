package org.stianloader.picocache.validate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Decides whether a cache entry may be handed out as-is.
 *
 * <p>An entry is valid if and only if it is a directory, contains the {@link #MARKER_FILE_NAME completion marker}
 * and contains at least one payload file somewhere in its tree. Marker files of earlier naming conventions
 * are not recognised; entries carrying them are considered stale.
 *
 * <p>Validation never touches the network and never modifies the entry.
 */
public class EntryValidator {

    /**
     * The name of the completion marker. It is the last file written into an entry before it is published.
     */
    @NotNull
    public static final String MARKER_FILE_NAME = ".picocache-complete";

    private static final String KEY_PREFIX = "key=";

    @NotNull
    private final String payloadSuffix;

    public EntryValidator(@NotNull String payloadSuffix) {
        this.payloadSuffix = Objects.requireNonNull(payloadSuffix, "payloadSuffix may not be null").toLowerCase(Locale.ROOT);
        if (this.payloadSuffix.isEmpty()) {
            throw new IllegalArgumentException("payloadSuffix may not be empty");
        }
    }

    @NotNull
    @Contract(pure = true)
    public String getPayloadSuffix() {
        return this.payloadSuffix;
    }

    @Contract(pure = true)
    public boolean isPayload(@NotNull Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(this.payloadSuffix) && Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS);
    }

    /**
     * Checks whether the tree below the given directory contains at least one payload file.
     * Symbolic links are not followed.
     *
     * @param directory The directory to scan
     * @return True if a payload file exists, false if none exists or the directory could not be scanned
     */
    public boolean containsPayload(@NotNull Path directory) {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (Stream<Path> files = Files.walk(directory)) {
            return files.anyMatch(this::isPayload);
        } catch (IOException | UncheckedIOException e) {
            return false;
        }
    }

    public boolean isValid(@NotNull Path entry) {
        return Files.isDirectory(entry)
                && Files.isRegularFile(entry.resolve(EntryValidator.MARKER_FILE_NAME), LinkOption.NOFOLLOW_LINKS)
                && this.containsPayload(entry);
    }

    /**
     * Writes the completion marker into a freshly extracted tree. Must only be called once
     * {@link #containsPayload(Path)} holds for that tree.
     *
     * @param directory The tree to mark
     * @param key The key the tree is going to be published as
     * @throws IOException If the marker could not be written
     */
    public void writeMarker(@NotNull Path directory, @NotNull String key) throws IOException {
        String content = EntryValidator.KEY_PREFIX + key + "\ncompleted=" + Instant.now() + "\n";
        Files.write(directory.resolve(EntryValidator.MARKER_FILE_NAME), content.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /**
     * Reads the key recorded in a completion marker.
     *
     * @param marker The marker file
     * @return The recorded key, or null if the marker does not record one
     * @throws IOException If the marker could not be read
     */
    @Nullable
    public static String readMarkerKey(@NotNull Path marker) throws IOException {
        List<String> lines = Files.readAllLines(marker, StandardCharsets.UTF_8);
        for (String line : lines) {
            if (line.startsWith(EntryValidator.KEY_PREFIX)) {
                return line.substring(EntryValidator.KEY_PREFIX.length());
            }
        }
        return null;
    }

    /**
     * Searches a directory for the completion marker of a key other than the given one. Such a directory holds
     * (or contains) the entry of another key and must not be replaced on behalf of the given key. Markers that
     * do not record a key are ignored, as are symbolic links.
     *
     * @param directory The directory to search
     * @param key The key the directory is expected to belong to
     * @return The first marker naming another key, if any
     * @throws IOException If the directory could not be searched or a marker could not be read
     */
    @NotNull
    public Optional<Path> findForeignMarker(@NotNull Path directory, @NotNull String key) throws IOException {
        if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.walk(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Path name = file.getFileName();
                if (name == null || !name.toString().equals(EntryValidator.MARKER_FILE_NAME) || !Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                String recorded = EntryValidator.readMarkerKey(file);
                if (recorded != null && !recorded.equals(key)) {
                    return Optional.of(file);
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return Optional.empty();
    }
}
