package org.stianloader.picocache.archive;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.regex.Pattern;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarUtils;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.logging.LoggingAdapter;

/**
 * Extracts downloaded source archives while refusing entries that could escape the destination directory.
 *
 * <p>Three formats are understood: plain tar (ustar, GNU or V7), gzip-compressed tar and a single gzip-compressed file.
 * The latter is what arXiv serves for submissions consisting of a single document. It is stored under
 * a fixed file name.
 *
 * <p>Tar archives are read twice. The first pass only inspects the headers and rejects the whole
 * archive if any entry is absolute, contains a ".." segment, is a symbolic or hard link, or is a device or FIFO.
 * Only if the first pass found nothing to object to, the second pass writes the entries to disk.
 */
public class SafeArchiveExtractor {

    private static final int TAR_HEADER_SIZE = 512;
    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:.*");

    private enum ArchiveFormat {
        TAR,
        GZIP_TAR,
        GZIP_SINGLE_FILE;
    }

    @NotNull
    private final LoggingAdapter logger;
    @NotNull
    private final String singleFileName;

    /**
     * Constructor.
     *
     * @param logger The adapter to log to
     * @param singleFileName The name under which the content of single-file gzip archives is stored
     */
    public SafeArchiveExtractor(@NotNull LoggingAdapter logger, @NotNull String singleFileName) {
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
        this.singleFileName = Objects.requireNonNull(singleFileName, "singleFileName may not be null");
    }

    @NotNull
    private static InputStream open(@NotNull Path archive, @NotNull ArchiveFormat format) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(archive));
        if (format == ArchiveFormat.TAR) {
            return in;
        }
        try {
            return new GzipCompressorInputStream(in, true);
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    /**
     * Checks whether a block looks like the first header of a tar archive. Old (V7) archives carry no magic,
     * so a header with a valid checksum is accepted as well.
     *
     * @param header The first bytes of the (decompressed) stream
     * @param read The amount of valid bytes in header
     * @return True if the stream should be read as tar archive
     */
    private static boolean isTarHeader(byte @NotNull[] header, int read) {
        if (TarArchiveInputStream.matches(header, read)) {
            return true;
        }
        return read >= SafeArchiveExtractor.TAR_HEADER_SIZE && header[0] != 0 && TarUtils.verifyCheckSum(header);
    }

    @NotNull
    private static ArchiveFormat detectFormat(@NotNull Path archive) throws IOException {
        byte[] header = new byte[SafeArchiveExtractor.TAR_HEADER_SIZE];
        int read;
        try (InputStream in = Files.newInputStream(archive)) {
            read = in.readNBytes(header, 0, header.length);
        }
        if (read >= 2 && (header[0] & 0xFF) == 0x1F && (header[1] & 0xFF) == 0x8B) {
            try (InputStream in = SafeArchiveExtractor.open(archive, ArchiveFormat.GZIP_TAR)) {
                read = in.readNBytes(header, 0, header.length);
            }
            return SafeArchiveExtractor.isTarHeader(header, read) ? ArchiveFormat.GZIP_TAR : ArchiveFormat.GZIP_SINGLE_FILE;
        } else if (SafeArchiveExtractor.isTarHeader(header, read)) {
            return ArchiveFormat.TAR;
        }
        throw new IOException("Unrecognised archive format: " + archive.getFileName());
    }

    /**
     * Checks a single entry name for absolute paths and parent traversal.
     *
     * @param name The entry name as stored in the archive
     * @throws UnsafeArchiveException If the name is unsafe
     */
    static void checkName(@NotNull String name) throws UnsafeArchiveException {
        if (name.startsWith("/") || name.startsWith("\\") || SafeArchiveExtractor.DRIVE_LETTER.matcher(name).matches()) {
            throw new UnsafeArchiveException(name, "has an absolute path");
        }
        for (String segment : name.split("[/\\\\]")) {
            if (segment.equals("..")) {
                throw new UnsafeArchiveException(name, "traverses into a parent directory");
            }
        }
    }

    private static void checkEntry(@NotNull TarArchiveEntry entry) throws UnsafeArchiveException {
        String name = entry.getName();
        if (entry.isSymbolicLink()) {
            throw new UnsafeArchiveException(name, "is a symbolic link to \"" + entry.getLinkName() + "\"");
        } else if (entry.isLink()) {
            throw new UnsafeArchiveException(name, "is a hard link to \"" + entry.getLinkName() + "\"");
        } else if (entry.isCharacterDevice() || entry.isBlockDevice() || entry.isFIFO()) {
            throw new UnsafeArchiveException(name, "is a device or FIFO");
        } else if (!entry.isFile() && !entry.isDirectory()) {
            throw new UnsafeArchiveException(name, "has an unsupported entry type");
        }
        SafeArchiveExtractor.checkName(name);
    }

    @NotNull
    private static Path resolveInside(@NotNull Path destination, @NotNull String name) throws UnsafeArchiveException {
        Path target = destination.resolve(name).normalize();
        if (!target.startsWith(destination)) {
            throw new UnsafeArchiveException(name, "resolves outside of the extraction directory");
        }
        return target;
    }

    /**
     * Extracts an archive into the given directory. If this method throws, the destination
     * directory may contain leftovers and should be discarded by the caller.
     *
     * @param archive The archive to extract
     * @param destination An existing directory to extract into
     * @return The amount of files written
     * @throws UnsafeArchiveException If the archive contains an unsafe entry. Nothing was written in that case.
     * @throws IOException If the archive is malformed or could not be written
     */
    public int extract(@NotNull Path archive, @NotNull Path destination) throws IOException {
        Path dest = destination.toAbsolutePath().normalize();
        if (!Files.isDirectory(dest)) {
            throw new IOException("Extraction target " + dest + " is not a directory");
        }
        try {
            ArchiveFormat format = SafeArchiveExtractor.detectFormat(archive);
            if (format == ArchiveFormat.GZIP_SINGLE_FILE) {
                this.logger.debug(SafeArchiveExtractor.class, "{} is a single gzip-compressed file, storing it as {}", archive.getFileName(), this.singleFileName);
                try (InputStream in = SafeArchiveExtractor.open(archive, format)) {
                    Files.copy(in, SafeArchiveExtractor.resolveInside(dest, this.singleFileName));
                }
                return 1;
            }
            int entries = this.scan(archive, format, dest);
            this.logger.debug(SafeArchiveExtractor.class, "{} passed inspection ({} entries), extracting into {}", archive.getFileName(), entries, dest);
            return this.write(archive, format, dest);
        } catch (RuntimeException e) {
            // commons-compress reports some header corruptions unchecked
            throw new IOException("Malformed archive " + archive.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private int scan(@NotNull Path archive, @NotNull ArchiveFormat format, @NotNull Path dest) throws IOException {
        int count = 0;
        try (TarArchiveInputStream tar = new TarArchiveInputStream(SafeArchiveExtractor.open(archive, format))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                SafeArchiveExtractor.checkEntry(entry);
                SafeArchiveExtractor.resolveInside(dest, entry.getName());
                count++;
            }
        }
        return count;
    }

    private int write(@NotNull Path archive, @NotNull ArchiveFormat format, @NotNull Path dest) throws IOException {
        int files = 0;
        try (TarArchiveInputStream tar = new TarArchiveInputStream(SafeArchiveExtractor.open(archive, format))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                // The archive is re-read from disk, so every entry is checked again
                SafeArchiveExtractor.checkEntry(entry);
                Path target = SafeArchiveExtractor.resolveInside(dest, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                files++;
            }
        }
        return files;
    }
}
