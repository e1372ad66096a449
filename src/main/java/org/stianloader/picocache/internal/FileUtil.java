package org.stianloader.picocache.internal;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.logging.LoggingAdapter;

public final class FileUtil {

    private FileUtil() {
        throw new AssertionError();
    }

    /**
     * Recursively deletes a file or directory. Symbolic links are deleted, never followed.
     * Failures are logged and otherwise ignored; deletion continues with the remaining files.
     *
     * @param path The file or directory to delete
     * @param logger The adapter to report failures to
     * @return True if the path no longer exists afterwards
     */
    public static boolean deleteQuietly(@NotNull Path path, @NotNull LoggingAdapter logger) {
        if (Files.notExists(path, LinkOption.NOFOLLOW_LINKS)) {
            return true;
        }
        try {
            Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    FileUtil.deleteSingle(file, logger);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn(FileUtil.class, "Unable to access {} for deletion", file, exc);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        logger.warn(FileUtil.class, "Unable to list {} for deletion", dir, exc);
                    }
                    FileUtil.deleteSingle(dir, logger);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException | RuntimeException e) {
            logger.warn(FileUtil.class, "Unable to delete {}", path, e);
        }
        return Files.notExists(path, LinkOption.NOFOLLOW_LINKS);
    }

    private static void deleteSingle(@NotNull Path path, @NotNull LoggingAdapter logger) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn(FileUtil.class, "Unable to delete {}", path, e);
        }
    }
}
