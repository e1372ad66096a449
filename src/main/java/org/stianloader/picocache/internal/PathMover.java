package org.stianloader.picocache.internal;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renames a file or directory. Used by the {@link StagingPipeline} for every rename of the publish step.
 */
@FunctionalInterface
public interface PathMover {
    void move(Path source, Path target) throws IOException;
}
