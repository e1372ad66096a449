package org.stianloader.picocache.archive;

import java.io.IOException;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown if an archive contains an entry which could write outside of the extraction directory
 * or create something other than a plain file or directory. Archives causing this exception are never extracted.
 */
public class UnsafeArchiveException extends IOException {

    private static final long serialVersionUID = -2309151447913372904L;

    @NotNull
    private final String entryName;

    public UnsafeArchiveException(@NotNull String entryName, @NotNull String reason) {
        super("Refusing to extract archive: entry \"" + entryName + "\" " + reason);
        this.entryName = entryName;
    }

    /**
     * Obtains the name of the first offending entry, as stored in the archive.
     *
     * @return The entry name
     */
    @NotNull
    public String getEntryName() {
        return this.entryName;
    }
}
