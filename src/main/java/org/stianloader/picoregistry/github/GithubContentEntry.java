package org.stianloader.picoregistry.github;

import java.net.URI;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single file or directory within a GitHub repository.
 *
 * @param name The file name, without any directories
 * @param path The path relative to the repository root
 * @param type Either {@link #TYPE_FILE}, {@link #TYPE_DIRECTORY} or another type reported by GitHub (e.g. "symlink")
 * @param downloadURL The raw download URL, null for directories
 */
public final record GithubContentEntry(@NotNull String name, @NotNull String path, @NotNull String type, @Nullable URI downloadURL) {

    @NotNull
    public static final String TYPE_DIRECTORY = "dir";
    @NotNull
    public static final String TYPE_FILE = "file";

    @Contract(pure = true)
    public boolean isFile() {
        return TYPE_FILE.equals(this.type);
    }

    @Contract(pure = true)
    public boolean isDirectory() {
        return TYPE_DIRECTORY.equals(this.type);
    }
}
