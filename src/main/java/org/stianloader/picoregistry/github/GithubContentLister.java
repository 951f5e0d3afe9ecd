package org.stianloader.picoregistry.github;

import java.io.IOException;
import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Lists the contents of directories within GitHub repositories. Registries backed by GitHub
 * use the lister to discover artifacts and their download URLs.
 */
public interface GithubContentLister {

    /**
     * List the direct children of a directory.
     *
     * @param owner The owner of the repository
     * @param repository The name of the repository
     * @param path The path of the directory relative to the repository root, empty for the root
     * @return The files and directories within the directory
     * @throws IOException If the listing could not be obtained, including when the directory does not exist
     */
    @NotNull
    List<@NotNull GithubContentEntry> listDirectory(@NotNull String owner, @NotNull String repository, @NotNull String path) throws IOException;
}
