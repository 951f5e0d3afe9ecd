package org.stianloader.picoregistry.registry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Registry} that is hosted within a GitHub repository.
 */
public interface GithubRegistry extends Registry {

    @NotNull
    @Contract(pure = true)
    String getOwner();

    @NotNull
    @Contract(pure = true)
    String getRepository();

    /**
     * Obtains the directory within the repository that acts as the root of the registry.
     *
     * @return The directory, without leading or trailing slashes. Empty if the repository root is used.
     */
    @NotNull
    @Contract(pure = true)
    String getPath();
}
