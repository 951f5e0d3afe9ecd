package org.stianloader.picoregistry.registry;

import java.net.URI;
import java.util.List;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoregistry.ArtifactType;
import org.stianloader.picoregistry.RegistryException;

/**
 * A named, URL-addressable source of downloadable artifacts.
 *
 * <p>Registry instances are shared between all users of a {@link RegistryProvider} and
 * therefore need to be safe for concurrent use. None of the implementations shipped
 * with picoregistry hold mutable state.
 */
public interface Registry {

    /**
     * Obtains the canonical name of the registry. {@link CachingRegistryProvider} caches
     * registries under this name.
     *
     * @return The name of the registry
     */
    @NotNull
    @Contract(pure = true)
    String getName();

    /**
     * Obtains the URL of the registry, with or without a scheme.
     * The URLs of all artifacts within the registry start with the short URL.
     *
     * @return The short URL, for example {@code github.com/helm/charts}
     */
    @NotNull
    @Contract(pure = true)
    String getShortURL();

    @NotNull
    @Contract(pure = true)
    String getType();

    /**
     * Obtains the format tags of the registry in their string form.
     *
     * @return The format string
     * @see RegistryFormat#parseTags(String)
     */
    @NotNull
    @Contract(pure = true)
    String getFormat();

    /**
     * List the artifacts within the registry.
     *
     * @param filter If not null, only types whose {@link ArtifactType#toString() string form}
     * contains a match of the pattern are returned
     * @return The artifacts within the registry
     * @throws RegistryException If the contents of the registry cannot be listed
     */
    @NotNull
    List<@NotNull ArtifactType> listTypes(@Nullable Pattern filter) throws RegistryException;

    /**
     * Obtains the URLs of the files that make up an artifact.
     *
     * @param type The artifact
     * @return The download URLs, never empty
     * @throws RegistryException If the artifact does not exist or the registry could not be queried
     */
    @NotNull
    List<@NotNull URI> getDownloadURLs(@NotNull ArtifactType type) throws RegistryException;
}
