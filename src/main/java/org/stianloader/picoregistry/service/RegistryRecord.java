package org.stianloader.picoregistry.service;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * The persisted description of a registry, as stored by a {@link RegistryService}.
 *
 * @param name The canonical name of the registry
 * @param url The short URL of the registry, e.g. {@code github.com/helm/charts}
 * @param type The kind of registry, currently only {@link #GITHUB_TYPE} is understood
 * @param format A {@link org.stianloader.picoregistry.registry.RegistryFormat#TAG_DELIMITER delimiter}-separated
 * set of format tags, e.g. {@code versioned;collection}
 */
public final record RegistryRecord(@NotNull String name, @NotNull String url, @NotNull String type, @NotNull String format) {

    @NotNull
    public static final String GITHUB_TYPE = "github";

    public RegistryRecord {
        Objects.requireNonNull(name, "name may not be null");
        Objects.requireNonNull(url, "url may not be null");
        Objects.requireNonNull(type, "type may not be null");
        Objects.requireNonNull(format, "format may not be null");
    }
}
