package org.stianloader.picoregistry.service;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoregistry.RegistryNotFoundException;

/**
 * Persistent store of {@link RegistryRecord registry records}. Implementations may block on
 * storage or network IO and must be safe for concurrent use.
 */
public interface RegistryService {

    /**
     * Obtains the record with the given name.
     *
     * @param name The exact name of the registry
     * @return The stored record, never null
     * @throws RegistryNotFoundException If no record with that name exists
     */
    @NotNull
    RegistryRecord get(@NotNull String name) throws RegistryNotFoundException;

    /**
     * Obtains the record of the registry hosting the given URL. The URL may point to
     * an artifact within the registry, in which case the record whose URL is a prefix of
     * the given URL is returned. Schemes are ignored for the comparison.
     *
     * @param url The URL of the registry or of an artifact hosted by it
     * @return The stored record, never null
     * @throws RegistryNotFoundException If no record matches the URL
     */
    @NotNull
    RegistryRecord getByURL(@NotNull String url) throws RegistryNotFoundException;

    @NotNull
    List<@NotNull RegistryRecord> list();

    void create(@NotNull RegistryRecord record);

    void delete(@NotNull String name) throws RegistryNotFoundException;
}
