package org.stianloader.picoregistry.registry;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.RegistryNotFoundException;

public interface RegistryProvider {

    /**
     * Obtains the registry whose short URL is a prefix of the given URL. The scheme of
     * both URLs is ignored. If several registries match, which one is returned is unspecified.
     *
     * @param url The URL of the registry or of an artifact within it
     * @return The registry
     * @throws RegistryNotFoundException If no registry is known for the URL
     * @throws RegistryException If the registry cannot be constructed
     */
    @NotNull
    Registry getRegistryByShortURL(@NotNull String url) throws RegistryException;

    /**
     * Obtains the registry with the given name.
     *
     * @param name The name of the registry
     * @return The registry
     * @throws RegistryNotFoundException If no registry with that name is known
     * @throws RegistryException If the registry cannot be constructed
     */
    @NotNull
    Registry getRegistryByName(@NotNull String name) throws RegistryException;
}
