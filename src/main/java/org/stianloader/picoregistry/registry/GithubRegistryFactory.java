package org.stianloader.picoregistry.registry;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.UnknownRegistryFormatException;
import org.stianloader.picoregistry.UnknownRegistryTypeException;
import org.stianloader.picoregistry.service.RegistryRecord;

/**
 * Turns {@link RegistryRecord registry records} into live {@link GithubRegistry} instances.
 * {@link CachingRegistryProvider} is its own default factory, but an alternate factory can
 * be supplied at construction time.
 */
@FunctionalInterface
public interface GithubRegistryFactory {

    /**
     * Construct the registry described by a record.
     *
     * @param record The registry record
     * @return The newly created registry
     * @throws UnknownRegistryTypeException If the record does not describe a GitHub registry
     * @throws UnknownRegistryFormatException If the format tags do not name a supported combination
     * @throws RegistryException If the registry cannot be created for other reasons, for example an invalid URL
     */
    @NotNull
    GithubRegistry getGithubRegistry(@NotNull RegistryRecord record) throws RegistryException;
}
