package org.stianloader.picoregistry;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a {@link org.stianloader.picoregistry.registry.RegistryProvider} breaks its contract
 * by neither returning a registry nor throwing an exception, or when a registry factory or service
 * asks the provider for the registry it is currently constructing.
 */
public class RegistryInconsistencyException extends RegistryException {

    private static final long serialVersionUID = 1617006632270947711L;

    public RegistryInconsistencyException(@NotNull String reference) {
        super("registry provider returned no registry and no error for " + reference);
    }

    public RegistryInconsistencyException(@NotNull String reference, @NotNull String message) {
        super(message + ": " + reference);
    }
}
