package org.stianloader.picoregistry;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of all failures raised while looking up, constructing or querying registries.
 * Failures are propagated to the caller as-is and are never retried by picoregistry.
 */
public class RegistryException extends Exception {

    private static final long serialVersionUID = -2186476517345981324L;

    public RegistryException(@NotNull String message) {
        super(message);
    }

    public RegistryException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
