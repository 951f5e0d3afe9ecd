package org.stianloader.picoregistry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when the registry service holds no record for a registry name or URL.
 */
public class RegistryNotFoundException extends RegistryException {

    private static final long serialVersionUID = 5460131808622431076L;

    @NotNull
    private final String query;

    public RegistryNotFoundException(@NotNull String query, @NotNull String message) {
        super(message);
        this.query = query;
    }

    /**
     * Obtains the name or URL for which no registry record exists.
     *
     * @return The queried name or URL
     */
    @NotNull
    @Contract(pure = true)
    public String getQuery() {
        return this.query;
    }
}
