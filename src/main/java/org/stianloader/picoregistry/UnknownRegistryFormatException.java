package org.stianloader.picoregistry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when the format tags of a registry record do not name a supported combination.
 */
public class UnknownRegistryFormatException extends RegistryException {

    private static final long serialVersionUID = 2315820938207125544L;

    @NotNull
    private final String format;

    public UnknownRegistryFormatException(@NotNull String format) {
        super("unknown registry format: " + format);
        this.format = format;
    }

    /**
     * Obtains the format string exactly as it was stored in the registry record.
     *
     * @return The literal format string
     */
    @NotNull
    @Contract(pure = true)
    public String getFormat() {
        return this.format;
    }
}
