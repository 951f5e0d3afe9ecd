package org.stianloader.picoregistry;

import java.net.URISyntaxException;

import org.jetbrains.annotations.NotNull;

public class InvalidDownloadURLException extends RegistryException {

    private static final long serialVersionUID = -7420795563326090193L;

    public InvalidDownloadURLException(@NotNull String reference, @NotNull URISyntaxException cause) {
        super("cannot parse download URL " + reference + ": " + cause.getMessage(), cause);
    }
}
