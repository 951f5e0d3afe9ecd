package org.stianloader.picoregistry;

import org.jetbrains.annotations.NotNull;

public class InvalidShortTypeException extends RegistryException {

    private static final long serialVersionUID = 8803215276405135961L;

    public InvalidShortTypeException(@NotNull String reference) {
        super("cannot parse short github url: " + reference);
    }
}
