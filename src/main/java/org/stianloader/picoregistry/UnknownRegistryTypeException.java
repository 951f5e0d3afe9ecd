package org.stianloader.picoregistry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

public class UnknownRegistryTypeException extends RegistryException {

    private static final long serialVersionUID = -4051226396518307770L;

    @NotNull
    private final String registryType;

    public UnknownRegistryTypeException(@NotNull String registryType) {
        super("unknown registry type: " + registryType);
        this.registryType = registryType;
    }

    @NotNull
    @Contract(pure = true)
    public String getRegistryType() {
        return this.registryType;
    }
}
