package org.stianloader.picoregistry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An {@link ArtifactType} identifies a single artifact within a registry. Template registries
 * group artifacts into qualifiers (collections) and keep several versions of each artifact,
 * package registries only know about the name.
 *
 * <p>The textual form is {@code [qualifier/]name[:version]}, as produced by {@link #toString()}
 * and consumed by {@link #parse(String)}.
 */
public final record ArtifactType(@Nullable String qualifier, @NotNull String name, @Nullable String version) {

    @NotNull
    public static ArtifactType of(@Nullable String qualifier, @NotNull String name, @Nullable String version) throws RegistryException {
        if (name == null || name.isBlank()) {
            throw new RegistryException("Artifact type name may not be empty (qualifier: \"" + qualifier + "\", version: \"" + version + "\")");
        }
        return new ArtifactType(ArtifactType.emptyToNull(qualifier), name, ArtifactType.emptyToNull(version));
    }

    @NotNull
    public static ArtifactType parse(@NotNull String type) throws RegistryException {
        String qualifier = null;
        String version = null;
        String name = type;
        int colon = name.lastIndexOf(':');
        if (colon != -1) {
            version = name.substring(colon + 1);
            name = name.substring(0, colon);
        }
        int slash = name.lastIndexOf('/');
        if (slash != -1) {
            qualifier = name.substring(0, slash);
            name = name.substring(slash + 1);
        }
        return ArtifactType.of(qualifier, name, version);
    }

    @Nullable
    @Contract(pure = true, value = "null -> null")
    private static String emptyToNull(@Nullable String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.qualifier != null) {
            builder.append(this.qualifier).append('/');
        }
        builder.append(this.name);
        if (this.version != null) {
            builder.append(':').append(this.version);
        }
        return builder.toString();
    }
}
