package org.stianloader.picoregistry.registry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The known format tags of a registry. A registry record stores its tags as a single
 * string, joined by {@link #TAG_DELIMITER}. The order of the tags is irrelevant.
 */
public enum RegistryFormat {

    /**
     * Artifacts are kept in several versions.
     */
    VERSIONED("versioned"),

    /**
     * Only the latest revision of an artifact is available.
     */
    UNVERSIONED("unversioned"),

    /**
     * Artifacts are grouped into collections (qualifiers).
     */
    COLLECTION("collection"),

    /**
     * All artifacts live at the top level of the registry.
     */
    ONE_LEVEL("one-level");

    public static final char TAG_DELIMITER = ';';

    @NotNull
    private final String tag;

    private RegistryFormat(@NotNull String tag) {
        this.tag = tag;
    }

    @NotNull
    @Contract(pure = true)
    public String getTag() {
        return this.tag;
    }

    @NotNull
    @Contract(pure = true)
    public static String join(@NotNull RegistryFormat @NotNull... formats) {
        StringBuilder builder = new StringBuilder();
        for (RegistryFormat format : formats) {
            if (builder.length() != 0) {
                builder.append(TAG_DELIMITER);
            }
            builder.append(format.tag);
        }
        return builder.toString();
    }

    /**
     * Split a format string into its tags. Surrounding whitespace and empty tags are dropped,
     * duplicates collapse. Tags that are not known to this enum are retained.
     *
     * @param format The format string of a registry record
     * @return An unmodifiable set of the tags
     */
    @NotNull
    @Contract(pure = true)
    public static Set<@NotNull String> parseTags(@NotNull String format) {
        Set<String> tags = new LinkedHashSet<>();
        int start = 0;
        while (start <= format.length()) {
            int end = format.indexOf(TAG_DELIMITER, start);
            if (end == -1) {
                end = format.length();
            }
            String tag = format.substring(start, end).trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
            start = end + 1;
        }
        return Collections.unmodifiableSet(tags);
    }

    @NotNull
    @Contract(pure = true)
    public static Set<@NotNull String> tagsOf(@NotNull RegistryFormat @NotNull... formats) {
        Set<String> tags = new LinkedHashSet<>();
        for (RegistryFormat format : formats) {
            tags.add(format.tag);
        }
        return Collections.unmodifiableSet(tags);
    }
}
