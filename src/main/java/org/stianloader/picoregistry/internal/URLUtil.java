package org.stianloader.picoregistry.internal;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

public final class URLUtil {

    /**
     * Strips a leading {@code http://} or {@code https://} (case insensitive) from a URL.
     * Other schemes are kept.
     *
     * @param url The URL to trim
     * @return The URL without its http(s) scheme
     */
    @NotNull
    @Contract(pure = true)
    public static String trimScheme(@NotNull String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("https://")) {
            return url.substring(8);
        } else if (lower.startsWith("http://")) {
            return url.substring(7);
        }
        return url;
    }

    /**
     * Checks whether a string claims to be an http(s) URL, that is whether it starts with
     * {@code http://} or {@code https://} (case insensitive). The remainder of the URL is not validated.
     *
     * @param url The string to check
     * @return True if the string has an http or https scheme
     */
    @Contract(pure = true)
    public static boolean isHttpURL(@NotNull String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    @NotNull
    @Contract(pure = true, value = "_ -> new")
    public static List<String> toStrings(@NotNull Collection<URI> uris) {
        List<String> strings = new ArrayList<>(uris.size());
        for (URI uri : uris) {
            strings.add(uri.toString());
        }
        return strings;
    }

    private URLUtil() {
        throw new UnsupportedOperationException();
    }
}
