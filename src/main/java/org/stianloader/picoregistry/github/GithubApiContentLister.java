package org.stianloader.picoregistry.github;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoregistry.logging.LoggingAdapter;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;

/**
 * A {@link GithubContentLister} that queries the
 * <a href="https://docs.github.com/en/rest/repos/contents">repository contents API</a>.
 */
public class GithubApiContentLister implements GithubContentLister {

    @NotNull
    public static final URI DEFAULT_API_BASE = URI.create("https://api.github.com/");

    @NotNull
    private final URI apiBase;
    @Nullable
    private String authToken;
    @Nullable
    private String branch;
    private int connectTimeout = 10_000;
    private int readTimeout = 30_000;

    public GithubApiContentLister() {
        this(GithubApiContentLister.DEFAULT_API_BASE);
    }

    public GithubApiContentLister(@NotNull URI apiBase) {
        Objects.requireNonNull(apiBase, "apiBase may not be null");
        if (apiBase.getPath() == null || apiBase.getPath().isEmpty()) {
            apiBase = apiBase.resolve("/");
        } else if (!apiBase.getPath().endsWith("/")) {
            apiBase = apiBase.resolve(apiBase.getPath() + "/");
        }
        this.apiBase = apiBase;
    }

    @NotNull
    @Contract(pure = true)
    public URI getAPIBase() {
        return this.apiBase;
    }

    /**
     * Set the token sent in the {@code Authorization} header. Unauthenticated requests are
     * subject to a much lower rate limit.
     *
     * @param authToken The token, or null to send unauthenticated requests
     * @return The current instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GithubApiContentLister setAuthToken(@Nullable String authToken) {
        this.authToken = authToken;
        return this;
    }

    /**
     * Set the branch, tag or commit to list. If unset the default branch of the repository is used.
     *
     * @param branch The git reference, or null for the default branch
     * @return The current instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GithubApiContentLister setBranch(@Nullable String branch) {
        this.branch = branch;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GithubApiContentLister setConnectTimeout(int connectTimeout) {
        if (connectTimeout < 0) {
            throw new IllegalArgumentException("connectTimeout may not be negative, got " + connectTimeout);
        }
        this.connectTimeout = connectTimeout;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GithubApiContentLister setReadTimeout(int readTimeout) {
        if (readTimeout < 0) {
            throw new IllegalArgumentException("readTimeout may not be negative, got " + readTimeout);
        }
        this.readTimeout = readTimeout;
        return this;
    }

    @NotNull
    private URI getContentsURI(@NotNull String owner, @NotNull String repository, @NotNull String path) throws IOException {
        StringBuilder relative = new StringBuilder("repos/").append(owner).append('/').append(repository).append("/contents");
        if (!path.isEmpty()) {
            relative.append('/').append(path);
        }
        try {
            URI contents = this.apiBase.resolve(new URI(null, null, relative.toString(), null));
            if (this.branch != null) {
                contents = new URI(contents.getScheme(), contents.getAuthority(), contents.getPath(), "ref=" + this.branch, null);
            }
            return contents;
        } catch (URISyntaxException e) {
            throw new IOException("Cannot build contents URI for " + owner + "/" + repository + "/" + path, e);
        }
    }

    @Override
    @NotNull
    public List<@NotNull GithubContentEntry> listDirectory(@NotNull String owner, @NotNull String repository, @NotNull String path) throws IOException {
        URI contents = this.getContentsURI(owner, repository, path);
        LoggingAdapter.getDefaultLogger().debug(GithubApiContentLister.class, "Listing {}", contents);

        URLConnection connection = contents.toURL().openConnection();
        connection.setConnectTimeout(this.connectTimeout);
        connection.setReadTimeout(this.readTimeout);
        if (connection instanceof HttpURLConnection) {
            HttpURLConnection httpConnection = (HttpURLConnection) connection;
            httpConnection.setRequestProperty("Accept", "application/vnd.github+json");
            if (this.authToken != null) {
                httpConnection.setRequestProperty("Authorization", "token " + this.authToken);
            }
            if ((httpConnection.getResponseCode() / 100) != 2) {
                throw new IOException("Query for " + connection.getURL() + " returned with a response code of " + httpConnection.getResponseCode() + " (" + httpConnection.getResponseMessage() + ")");
            }
        }

        try (InputStream is = connection.getInputStream();
                Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return GithubApiContentLister.parseListing(Json.parse(reader), contents);
        } catch (ParseException e) {
            throw new IOException("Malformed listing returned by " + contents, e);
        }
    }

    @NotNull
    private static List<@NotNull GithubContentEntry> parseListing(@NotNull JsonValue listing, @NotNull URI source) throws IOException {
        if (listing.isObject()) {
            // Listing a file rather than a directory
            return Collections.singletonList(GithubApiContentLister.parseEntry(listing.asObject(), source));
        } else if (!listing.isArray()) {
            throw new IOException("Expected a JSON array or object from " + source + ", got " + listing);
        }

        List<GithubContentEntry> entries = new ArrayList<>();
        for (JsonValue value : listing.asArray()) {
            if (!value.isObject()) {
                throw new IOException("Expected a JSON object within the listing of " + source + ", got " + value);
            }
            entries.add(GithubApiContentLister.parseEntry(value.asObject(), source));
        }
        return entries;
    }

    @NotNull
    private static GithubContentEntry parseEntry(@NotNull JsonObject entry, @NotNull URI source) throws IOException {
        String name = entry.getString("name", null);
        String type = entry.getString("type", null);
        if (name == null || type == null) {
            throw new IOException("Listing entry without name or type returned by " + source + ": " + entry);
        }
        String path = entry.getString("path", name);

        URI downloadURL = null;
        JsonValue download = entry.get("download_url");
        if (download != null && download.isString()) {
            try {
                downloadURL = new URI(download.asString());
            } catch (URISyntaxException e) {
                throw new IOException("Invalid download_url for " + path + " returned by " + source, e);
            }
        }
        return new GithubContentEntry(name, path, type, downloadURL);
    }
}
