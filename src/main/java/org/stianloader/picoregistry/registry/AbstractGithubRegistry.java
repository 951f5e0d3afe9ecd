package org.stianloader.picoregistry.registry;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoregistry.ArtifactType;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.github.GithubContentEntry;
import org.stianloader.picoregistry.github.GithubContentLister;
import org.stianloader.picoregistry.internal.URLUtil;
import org.stianloader.picoregistry.service.RegistryRecord;

/**
 * Base class of registries hosted within GitHub repositories. The short URL of such registries
 * has the form {@code [scheme://]github.com/owner/repository[/path]}.
 */
public abstract class AbstractGithubRegistry implements GithubRegistry {

    private static final Pattern SHORT_URL_PATTERN = Pattern.compile("^github\\.com/([^/]+)/([^/]+)(?:/(.*?))?/*$");

    @NotNull
    private final String name;
    @NotNull
    private final String shortURL;
    @NotNull
    private final String owner;
    @NotNull
    private final String repository;
    @NotNull
    private final String path;
    @NotNull
    private final GithubContentLister lister;

    protected AbstractGithubRegistry(@NotNull String name, @NotNull String shortURL, @NotNull GithubContentLister lister) throws RegistryException {
        this.name = Objects.requireNonNull(name, "name may not be null");
        this.shortURL = Objects.requireNonNull(shortURL, "shortURL may not be null");
        this.lister = Objects.requireNonNull(lister, "lister may not be null");

        Matcher matcher = SHORT_URL_PATTERN.matcher(URLUtil.trimScheme(shortURL));
        if (!matcher.matches()) {
            throw new RegistryException("Registry \"" + name + "\" has an URL that does not point to a GitHub repository: " + shortURL);
        }
        this.owner = matcher.group(1);
        this.repository = matcher.group(2);
        String path = matcher.group(3);
        this.path = path == null ? "" : path;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getShortURL() {
        return this.shortURL;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getType() {
        return RegistryRecord.GITHUB_TYPE;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getOwner() {
        return this.owner;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getRepository() {
        return this.repository;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getPath() {
        return this.path;
    }

    /**
     * Resolve a path relative to the registry root into a path relative to the repository root.
     */
    @NotNull
    @Contract(pure = true)
    protected String toRepositoryPath(@NotNull String relativePath) {
        if (this.path.isEmpty()) {
            return relativePath;
        } else if (relativePath.isEmpty()) {
            return this.path;
        }
        return this.path + '/' + relativePath;
    }

    @NotNull
    protected List<@NotNull GithubContentEntry> listDirectory(@NotNull String relativePath) throws RegistryException {
        String repositoryPath = this.toRepositoryPath(relativePath);
        try {
            return this.lister.listDirectory(this.owner, this.repository, repositoryPath);
        } catch (IOException e) {
            throw new RegistryException("Failed to list " + this.owner + "/" + this.repository + "/" + repositoryPath + " of registry \"" + this.name + "\"", e);
        }
    }

    @NotNull
    protected List<@NotNull String> listSubdirectories(@NotNull String relativePath) throws RegistryException {
        List<String> directories = new ArrayList<>();
        for (GithubContentEntry entry : this.listDirectory(relativePath)) {
            if (entry.isDirectory()) {
                directories.add(entry.name());
            }
        }
        return directories;
    }

    @Contract(pure = true)
    protected static boolean isAccepted(@NotNull ArtifactType type, @Nullable Pattern filter) {
        return filter == null || filter.matcher(type.toString()).find();
    }

    @NotNull
    protected static List<@NotNull URI> collectDownloadURLs(@NotNull List<@NotNull GithubContentEntry> entries, @NotNull FileFilter filter) {
        List<URI> urls = new ArrayList<>();
        for (GithubContentEntry entry : entries) {
            URI downloadURL = entry.downloadURL();
            if (entry.isFile() && downloadURL != null && filter.accept(entry.name())) {
                urls.add(downloadURL);
            }
        }
        return urls;
    }

    @FunctionalInterface
    protected static interface FileFilter {
        boolean accept(@NotNull String fileName);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[name=" + this.name + ", url=" + this.shortURL + ", format=" + this.getFormat() + "]";
    }
}
