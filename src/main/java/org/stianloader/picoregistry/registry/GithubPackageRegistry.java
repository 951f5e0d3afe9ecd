package org.stianloader.picoregistry.registry;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoregistry.ArtifactType;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.github.GithubContentLister;

/**
 * An unversioned registry where every package is a top-level directory. The manifests of a
 * package are the YAML files within {@code [path/]name/manifests}.
 *
 * <p>An example of such a registry is <a href="https://github.com/helm/charts">github.com/helm/charts</a>.
 */
public class GithubPackageRegistry extends AbstractGithubRegistry {

    @NotNull
    public static final String FORMAT = RegistryFormat.join(RegistryFormat.UNVERSIONED, RegistryFormat.ONE_LEVEL);

    public GithubPackageRegistry(@NotNull String name, @NotNull String shortURL, @NotNull GithubContentLister lister) throws RegistryException {
        super(name, shortURL, lister);
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getFormat() {
        return GithubPackageRegistry.FORMAT;
    }

    @Override
    @NotNull
    public List<@NotNull URI> getDownloadURLs(@NotNull ArtifactType type) throws RegistryException {
        // Qualifier and version are meaningless for package registries
        List<URI> urls = AbstractGithubRegistry.collectDownloadURLs(this.listDirectory(type.name() + "/manifests"), (fileName) -> {
            String lower = fileName.toLowerCase(Locale.ROOT);
            return lower.endsWith(".yaml") || lower.endsWith(".yml");
        });
        if (urls.isEmpty()) {
            throw new RegistryException("Cannot find manifests of package \"" + type.name() + "\" in registry \"" + this.getName() + "\"");
        }
        return Collections.unmodifiableList(urls);
    }

    @Override
    @NotNull
    public List<@NotNull ArtifactType> listTypes(@Nullable Pattern filter) throws RegistryException {
        List<ArtifactType> types = new ArrayList<>();
        for (String name : this.listSubdirectories("")) {
            ArtifactType type = ArtifactType.of(null, name, null);
            if (AbstractGithubRegistry.isAccepted(type, filter)) {
                types.add(type);
            }
        }
        return Collections.unmodifiableList(types);
    }
}
