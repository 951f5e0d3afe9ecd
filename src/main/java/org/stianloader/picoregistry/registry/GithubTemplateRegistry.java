package org.stianloader.picoregistry.registry;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoregistry.ArtifactType;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.github.GithubContentLister;

/**
 * A versioned registry that groups its templates into collections. Templates are stored as
 * {@code [path/]qualifier/name/version/name.(jinja|py)}, optionally accompanied by a
 * {@code .schema} file with the same name.
 *
 * <p>An example of such a registry is
 * <a href="https://github.com/kubernetes/application-dm-templates">github.com/kubernetes/application-dm-templates</a>.
 */
public class GithubTemplateRegistry extends AbstractGithubRegistry {

    @NotNull
    public static final String FORMAT = RegistryFormat.join(RegistryFormat.VERSIONED, RegistryFormat.COLLECTION);

    public GithubTemplateRegistry(@NotNull String name, @NotNull String shortURL, @NotNull GithubContentLister lister) throws RegistryException {
        super(name, shortURL, lister);
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getFormat() {
        return GithubTemplateRegistry.FORMAT;
    }

    @NotNull
    private static String getTemplateDirectory(@NotNull ArtifactType type) throws RegistryException {
        if (type.version() == null) {
            throw new RegistryException("Template \"" + type + "\" does not define a version");
        }
        String directory = type.name() + '/' + type.version();
        if (type.qualifier() != null) {
            directory = type.qualifier() + '/' + directory;
        }
        return directory;
    }

    @Override
    @NotNull
    public List<@NotNull URI> getDownloadURLs(@NotNull ArtifactType type) throws RegistryException {
        String directory = GithubTemplateRegistry.getTemplateDirectory(type);
        String jinja = type.name() + ".jinja";
        String python = type.name() + ".py";
        List<URI> urls = AbstractGithubRegistry.collectDownloadURLs(this.listDirectory(directory), (fileName) -> {
            return fileName.equals(jinja) || fileName.equals(python)
                    || fileName.equals(jinja + ".schema") || fileName.equals(python + ".schema");
        });
        if (urls.isEmpty()) {
            throw new RegistryException("Cannot find template \"" + type + "\" in registry \"" + this.getName() + "\"");
        }
        return Collections.unmodifiableList(urls);
    }

    @Override
    @NotNull
    public List<@NotNull ArtifactType> listTypes(@Nullable Pattern filter) throws RegistryException {
        List<ArtifactType> types = new ArrayList<>();
        for (String qualifier : this.listSubdirectories("")) {
            for (String name : this.listSubdirectories(qualifier)) {
                for (String version : this.listSubdirectories(qualifier + '/' + name)) {
                    ArtifactType type = ArtifactType.of(qualifier, name, version);
                    if (AbstractGithubRegistry.isAccepted(type, filter)) {
                        types.add(type);
                    }
                }
            }
        }
        return Collections.unmodifiableList(types);
    }
}
