package org.stianloader.picoregistry;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoregistry.internal.URLUtil;
import org.stianloader.picoregistry.registry.CachingRegistryProvider;
import org.stianloader.picoregistry.registry.Registry;
import org.stianloader.picoregistry.registry.RegistryProvider;

/**
 * Converts type references into the URLs from which the referenced files can be downloaded.
 *
 * <p>References are handled by the first of the following rules that applies:
 * <ol>
 * <li>{@link ShortTypeForm#TEMPLATE Template short forms} and</li>
 * <li>{@link ShortTypeForm#PACKAGE package short forms} are looked up in the registry whose
 * short URL prefixes the reference.</li>
 * <li>Absolute http(s) URLs are returned as-is.</li>
 * <li>Anything else is a primitive type that does not need to be downloaded, for which
 * no URLs are returned.</li>
 * </ol>
 */
public class DownloadURLResolver {

    @NotNull
    private final List<@NotNull ReferenceHandler> handlers;
    @NotNull
    private final RegistryProvider provider;

    public DownloadURLResolver() {
        this(new CachingRegistryProvider());
    }

    public DownloadURLResolver(@NotNull RegistryProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider may not be null");
        List<ReferenceHandler> handlers = new ArrayList<>();
        for (ShortTypeForm form : ShortTypeForm.values()) {
            handlers.add(new ReferenceHandler(form::matches, (reference) -> this.resolveShortType(form, reference)));
        }
        handlers.add(new ReferenceHandler(URLUtil::isHttpURL, DownloadURLResolver::resolveFullURL));
        this.handlers = Collections.unmodifiableList(handlers);
    }

    @NotNull
    private static List<@NotNull String> resolveFullURL(@NotNull String reference) throws InvalidDownloadURLException {
        try {
            // Authorities that are not valid host names (e.g. underscores) parse as registry-based and are kept verbatim
            return Collections.singletonList(new URI(reference).toString());
        } catch (URISyntaxException e) {
            throw new InvalidDownloadURLException(reference, e);
        }
    }

    @NotNull
    @Contract(pure = true)
    public RegistryProvider getProvider() {
        return this.provider;
    }

    /**
     * Obtains the URLs that should be used to fetch a type.
     *
     * @param reference The type reference, for example {@code github.com/helm/charts/cassandra}
     * @return The download URLs. Empty if the reference does not need to be fetched.
     * @throws RegistryException If the reference names a registry or artifact that cannot be resolved
     */
    @NotNull
    public List<@NotNull String> resolveDownloadURLs(@NotNull String reference) throws RegistryException {
        Objects.requireNonNull(reference, "reference may not be null");
        for (ReferenceHandler handler : this.handlers) {
            if (handler.matcher.matches(reference)) {
                return handler.resolver.resolve(reference);
            }
        }
        return Collections.emptyList();
    }

    @NotNull
    private List<@NotNull String> resolveShortType(@NotNull ShortTypeForm form, @NotNull String reference) throws RegistryException {
        List<String> components = form.extract(reference);
        Registry registry = this.provider.getRegistryByShortURL(reference);
        if (registry == null) {
            throw new RegistryInconsistencyException(reference);
        }
        ArtifactType type = form.createType(components);
        return Collections.unmodifiableList(URLUtil.toStrings(registry.getDownloadURLs(type)));
    }

    private static final class ReferenceHandler {
        @NotNull
        private final ReferenceMatcher matcher;
        @NotNull
        private final ReferenceResolver resolver;

        private ReferenceHandler(@NotNull ReferenceMatcher matcher, @NotNull ReferenceResolver resolver) {
            this.matcher = matcher;
            this.resolver = resolver;
        }
    }

    @FunctionalInterface
    private static interface ReferenceMatcher {
        boolean matches(@NotNull String reference);
    }

    @FunctionalInterface
    private static interface ReferenceResolver {
        @NotNull
        List<@NotNull String> resolve(@NotNull String reference) throws RegistryException;
    }
}
