package org.stianloader.picoregistry.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.RegistryInconsistencyException;
import org.stianloader.picoregistry.UnknownRegistryFormatException;
import org.stianloader.picoregistry.UnknownRegistryTypeException;
import org.stianloader.picoregistry.github.GithubApiContentLister;
import org.stianloader.picoregistry.github.GithubContentLister;
import org.stianloader.picoregistry.internal.URLUtil;
import org.stianloader.picoregistry.logging.LoggingAdapter;
import org.stianloader.picoregistry.service.InMemoryRegistryService;
import org.stianloader.picoregistry.service.RegistryRecord;
import org.stianloader.picoregistry.service.RegistryService;

/**
 * A {@link RegistryProvider} that lazily creates registries from the records of a {@link RegistryService}
 * and caches them for the lifetime of the provider. Cached registries are never evicted or refreshed.
 *
 * <p>Registries are cached under their {@link Registry#getName() own name}, which need not be the name
 * they were looked up with. Concurrent lookups of the same name or URL share a single construction;
 * no lock is held while the registry service or the factory run. Should two constructions for
 * different lookup keys end up producing a registry with the same name, the first one to be cached
 * is handed out to everyone, so that at most one instance per name exists.
 *
 * <p>Failed constructions are not cached, the next lookup will query the registry service again.
 * A factory or registry service that looks up the registry it is being asked to construct fails
 * with a {@link RegistryInconsistencyException} instead of waiting on itself.
 */
public class CachingRegistryProvider implements RegistryProvider, GithubRegistryFactory {

    @NotNull
    private final ConcurrentMap<String, Registry> registries = new ConcurrentHashMap<>();
    @NotNull
    private final ConcurrentMap<String, CompletableFuture<Registry>> constructions = new ConcurrentHashMap<>();
    /**
     * The keys whose construction is run by the current thread.
     */
    @NotNull
    private final ThreadLocal<Set<String>> ownedConstructions = ThreadLocal.withInitial(HashSet::new);
    @NotNull
    private final RegistryService service;
    @NotNull
    private final GithubRegistryFactory factory;
    @NotNull
    private final GithubContentLister lister;

    /**
     * Creates a provider backed by {@link InMemoryRegistryService#withDefaults()} which queries
     * the public GitHub API.
     */
    public CachingRegistryProvider() {
        this(null, null, new GithubApiContentLister());
    }

    public CachingRegistryProvider(@Nullable RegistryService service, @Nullable GithubRegistryFactory factory) {
        this(service, factory, new GithubApiContentLister());
    }

    /**
     * Constructor.
     *
     * @param service The source of registry records, or null to use {@link InMemoryRegistryService#withDefaults()}
     * @param factory The factory used to create registries, or null to use this provider as the factory
     * @param lister The lister used by registries created by this provider. Unused if another factory is supplied.
     */
    public CachingRegistryProvider(@Nullable RegistryService service, @Nullable GithubRegistryFactory factory, @NotNull GithubContentLister lister) {
        this.service = service == null ? InMemoryRegistryService.withDefaults() : service;
        this.factory = factory == null ? this : factory;
        this.lister = Objects.requireNonNull(lister, "lister may not be null");
    }

    @NotNull
    private static Registry await(@NotNull CompletableFuture<Registry> construction) throws RegistryException {
        try {
            return construction.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RegistryException) {
                throw (RegistryException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RegistryException("Registry construction failed", cause);
        }
    }

    @NotNull
    private Registry construct(@NotNull String key, @NotNull CacheLookup lookup, @NotNull RecordSource source) throws RegistryException {
        Set<String> owned = this.ownedConstructions.get();
        if (owned.contains(key)) {
            // Joining our own construction would never complete
            throw new RegistryInconsistencyException(key, "Registry factory or service re-entered the provider while constructing");
        }

        CompletableFuture<Registry> construction = new CompletableFuture<>();
        CompletableFuture<Registry> running = this.constructions.putIfAbsent(key, construction);
        if (running != null) {
            LoggingAdapter.getDefaultLogger().debug(CachingRegistryProvider.class, "Waiting on running construction for {}", key);
            return CachingRegistryProvider.await(running);
        }

        owned.add(key);
        try {
            // A construction for the same key may have finished between the cache lookup and claiming the key
            Registry registry = lookup.find();
            if (registry == null) {
                RegistryRecord record = source.fetch();
                LoggingAdapter.getDefaultLogger().debug(CachingRegistryProvider.class, "Constructing registry for {} from {}", key, record);
                Registry created = this.factory.getGithubRegistry(record);
                if (created == null) {
                    throw new RegistryInconsistencyException(record.name());
                }
                registry = this.registries.putIfAbsent(created.getName(), created);
                if (registry == null) {
                    LoggingAdapter.getDefaultLogger().info(CachingRegistryProvider.class, "Cached registry \"{}\" ({})", created.getName(), created.getShortURL());
                    registry = created;
                } else {
                    LoggingAdapter.getDefaultLogger().warn(CachingRegistryProvider.class, "Registry \"{}\" was cached concurrently; discarding the instance created for {}", created.getName(), key);
                }
            }
            construction.complete(registry);
            return registry;
        } catch (Throwable t) {
            construction.completeExceptionally(t);
            throw t;
        } finally {
            owned.remove(key);
            this.constructions.remove(key, construction);
        }
    }

    @Nullable
    private Registry findRegistryByShortURL(@NotNull String url) {
        String trimmed = URLUtil.trimScheme(url);
        for (Registry registry : this.registries.values()) {
            if (trimmed.startsWith(URLUtil.trimScheme(registry.getShortURL()))) {
                return registry;
            }
        }
        return null;
    }

    /**
     * Obtains a snapshot of all registries cached so far.
     *
     * @return An unmodifiable copy of the cached registries
     */
    @NotNull
    @Contract(pure = true, value = "-> new")
    public Collection<@NotNull Registry> getCachedRegistries() {
        return Collections.unmodifiableList(new ArrayList<>(this.registries.values()));
    }

    @Override
    @NotNull
    public GithubRegistry getGithubRegistry(@NotNull RegistryRecord record) throws RegistryException {
        if (!RegistryRecord.GITHUB_TYPE.equals(record.type())) {
            throw new UnknownRegistryTypeException(record.type());
        }

        Set<String> tags = RegistryFormat.parseTags(record.format());
        if (tags.equals(RegistryFormat.tagsOf(RegistryFormat.UNVERSIONED, RegistryFormat.ONE_LEVEL))) {
            return new GithubPackageRegistry(record.name(), record.url(), this.lister);
        } else if (tags.equals(RegistryFormat.tagsOf(RegistryFormat.VERSIONED, RegistryFormat.COLLECTION))) {
            return new GithubTemplateRegistry(record.name(), record.url(), this.lister);
        }

        throw new UnknownRegistryFormatException(record.format());
    }

    @Override
    @NotNull
    public Registry getRegistryByName(@NotNull String name) throws RegistryException {
        Objects.requireNonNull(name, "name may not be null");
        Registry registry = this.registries.get(name);
        if (registry != null) {
            return registry;
        }
        LoggingAdapter.getDefaultLogger().debug(CachingRegistryProvider.class, "Cache miss for registry name \"{}\"", name);
        return this.construct("name:" + name, () -> this.registries.get(name), () -> this.service.get(name));
    }

    @Override
    @NotNull
    public Registry getRegistryByShortURL(@NotNull String url) throws RegistryException {
        Objects.requireNonNull(url, "url may not be null");
        Registry registry = this.findRegistryByShortURL(url);
        if (registry != null) {
            return registry;
        }
        LoggingAdapter.getDefaultLogger().debug(CachingRegistryProvider.class, "Cache miss for registry URL \"{}\"", url);
        return this.construct("url:" + URLUtil.trimScheme(url), () -> this.findRegistryByShortURL(url), () -> this.service.getByURL(url));
    }

    @FunctionalInterface
    private static interface CacheLookup {
        @Nullable
        Registry find();
    }

    @FunctionalInterface
    private static interface RecordSource {
        @NotNull
        RegistryRecord fetch() throws RegistryException;
    }
}
