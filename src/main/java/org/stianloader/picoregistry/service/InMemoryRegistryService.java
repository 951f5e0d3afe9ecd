package org.stianloader.picoregistry.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoregistry.RegistryNotFoundException;
import org.stianloader.picoregistry.internal.URLUtil;

/**
 * A {@link RegistryService} that keeps its records in memory. Records are lost
 * once the instance is discarded.
 */
public class InMemoryRegistryService implements RegistryService {

    @NotNull
    private final ConcurrentMap<String, RegistryRecord> records = new ConcurrentHashMap<>();

    /**
     * Creates a service that knows about the helm charts package registry ("charts") and the
     * kubernetes template registry ("application-dm-templates").
     *
     * @return A newly created, pre-populated service
     */
    @NotNull
    @Contract(pure = true, value = "-> new")
    public static InMemoryRegistryService withDefaults() {
        InMemoryRegistryService service = new InMemoryRegistryService();
        service.create(new RegistryRecord("charts", "github.com/helm/charts", RegistryRecord.GITHUB_TYPE, "unversioned;one-level"));
        service.create(new RegistryRecord("application-dm-templates", "github.com/kubernetes/application-dm-templates", RegistryRecord.GITHUB_TYPE, "versioned;collection"));
        return service;
    }

    @Override
    @NotNull
    public RegistryRecord get(@NotNull String name) throws RegistryNotFoundException {
        RegistryRecord record = this.records.get(name);
        if (record == null) {
            throw new RegistryNotFoundException(name, "Failed to find registry named \"" + name + "\"");
        }
        return record;
    }

    @Override
    @NotNull
    public RegistryRecord getByURL(@NotNull String url) throws RegistryNotFoundException {
        String trimmed = URLUtil.trimScheme(url);
        for (RegistryRecord record : this.records.values()) {
            if (trimmed.startsWith(URLUtil.trimScheme(record.url()))) {
                return record;
            }
        }
        throw new RegistryNotFoundException(url, "Failed to find registry for url \"" + url + "\"");
    }

    @Override
    @NotNull
    public List<@NotNull RegistryRecord> list() {
        return new ArrayList<>(this.records.values());
    }

    @Override
    public void create(@NotNull RegistryRecord record) {
        Objects.requireNonNull(record, "record may not be null");
        if (this.records.putIfAbsent(record.name(), record) != null) {
            throw new IllegalStateException("There is already a registry with the name \"" + record.name() + "\" registered!");
        }
    }

    @Override
    public void delete(@NotNull String name) throws RegistryNotFoundException {
        if (this.records.remove(name) == null) {
            throw new RegistryNotFoundException(name, "Failed to find registry named \"" + name + "\"");
        }
    }
}
