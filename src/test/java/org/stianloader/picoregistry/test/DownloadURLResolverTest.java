package org.stianloader.picoregistry.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.stianloader.picoregistry.ArtifactType;
import org.stianloader.picoregistry.DownloadURLResolver;
import org.stianloader.picoregistry.InvalidDownloadURLException;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.RegistryInconsistencyException;
import org.stianloader.picoregistry.RegistryNotFoundException;
import org.stianloader.picoregistry.registry.CachingRegistryProvider;
import org.stianloader.picoregistry.registry.Registry;
import org.stianloader.picoregistry.registry.RegistryProvider;
import org.stianloader.picoregistry.service.InMemoryRegistryService;

public class DownloadURLResolverTest {

    private static final String TEMPLATE = "github.com/kubernetes/application-dm-templates/storage/redis:v1";
    private static final String PACKAGE = "github.com/helm/charts/cassandra";

    /**
     * A registry that records the types it is asked for.
     */
    private static class RecordingRegistry implements Registry {
        private final List<ArtifactType> requested = new ArrayList<>();
        private final String shortURL;

        public RecordingRegistry(String shortURL) {
            this.shortURL = shortURL;
        }

        @Override
        @NotNull
        public String getName() {
            return "recording";
        }

        @Override
        @NotNull
        public String getShortURL() {
            return this.shortURL;
        }

        @Override
        @NotNull
        public String getType() {
            return "recording";
        }

        @Override
        @NotNull
        public String getFormat() {
            return "";
        }

        @Override
        @NotNull
        public List<@NotNull ArtifactType> listTypes(@Nullable Pattern filter) {
            return Collections.unmodifiableList(this.requested);
        }

        @Override
        @NotNull
        public List<@NotNull URI> getDownloadURLs(@NotNull ArtifactType type) {
            this.requested.add(type);
            return Collections.singletonList(URI.create("https://example.com/" + type.name()));
        }
    }

    private static class FixedProvider implements RegistryProvider {
        private final Registry registry;
        private final List<String> urlQueries = new ArrayList<>();

        public FixedProvider(Registry registry) {
            this.registry = registry;
        }

        @Override
        public Registry getRegistryByShortURL(@NotNull String url) {
            this.urlQueries.add(url);
            return this.registry;
        }

        @Override
        public Registry getRegistryByName(@NotNull String name) {
            return this.registry;
        }
    }

    private static FakeContentLister createLister() {
        return new FakeContentLister()
                .addFile("kubernetes", "application-dm-templates", "storage/redis/v1/redis.jinja")
                .addFile("kubernetes", "application-dm-templates", "storage/redis/v1/redis.jinja.schema")
                .addFile("kubernetes", "application-dm-templates", "storage/redis/v1/README.md")
                .addFile("helm", "charts", "cassandra/manifests/cassandra-rc.yaml")
                .addFile("helm", "charts", "cassandra/manifests/cassandra-service.yaml");
    }

    @Test
    public void testTemplateShortForm() throws RegistryException {
        CountingRegistryService service = new CountingRegistryService(InMemoryRegistryService.withDefaults());
        CachingRegistryProvider provider = new CachingRegistryProvider(service, null, DownloadURLResolverTest.createLister());
        DownloadURLResolver resolver = new DownloadURLResolver(provider);

        assertEquals(Arrays.asList(FakeContentLister.rawURL("kubernetes", "application-dm-templates", "storage/redis/v1/redis.jinja"),
                FakeContentLister.rawURL("kubernetes", "application-dm-templates", "storage/redis/v1/redis.jinja.schema")),
                resolver.resolveDownloadURLs(TEMPLATE));
        assertEquals(1, service.urlLookups.get());
        assertEquals("github.com/kubernetes/application-dm-templates", provider.getRegistryByName("application-dm-templates").getShortURL());
        assertEquals(1, provider.getCachedRegistries().size());
    }

    @Test
    public void testPackageShortForm() throws RegistryException {
        CachingRegistryProvider provider = new CachingRegistryProvider(InMemoryRegistryService.withDefaults(), null, DownloadURLResolverTest.createLister());
        DownloadURLResolver resolver = new DownloadURLResolver(provider);

        assertEquals(Arrays.asList(FakeContentLister.rawURL("helm", "charts", "cassandra/manifests/cassandra-rc.yaml"),
                FakeContentLister.rawURL("helm", "charts", "cassandra/manifests/cassandra-service.yaml")),
                resolver.resolveDownloadURLs(PACKAGE));
        // Resolving twice uses the cached registry
        assertEquals(2, resolver.resolveDownloadURLs("https://" + PACKAGE).size());
        assertEquals(1, provider.getCachedRegistries().size());
    }

    @Test
    public void testTypesHandedToRegistry() throws RegistryException {
        RecordingRegistry registry = new RecordingRegistry("github.com/kubernetes/application-dm-templates");
        FixedProvider provider = new FixedProvider(registry);
        DownloadURLResolver resolver = new DownloadURLResolver(provider);

        assertEquals(Collections.singletonList("https://example.com/redis"), resolver.resolveDownloadURLs(TEMPLATE));
        assertEquals(Collections.singletonList("https://example.com/cassandra"), resolver.resolveDownloadURLs(PACKAGE));

        assertEquals(new ArtifactType("storage", "redis", "v1"), registry.requested.get(0));
        ArtifactType pkg = registry.requested.get(1);
        assertEquals("cassandra", pkg.name());
        assertNull(pkg.qualifier());
        assertNull(pkg.version());
        // The full reference is used to look up the registry
        assertEquals(Arrays.asList(TEMPLATE, PACKAGE), provider.urlQueries);
    }

    @Test
    public void testFullURL() throws RegistryException {
        CountingRegistryService service = new CountingRegistryService(InMemoryRegistryService.withDefaults());
        DownloadURLResolver resolver = new DownloadURLResolver(new CachingRegistryProvider(service, null, new FakeContentLister()));

        assertEquals(Collections.singletonList("https://example.com/blob/file.yaml"), resolver.resolveDownloadURLs("https://example.com/blob/file.yaml"));
        assertEquals(Collections.singletonList("http://example.com/a/b.jinja?raw=true"), resolver.resolveDownloadURLs("http://example.com/a/b.jinja?raw=true"));
        assertEquals(0, service.totalLookups());
    }

    @Test
    public void testFullURLWithRegistryAuthority() throws RegistryException {
        CountingRegistryService service = new CountingRegistryService(InMemoryRegistryService.withDefaults());
        DownloadURLResolver resolver = new DownloadURLResolver(new CachingRegistryProvider(service, null, new FakeContentLister()));

        assertEquals(Collections.singletonList("https://raw_files.example.com/blob/file.yaml"), resolver.resolveDownloadURLs("https://raw_files.example.com/blob/file.yaml"));
        assertEquals(Collections.singletonList("HTTPS://example.com/blob/file.yaml"), resolver.resolveDownloadURLs("HTTPS://example.com/blob/file.yaml"));
        assertEquals(0, service.totalLookups());
    }

    @Test
    public void testInvalidFullURL() {
        DownloadURLResolver resolver = new DownloadURLResolver(new CachingRegistryProvider(InMemoryRegistryService.withDefaults(), null, new FakeContentLister()));

        InvalidDownloadURLException ex = assertThrows(InvalidDownloadURLException.class, () -> resolver.resolveDownloadURLs("https://example.com/a b.yaml"));
        assertInstanceOf(URISyntaxException.class, ex.getCause());
        assertThrows(InvalidDownloadURLException.class, () -> resolver.resolveDownloadURLs("http://"));
        assertThrows(InvalidDownloadURLException.class, () -> resolver.resolveDownloadURLs("https://example.com/%zz"));
    }

    @Test
    public void testPrimitiveTypes() throws RegistryException {
        CountingRegistryService service = new CountingRegistryService(InMemoryRegistryService.withDefaults());
        DownloadURLResolver resolver = new DownloadURLResolver(new CachingRegistryProvider(service, null, new FakeContentLister()));

        assertTrue(resolver.resolveDownloadURLs("string").isEmpty());
        assertTrue(resolver.resolveDownloadURLs("compute.v1.instance").isEmpty());
        assertTrue(resolver.resolveDownloadURLs("ftp://example.com/file.yaml").isEmpty());
        assertEquals(0, service.totalLookups());
    }

    @Test
    public void testUnknownRegistry() {
        DownloadURLResolver resolver = new DownloadURLResolver(new CachingRegistryProvider(InMemoryRegistryService.withDefaults(), null, new FakeContentLister()));
        assertThrows(RegistryNotFoundException.class, () -> resolver.resolveDownloadURLs("github.com/nobody/nothing/thing"));
        assertThrows(RegistryNotFoundException.class, () -> resolver.resolveDownloadURLs("github.com/nobody/nothing/storage/thing:v1"));
    }

    @Test
    public void testMissingArtifact() {
        DownloadURLResolver resolver = new DownloadURLResolver(new CachingRegistryProvider(InMemoryRegistryService.withDefaults(), null, DownloadURLResolverTest.createLister()));
        assertThrows(RegistryException.class, () -> resolver.resolveDownloadURLs("github.com/helm/charts/redis"));
        assertThrows(RegistryException.class, () -> resolver.resolveDownloadURLs("github.com/kubernetes/application-dm-templates/storage/redis:v9"));
    }

    @Test
    public void testProviderWithoutRegistry() {
        DownloadURLResolver resolver = new DownloadURLResolver(new FixedProvider(null));
        assertThrows(RegistryInconsistencyException.class, () -> resolver.resolveDownloadURLs(TEMPLATE));
        assertThrows(RegistryInconsistencyException.class, () -> resolver.resolveDownloadURLs(PACKAGE));
    }
}
