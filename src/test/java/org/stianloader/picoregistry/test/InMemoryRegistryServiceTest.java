package org.stianloader.picoregistry.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.stianloader.picoregistry.RegistryNotFoundException;
import org.stianloader.picoregistry.service.InMemoryRegistryService;
import org.stianloader.picoregistry.service.RegistryRecord;

public class InMemoryRegistryServiceTest {

    @Test
    public void testDefaults() throws RegistryNotFoundException {
        InMemoryRegistryService service = InMemoryRegistryService.withDefaults();
        assertEquals(2, service.list().size());
        assertEquals(new RegistryRecord("charts", "github.com/helm/charts", "github", "unversioned;one-level"), service.get("charts"));
        assertEquals("versioned;collection", service.get("application-dm-templates").format());
    }

    @Test
    public void testGetByURL() throws RegistryNotFoundException {
        InMemoryRegistryService service = InMemoryRegistryService.withDefaults();
        assertEquals("charts", service.getByURL("github.com/helm/charts").name());
        assertEquals("charts", service.getByURL("https://github.com/helm/charts/cassandra").name());
        assertEquals("application-dm-templates", service.getByURL("http://github.com/kubernetes/application-dm-templates/storage/redis:v1").name());
        RegistryNotFoundException ex = assertThrows(RegistryNotFoundException.class, () -> service.getByURL("github.com/helm/other"));
        assertEquals("github.com/helm/other", ex.getQuery());
    }

    @Test
    public void testCreateAndDelete() throws RegistryNotFoundException {
        InMemoryRegistryService service = new InMemoryRegistryService();
        RegistryRecord record = new RegistryRecord("acme", "https://github.com/acme/templates", RegistryRecord.GITHUB_TYPE, "versioned;collection");
        service.create(record);
        assertEquals(record, service.getByURL("github.com/acme/templates/a/b:v1"));
        assertThrows(IllegalStateException.class, () -> service.create(record));

        service.delete("acme");
        assertThrows(RegistryNotFoundException.class, () -> service.get("acme"));
        assertThrows(RegistryNotFoundException.class, () -> service.delete("acme"));
        assertEquals(0, service.list().size());
    }
}
