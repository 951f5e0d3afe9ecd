package org.stianloader.picoregistry.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.stianloader.picoregistry.ArtifactType;
import org.stianloader.picoregistry.InvalidShortTypeException;
import org.stianloader.picoregistry.RegistryException;
import org.stianloader.picoregistry.ShortTypeForm;

public class ShortTypeFormTest {

    @Test
    public void testTemplateTakesPriority() {
        String template = "github.com/kubernetes/application-dm-templates/storage/redis:v1";
        // The package pattern matches as well, which is why the order matters
        assertTrue(ShortTypeForm.PACKAGE.matches(template));
        assertEquals(ShortTypeForm.TEMPLATE, ShortTypeForm.classify(template));
        assertEquals(ShortTypeForm.TEMPLATE, ShortTypeForm.values()[0]);
    }

    @Test
    public void testClassify() {
        assertEquals(ShortTypeForm.PACKAGE, ShortTypeForm.classify("github.com/helm/charts/cassandra"));
        assertEquals(ShortTypeForm.PACKAGE, ShortTypeForm.classify("https://github.com/helm/charts/cassandra"));
        assertNull(ShortTypeForm.classify("https://example.com/blob/file.yaml"));
        assertNull(ShortTypeForm.classify("string"));
        assertNull(ShortTypeForm.classify("github.com/helm/charts"));
    }

    @Test
    public void testExtract() throws RegistryException {
        assertEquals(Arrays.asList("kubernetes", "application-dm-templates", "storage", "redis", "v1"),
                ShortTypeForm.TEMPLATE.extract("github.com/kubernetes/application-dm-templates/storage/redis:v1"));
        assertEquals(Arrays.asList("helm", "charts", "cassandra"),
                ShortTypeForm.PACKAGE.extract("github.com/helm/charts/cassandra"));
        assertThrows(InvalidShortTypeException.class, () -> ShortTypeForm.TEMPLATE.extract("github.com/helm/charts/cassandra"));
        assertThrows(InvalidShortTypeException.class, () -> ShortTypeForm.PACKAGE.extract("string"));
    }

    @Test
    public void testEmptyComponentsRejected() {
        assertTrue(ShortTypeForm.TEMPLATE.matches("github.com/kubernetes/application-dm-templates/storage/redis:"));
        assertThrows(InvalidShortTypeException.class, () -> ShortTypeForm.TEMPLATE.extract("github.com/kubernetes/application-dm-templates/storage/redis:"));
        assertThrows(InvalidShortTypeException.class, () -> ShortTypeForm.TEMPLATE.extract("github.com/kubernetes/application-dm-templates//redis:v1"));
        assertThrows(InvalidShortTypeException.class, () -> ShortTypeForm.PACKAGE.extract("github.com/helm//cassandra"));
        assertThrows(InvalidShortTypeException.class, () -> ShortTypeForm.PACKAGE.extract("github.com/helm/charts/"));
    }

    @Test
    public void testCreateType() throws RegistryException {
        ArtifactType template = ShortTypeForm.TEMPLATE.createType(ShortTypeForm.TEMPLATE.extract("github.com/kubernetes/application-dm-templates/storage/redis:v1"));
        assertEquals(new ArtifactType("storage", "redis", "v1"), template);

        ArtifactType pkg = ShortTypeForm.PACKAGE.createType(ShortTypeForm.PACKAGE.extract("github.com/helm/charts/cassandra"));
        assertEquals(new ArtifactType(null, "cassandra", null), pkg);
    }
}
