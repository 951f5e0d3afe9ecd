package org.stianloader.picoregistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The abbreviated ("short") forms under which artifacts hosted on GitHub registries can be referenced.
 *
 * <p>The constants are declared in the order in which they must be tested:
 * every template reference also has the shape of a package reference, so
 * {@link #TEMPLATE} has to be tried before {@link #PACKAGE}. {@link #classify(String)}
 * does exactly that.
 */
public enum ShortTypeForm {

    /**
     * {@code github.com/owner/repo/qualifier/type:version}, for example
     * {@code github.com/kubernetes/application-dm-templates/storage/redis:v1}.
     * Used by registries that support versions and have collections.
     */
    TEMPLATE(Pattern.compile("github.com/(.*)/(.*)/(.*)/(.*):(.*)"), 5) {
        @Override
        @NotNull
        public ArtifactType createType(@NotNull List<@NotNull String> components) throws RegistryException {
            return ArtifactType.of(components.get(2), components.get(3), components.get(4));
        }
    },

    /**
     * {@code github.com/owner/repo/type}, for example {@code github.com/helm/charts/cassandra}.
     * Used by registries that neither support versions nor have collections.
     */
    PACKAGE(Pattern.compile("github.com/(.*)/(.*)/(.*)"), 3) {
        @Override
        @NotNull
        public ArtifactType createType(@NotNull List<@NotNull String> components) throws RegistryException {
            return ArtifactType.of(null, components.get(2), null);
        }
    };

    @NotNull
    private final Pattern pattern;
    private final int components;

    private ShortTypeForm(@NotNull Pattern pattern, int components) {
        this.pattern = pattern;
        this.components = components;
    }

    /**
     * Obtains the first form that matches the given reference, testing in declaration order.
     *
     * @param reference The type reference
     * @return The matching form, or null if the reference is not in a short form
     */
    @Nullable
    @Contract(pure = true)
    public static ShortTypeForm classify(@NotNull String reference) {
        for (ShortTypeForm form : ShortTypeForm.values()) {
            if (form.matches(reference)) {
                return form;
            }
        }
        return null;
    }

    @Contract(pure = true)
    public boolean matches(@NotNull String reference) {
        return this.pattern.matcher(reference).find();
    }

    /**
     * Obtains the captured components (owner, repo, [qualifier,] type[, version]) of a reference.
     *
     * @param reference The type reference
     * @return An unmodifiable list with exactly {@link #getComponentCount()} elements
     * @throws InvalidShortTypeException If the reference does not match this form or one of the components is empty
     */
    @NotNull
    public List<@NotNull String> extract(@NotNull String reference) throws InvalidShortTypeException {
        Matcher matcher = this.pattern.matcher(reference);
        if (!matcher.find()) {
            throw new InvalidShortTypeException(reference);
        }
        List<String> groups = new ArrayList<>(this.components);
        for (int i = 1; i <= this.components; i++) {
            String group = matcher.group(i);
            if (group.isEmpty()) {
                throw new InvalidShortTypeException(reference);
            }
            groups.add(group);
        }
        return Collections.unmodifiableList(groups);
    }

    /**
     * Create the {@link ArtifactType} referenced by the components {@link #extract(String) extracted}
     * from a reference of this form.
     *
     * @param components The extracted components
     * @return The referenced type
     * @throws RegistryException If the components do not form a valid type
     */
    @NotNull
    public abstract ArtifactType createType(@NotNull List<@NotNull String> components) throws RegistryException;

    @Contract(pure = true)
    public int getComponentCount() {
        return this.components;
    }
}
