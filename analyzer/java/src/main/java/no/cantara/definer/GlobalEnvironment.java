package no.cantara.definer;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A fixed set of globally defined names.
 */
public final class GlobalEnvironment implements GlobalResolver {

    static final String STANDARD_RESOURCE = "standard-globals.yaml";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));
    private static final GlobalEnvironment EMPTY = new GlobalEnvironment(Set.of());

    private final Set<String> names;

    private GlobalEnvironment(Collection<String> names) {
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public static GlobalEnvironment empty() {
        return EMPTY;
    }

    public static GlobalEnvironment of(String... names) {
        return new GlobalEnvironment(Arrays.asList(names));
    }

    public static GlobalEnvironment of(Collection<String> names) {
        return new GlobalEnvironment(names);
    }

    /**
     * The Scheme base-library names bundled with this library.
     */
    public static GlobalEnvironment standard() {
        return StandardHolder.STANDARD;
    }

    /** A new environment that also defines {@code more}. */
    public GlobalEnvironment with(Collection<String> more) {
        if (more.isEmpty()) return this;
        Set<String> next = new LinkedHashSet<>(names);
        next.addAll(more);
        return new GlobalEnvironment(next);
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public boolean isGloballyDefined(String name) {
        return names.contains(name);
    }

    @Override
    public String toString() {
        return "GlobalEnvironment[" + names.size() + " name(s)]";
    }

    @SuppressWarnings("unchecked")
    static GlobalEnvironment loadResource(String resource) {
        try (InputStream is = GlobalEnvironment.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Missing classpath resource: " + resource);
            }
            Map<String, Object> data = YAML.load(is);
            List<String> names = (List<String>) data.getOrDefault("globals", List.of());
            return new GlobalEnvironment(names);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    private static final class StandardHolder {
        static final GlobalEnvironment STANDARD = loadResource(STANDARD_RESOURCE);
    }
}
