package no.cantara.definer.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An expression in the minimal core language, as delivered by the external macro expander.
 *
 * <p>Only three shapes exist. Special forms are {@link Application}s whose head is an
 * {@link Identifier} naming a {@link PrimitiveForm}; everything else is a generic combination.
 */
public sealed interface CoreExpr {

    /**
     * A literal value. Never an identifier, whatever its value looks like.
     */
    record Atom(Object value) implements CoreExpr {
        @Override
        public String toSource() {
            if (value instanceof String s) {
                return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            }
            if (value instanceof Boolean b) return b ? "#t" : "#f";
            return String.valueOf(value);
        }
    }

    /**
     * A symbolic name, the only candidate for free-identifier status.
     */
    record Identifier(String name) implements CoreExpr {
        public Identifier {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("identifier name must not be blank");
            }
        }

        @Override
        public String toSource() {
            return name;
        }
    }

    /**
     * An ordered sequence of sub-expressions.
     */
    record Application(List<CoreExpr> elements) implements CoreExpr {
        public Application {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        public boolean isEmpty() { return elements.isEmpty(); }
        public int size() { return elements.size(); }
        public CoreExpr get(int index) { return elements.get(index); }

        /** The elements after the first {@code n}, or an empty list when there are not that many. */
        public List<CoreExpr> drop(int n) {
            return n >= elements.size() ? List.of() : elements.subList(n, elements.size());
        }

        @Override
        public String toSource() {
            return elements.stream().map(CoreExpr::toSource).collect(Collectors.joining(" ", "(", ")"));
        }
    }

    /**
     * Renders this expression as an s-expression.
     */
    String toSource();

    static Atom atom(Object value) {
        return new Atom(value);
    }

    static Identifier id(String name) {
        return new Identifier(name);
    }

    static Application app(CoreExpr... elements) {
        return new Application(Arrays.asList(elements));
    }

    /** An application of identifiers only, e.g. a parameter list. */
    static Application list(String... names) {
        return new Application(Arrays.stream(names).map(CoreExpr::id).map(CoreExpr.class::cast).toList());
    }
}
