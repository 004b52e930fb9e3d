package no.cantara.definer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One alternative description of a {@link Unit}: opaque text, a wrapped core expression,
 * or an ordered compound of other representations.
 *
 * <p>Representations are values. Updating a compound returns a new compound.
 */
public sealed interface Representation {

    /**
     * Free-form text. Never analyzed, and never evidence of well-posedness on its own.
     */
    record StringRep(String text) implements Representation {
        public StringRep {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String humanFriendly() {
            return text.contains(" ") ? "[[" + text + "]]" : text;
        }
    }

    /**
     * A description codified as a core expression.
     */
    record ObjectRep(CoreExpr expr) implements Representation {
        public ObjectRep {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public String humanFriendly() {
            return expr.toSource();
        }
    }

    /**
     * A description made of parts that must all hold.
     */
    record CompoundRep(List<Representation> parts) implements Representation {
        public CompoundRep {
            parts = parts != null ? List.copyOf(parts) : List.of();
        }

        /** A new compound with {@code part} appended. */
        public CompoundRep with(Representation part) {
            List<Representation> next = new ArrayList<>(parts);
            next.add(Objects.requireNonNull(part, "part"));
            return new CompoundRep(next);
        }

        @Override
        public String humanFriendly() {
            return parts.stream().map(Representation::humanFriendly).collect(Collectors.joining(" + ", "{", "}"));
        }
    }

    /**
     * A display string for this representation.
     */
    String humanFriendly();

    static StringRep text(String text) {
        return new StringRep(text);
    }

    static ObjectRep object(CoreExpr expr) {
        return new ObjectRep(expr);
    }

    static CompoundRep compound(Representation... parts) {
        return new CompoundRep(Arrays.asList(parts));
    }
}
