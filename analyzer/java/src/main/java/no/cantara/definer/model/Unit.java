package no.cantara.definer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A problem or topic under analysis: its alternative representations plus relational links
 * to other units.
 *
 * <p>{@code parents} and {@code children} hold unit ids, not units. They are inert metadata
 * maintained by the graph builder and are not consulted for well-posedness.
 */
public record Unit(
        String id,
        List<Representation> representations,
        Set<String> parents,
        Set<String> children
) {
    public Unit {
        Objects.requireNonNull(id, "id");
        representations = representations != null ? List.copyOf(representations) : List.of();
        parents = parents != null ? Collections.unmodifiableSet(new LinkedHashSet<>(parents)) : Set.of();
        children = children != null ? Collections.unmodifiableSet(new LinkedHashSet<>(children)) : Set.of();
    }

    /** A unit with the given representations and no links. */
    public static Unit of(String id, Representation... representations) {
        return new Unit(id, Arrays.asList(representations), Set.of(), Set.of());
    }

    /** Replaces the representation sequence wholesale. */
    public Unit withRepresentations(List<Representation> replacement) {
        return new Unit(id, replacement, parents, children);
    }

    /** Appends one representation. */
    public Unit withRepresentation(Representation representation) {
        List<Representation> next = new ArrayList<>(representations);
        next.add(Objects.requireNonNull(representation, "representation"));
        return new Unit(id, next, parents, children);
    }

    public Unit withParent(String parentId) {
        Set<String> next = new LinkedHashSet<>(parents);
        next.add(Objects.requireNonNull(parentId, "parentId"));
        return new Unit(id, representations, next, children);
    }

    public Unit withChild(String childId) {
        Set<String> next = new LinkedHashSet<>(children);
        next.add(Objects.requireNonNull(childId, "childId"));
        return new Unit(id, representations, parents, next);
    }
}
