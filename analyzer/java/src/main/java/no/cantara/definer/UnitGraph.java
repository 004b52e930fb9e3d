package no.cantara.definer;

import no.cantara.definer.model.Representation;
import no.cantara.definer.model.Unit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, id-indexed set of units and the parent/child links between them.
 *
 * <p>Every update returns a new graph. Links are relational metadata only; nothing here
 * affects well-posedness.
 */
public final class UnitGraph {

    private static final UnitGraph EMPTY = new UnitGraph(Map.of());

    private final Map<String, Unit> units;

    private UnitGraph(Map<String, Unit> units) {
        this.units = units;
    }

    public static UnitGraph empty() {
        return EMPTY;
    }

    public static UnitGraph of(Unit... units) {
        return of(Arrays.asList(units));
    }

    /**
     * @throws IllegalArgumentException if two units share an id
     */
    public static UnitGraph of(List<Unit> units) {
        Map<String, Unit> byId = new LinkedHashMap<>();
        for (Unit unit : units) {
            if (byId.putIfAbsent(unit.id(), unit) != null) {
                throw new IllegalArgumentException("unit '" + unit.id() + "' already present");
            }
        }
        return new UnitGraph(Collections.unmodifiableMap(byId));
    }

    /**
     * @throws IllegalArgumentException if a unit with the same id is already present
     */
    public UnitGraph add(Unit unit) {
        if (units.containsKey(unit.id())) {
            throw new IllegalArgumentException("unit '" + unit.id() + "' already present");
        }
        Map<String, Unit> next = new LinkedHashMap<>(units);
        next.put(unit.id(), unit);
        return new UnitGraph(Collections.unmodifiableMap(next));
    }

    /**
     * Records {@code childId} as a child of {@code parentId} on both units.
     */
    public UnitGraph link(String parentId, String childId) {
        Unit parent = require(parentId);
        Map<String, Unit> next = new LinkedHashMap<>(units);
        next.put(parentId, parent.withChild(childId));
        Unit child = next.get(childId);
        if (child == null) {
            throw new IllegalArgumentException("unknown unit '" + childId + "'");
        }
        next.put(childId, child.withParent(parentId));
        return new UnitGraph(Collections.unmodifiableMap(next));
    }

    public UnitGraph replaceRepresentations(String id, List<Representation> representations) {
        Unit unit = require(id);
        Map<String, Unit> next = new LinkedHashMap<>(units);
        next.put(id, unit.withRepresentations(representations));
        return new UnitGraph(Collections.unmodifiableMap(next));
    }

    public Optional<Unit> unit(String id) {
        return Optional.ofNullable(units.get(id));
    }

    /** Units in insertion order. */
    public List<Unit> units() {
        return List.copyOf(units.values());
    }

    public int size() {
        return units.size();
    }

    /**
     * Links that name a unit not in this graph, one message per dangling reference.
     */
    public List<String> unknownLinks() {
        List<String> warnings = new ArrayList<>();
        for (Unit unit : units.values()) {
            String p = "unit '" + unit.id() + "'";
            for (String parent : unit.parents()) {
                if (!units.containsKey(parent)) {
                    warnings.add(p + ": parent references unknown unit '" + parent + "'");
                }
            }
            for (String child : unit.children()) {
                if (!units.containsKey(child)) {
                    warnings.add(p + ": child references unknown unit '" + child + "'");
                }
            }
        }
        return warnings;
    }

    /**
     * The parent-to-child edges (as "parent->child") that close a cycle, found by depth-first search.
     * Edges may be declared on either end.
     */
    public Set<String> cycleEdges() {
        Map<String, Set<String>> adj = new LinkedHashMap<>();
        for (String id : units.keySet()) {
            adj.put(id, new LinkedHashSet<>());
        }
        for (Unit unit : units.values()) {
            for (String child : unit.children()) {
                if (units.containsKey(child)) adj.get(unit.id()).add(child);
            }
            for (String parent : unit.parents()) {
                if (units.containsKey(parent)) adj.get(parent).add(unit.id());
            }
        }

        Set<String> cycleEdges = new LinkedHashSet<>();
        Map<String, Visit> visits = new HashMap<>();
        for (String root : adj.keySet()) {
            if (!visits.containsKey(root)) {
                search(root, adj, visits, cycleEdges);
            }
        }
        return cycleEdges;
    }

    private enum Visit { ON_PATH, DONE }

    private record Frame(String node, Iterator<String> next) {}

    // Explicit stack: link chains can be longer than the call stack allows.
    private static void search(String root, Map<String, Set<String>> adj,
                               Map<String, Visit> visits, Set<String> cycleEdges) {
        Deque<Frame> path = new ArrayDeque<>();
        visits.put(root, Visit.ON_PATH);
        path.push(new Frame(root, adj.get(root).iterator()));
        while (!path.isEmpty()) {
            Frame top = path.peek();
            if (!top.next().hasNext()) {
                visits.put(top.node(), Visit.DONE);
                path.pop();
                continue;
            }
            String child = top.next().next();
            Visit seen = visits.get(child);
            if (seen == Visit.ON_PATH) {
                cycleEdges.add(top.node() + "->" + child);
            } else if (seen == null) {
                visits.put(child, Visit.ON_PATH);
                path.push(new Frame(child, adj.get(child).iterator()));
            }
        }
    }

    private Unit require(String id) {
        Unit unit = units.get(id);
        if (unit == null) {
            throw new IllegalArgumentException("unknown unit '" + id + "'");
        }
        return unit;
    }
}
