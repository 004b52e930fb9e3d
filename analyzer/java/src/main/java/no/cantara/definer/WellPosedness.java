package no.cantara.definer;

import no.cantara.definer.model.Representation;
import no.cantara.definer.model.Representation.CompoundRep;
import no.cantara.definer.model.Representation.ObjectRep;
import no.cantara.definer.model.Representation.StringRep;
import no.cantara.definer.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether representations and units are well-posed.
 *
 * <p>A representation is well-posed when it is closed: an {@link ObjectRep} whose expression has
 * no free identifiers, or a {@link CompoundRep} whose parts all are. A {@link StringRep} never is.
 * A unit is well-posed when at least one of its representations is; parent and child links are
 * not consulted.
 *
 * <p>Analysis failures propagate to the caller. A unit evaluation stops at the first well-posed
 * representation, so failures in later representations are never reached.
 *
 * <p>Compound nesting is walked recursively. Compounds are built bottom-up from immutable parts, so
 * they are always finite, but nesting thousands of levels deep can exhaust the thread stack.
 */
public final class WellPosedness {

    private static final Logger log = LoggerFactory.getLogger(WellPosedness.class);

    /**
     * Outcome of assessing one unit.
     *
     * @param unitId         The assessed unit.
     * @param wellPosed      Same answer as {@link #isWellPosed(Unit)}.
     * @param wellPosedIndex Zero-based index of the first well-posed representation, or -1.
     * @param reasons        Why each representation falls short; empty when well-posed.
     */
    public record Assessment(String unitId, boolean wellPosed, int wellPosedIndex, List<String> reasons) {
        public Assessment {
            reasons = List.copyOf(reasons);
        }
    }

    private final FreeVariableAnalyzer analyzer;

    public WellPosedness(FreeVariableAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    public FreeVariableAnalyzer analyzer() {
        return analyzer;
    }

    /**
     * Whether {@code rep} is by itself a self-contained closed description.
     */
    public boolean isClosed(Representation rep) {
        if (rep instanceof StringRep) {
            return false;
        }
        if (rep instanceof ObjectRep object) {
            return analyzer.isClosed(object.expr());
        }
        for (Representation part : ((CompoundRep) rep).parts()) {
            if (!isClosed(part)) return false;
        }
        return true;
    }

    public boolean isWellPosed(Representation rep) {
        return isClosed(rep);
    }

    public boolean isWellPosed(Unit unit) {
        List<Representation> reps = unit.representations();
        for (int i = 0; i < reps.size(); i++) {
            if (isWellPosed(reps.get(i))) {
                log.debug("Unit '{}' is well-posed by representation #{}", unit.id(), i + 1);
                return true;
            }
        }
        return false;
    }

    /**
     * Union of the free identifiers of every expression reachable in {@code rep}.
     * Text contributes none.
     */
    public Set<String> freeVariables(Representation rep) {
        Set<String> free = new LinkedHashSet<>();
        collectFree(rep, free);
        return Collections.unmodifiableSet(free);
    }

    private void collectFree(Representation rep, Set<String> into) {
        if (rep instanceof ObjectRep object) {
            into.addAll(analyzer.freeVariables(object.expr()));
        } else if (rep instanceof CompoundRep compound) {
            for (Representation part : compound.parts()) {
                collectFree(part, into);
            }
        }
    }

    /**
     * Like {@link #isWellPosed(Unit)}, but says why a unit is not well-posed.
     */
    public Assessment assess(Unit unit) {
        List<Representation> reps = unit.representations();
        if (reps.isEmpty()) {
            return new Assessment(unit.id(), false, -1, List.of("unit has no representations"));
        }
        List<String> reasons = new ArrayList<>();
        for (int i = 0; i < reps.size(); i++) {
            List<String> own = new ArrayList<>();
            explain(reps.get(i), "#" + (i + 1), own);
            if (own.isEmpty()) {
                log.debug("Unit '{}' is well-posed by representation #{}", unit.id(), i + 1);
                return new Assessment(unit.id(), true, i, List.of());
            }
            reasons.addAll(own);
        }
        return new Assessment(unit.id(), false, -1, reasons);
    }

    /**
     * Assessments of every unit in the graph, in insertion order.
     */
    public List<Assessment> assessAll(UnitGraph graph) {
        return graph.units().stream().map(this::assess).toList();
    }

    private void explain(Representation rep, String path, List<String> into) {
        String p = "representation " + path;
        if (rep instanceof StringRep) {
            into.add(p + ": text is never a closed description");
        } else if (rep instanceof ObjectRep object) {
            Set<String> free = analyzer.freeVariables(object.expr());
            if (!free.isEmpty()) {
                into.add(p + ": free identifier(s) " + free.stream().sorted().toList());
            }
        } else {
            // Stops at the first failing part, as isClosed does.
            List<Representation> parts = ((CompoundRep) rep).parts();
            int before = into.size();
            for (int j = 0; j < parts.size() && into.size() == before; j++) {
                explain(parts.get(j), path + "." + (j + 1), into);
            }
        }
    }
}
