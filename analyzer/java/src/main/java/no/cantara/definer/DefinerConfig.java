package no.cantara.definer;

import no.cantara.definer.FreeVariableAnalyzer.Mode;

import java.util.List;

/**
 * Analysis settings, usually read from a definer.yaml by {@link DefinerConfigParser}.
 *
 * @param mode            How malformed keyword forms are handled.
 * @param maxDepth        Maximum expression nesting depth, at most {@link #MAX_SUPPORTED_DEPTH}.
 * @param standardGlobals Whether the bundled Scheme base-library names count as defined.
 * @param globals         Further names the ambient environment defines.
 */
public record DefinerConfig(
        Mode mode,
        int maxDepth,
        boolean standardGlobals,
        List<String> globals
) {
    public DefinerConfig {
        mode = mode != null ? mode : Mode.STRICT;
        globals = globals != null ? List.copyOf(globals) : List.of();
        if (maxDepth < 1) {
            throw new IllegalArgumentException("'max_depth' must be positive, got " + maxDepth);
        }
        if (maxDepth > MAX_SUPPORTED_DEPTH) {
            throw new IllegalArgumentException(
                    "'max_depth' must be at most " + MAX_SUPPORTED_DEPTH + ", got " + maxDepth);
        }
    }

    /** Deepest nesting the analyzer walks within a default-sized thread stack. */
    public static final int MAX_SUPPORTED_DEPTH = 8192;

    public static DefinerConfig defaults() {
        return new DefinerConfig(Mode.STRICT, FreeVariableAnalyzer.DEFAULT_MAX_DEPTH, true, List.of());
    }

    public GlobalEnvironment environment() {
        GlobalEnvironment base = standardGlobals ? GlobalEnvironment.standard() : GlobalEnvironment.empty();
        return base.with(globals);
    }

    public FreeVariableAnalyzer analyzer() {
        return new FreeVariableAnalyzer(environment(), mode, maxDepth);
    }

    public WellPosedness evaluator() {
        return new WellPosedness(analyzer());
    }
}
