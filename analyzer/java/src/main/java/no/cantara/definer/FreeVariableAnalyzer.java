package no.cantara.definer;

import no.cantara.definer.GlobalResolver.ResolutionUnavailableException;
import no.cantara.definer.model.CoreExpr;
import no.cantara.definer.model.PrimitiveForm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the identifiers in a {@link CoreExpr} that are neither lexically bound nor defined
 * by the ambient {@link GlobalResolver}.
 *
 * <p>Binding rules, by head keyword:
 * <ul>
 *   <li>{@code lambda}: the parameter list is bound over the body forms.</li>
 *   <li>{@code let}, {@code let*}, {@code letrec}, {@code parameterize}, {@code fluid-let}: all
 *       bound names form one flat scope over the body. Initializers are not walked.</li>
 *   <li>{@code define}: a bare target, or every name in a function-style target, is bound over
 *       the remaining forms.</li>
 *   <li>{@code set!}: the assigned name is bound over the remaining forms.</li>
 *   <li>{@code quote}, {@code quasiquote}: nothing inside is a reference.</li>
 * </ul>
 * Any other application is a generic combination; every element, head included, is walked
 * under the unchanged scopes.
 *
 * <p>The walk recurses once per nesting level. Depths above
 * {@link DefinerConfig#MAX_SUPPORTED_DEPTH} may exhaust a default-sized thread stack before the
 * {@code maxDepth} guard fires.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class FreeVariableAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FreeVariableAnalyzer.class);

    public static final int DEFAULT_MAX_DEPTH = 2048;

    /**
     * How keyword forms that cannot be destructured are handled.
     */
    public enum Mode {
        /** Raise {@link MalformedExpressionException}. */
        STRICT,
        /** Walk whatever can be destructured; missing parts bind and analyze nothing. */
        LENIENT
    }

    /** Thrown in {@link Mode#STRICT} when a keyword form has a shape the analyzer cannot walk. */
    public static class MalformedExpressionException extends IllegalArgumentException {
        private final transient CoreExpr expression;

        public MalformedExpressionException(String msg, CoreExpr expression) {
            super(msg + ": " + expression.toSource());
            this.expression = expression;
        }

        public CoreExpr expression() { return expression; }
    }

    /** Thrown when an expression nests deeper than the configured limit, i.e. is not a finite tree in practice. */
    public static class CyclicExpressionException extends IllegalArgumentException {
        public CyclicExpressionException(String msg) { super(msg); }
    }

    private final GlobalResolver resolver;
    private final Mode mode;
    private final int maxDepth;

    public FreeVariableAnalyzer(GlobalResolver resolver) {
        this(resolver, Mode.STRICT, DEFAULT_MAX_DEPTH);
    }

    public FreeVariableAnalyzer(GlobalResolver resolver, Mode mode, int maxDepth) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.mode = Objects.requireNonNull(mode, "mode");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public GlobalResolver resolver() { return resolver; }
    public Mode mode() { return mode; }
    public int maxDepth() { return maxDepth; }

    /**
     * Free identifiers of {@code expr} analyzed from the top level.
     */
    public Set<String> freeVariables(CoreExpr expr) {
        return freeVariables(expr, ScopeStack.empty());
    }

    /**
     * Free identifiers of {@code expr} with {@code scopes} already in effect.
     *
     * @return names in order of first occurrence; empty iff the expression is closed
     * @throws MalformedExpressionException   in strict mode, for an unwalkable keyword form
     * @throws CyclicExpressionException      if nesting exceeds {@link #maxDepth()}
     * @throws ResolutionUnavailableException if the resolver fails
     */
    public Set<String> freeVariables(CoreExpr expr, ScopeStack scopes) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(scopes, "scopes");
        Walk walk = new Walk();
        walk.visit(expr, scopes, 0);
        Set<String> free = Collections.unmodifiableSet(walk.free);
        if (log.isDebugEnabled()) {
            log.debug("Free identifiers in {}: {}", expr.toSource(), free);
        }
        return free;
    }

    public boolean isClosed(CoreExpr expr) {
        return freeVariables(expr).isEmpty();
    }

    /**
     * State of one analysis call. The resolver is asked about each name at most once per call.
     */
    private final class Walk {
        private final Set<String> free = new LinkedHashSet<>();
        private final Map<String, Boolean> resolved = new HashMap<>();

        void visit(CoreExpr expr, ScopeStack scopes, int depth) {
            if (depth > maxDepth) {
                throw new CyclicExpressionException(
                        "Expression nests deeper than " + maxDepth + " levels; refusing to walk a cyclic or unbounded expression");
            }
            if (expr instanceof CoreExpr.Atom) {
                return;
            }
            if (expr instanceof CoreExpr.Identifier id) {
                reference(id.name(), scopes);
                return;
            }
            CoreExpr.Application app = (CoreExpr.Application) expr;
            if (app.isEmpty()) {
                malformed("Empty application", app);
                return;
            }
            Optional<PrimitiveForm> form = PrimitiveForm.of(app.get(0));
            if (form.isEmpty()) {
                walkAll(app.elements(), scopes, depth);
                return;
            }
            switch (form.get().kind()) {
                case BINDING -> lambda(app, scopes, depth);
                case SEQUENTIAL_BINDING -> let(app, scopes, depth);
                case DEFINITION -> define(app, scopes, depth);
                case ASSIGNMENT -> assignment(app, scopes, depth);
                case QUOTATION -> { }
            }
        }

        private void reference(String name, ScopeStack scopes) {
            if (scopes.binds(name) || free.contains(name)) {
                return;
            }
            if (!resolved.computeIfAbsent(name, this::askResolver)) {
                free.add(name);
            }
        }

        private boolean askResolver(String name) {
            try {
                return resolver.isGloballyDefined(name);
            } catch (ResolutionUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ResolutionUnavailableException(name, e);
            }
        }

        private void lambda(CoreExpr.Application app, ScopeStack scopes, int depth) {
            if (app.size() < 2) {
                malformed(keyword(app) + " without a parameter list", app);
                return;
            }
            List<String> params = parameterNames(app.get(1), app);
            body(app, 2, scopes.push(params), depth);
        }

        private void let(CoreExpr.Application app, ScopeStack scopes, int depth) {
            if (app.size() < 2) {
                malformed(keyword(app) + " without a binding list", app);
                return;
            }
            List<String> names = new ArrayList<>();
            if (app.get(1) instanceof CoreExpr.Application bindings) {
                for (CoreExpr entry : bindings.elements()) {
                    if (entry instanceof CoreExpr.Identifier id) {
                        names.add(id.name());
                    } else if (entry instanceof CoreExpr.Application pair
                            && !pair.isEmpty() && pair.get(0) instanceof CoreExpr.Identifier bound) {
                        names.add(bound.name());
                    } else {
                        malformed(keyword(app) + " binding is neither a name nor a (name init) pair", app);
                    }
                }
            } else {
                malformed(keyword(app) + " binding list is not a list", app);
            }
            body(app, 2, scopes.push(names), depth);
        }

        private void define(CoreExpr.Application app, ScopeStack scopes, int depth) {
            if (app.size() < 2) {
                malformed("define without a target", app);
                return;
            }
            List<String> names = new ArrayList<>();
            CoreExpr target = app.get(1);
            if (target instanceof CoreExpr.Identifier id) {
                names.add(id.name());
            } else if (target instanceof CoreExpr.Application signature && !signature.isEmpty()) {
                collectIdentifiers(signature, names);
            } else {
                malformed("define target is not a name or a signature", app);
            }
            body(app, 2, scopes.push(names), depth);
        }

        private void assignment(CoreExpr.Application app, ScopeStack scopes, int depth) {
            if (app.size() < 2) {
                malformed(keyword(app) + " without a name", app);
                return;
            }
            List<String> names = new ArrayList<>();
            if (app.get(1) instanceof CoreExpr.Identifier id) {
                names.add(id.name());
            } else {
                malformed(keyword(app) + " target is not a name", app);
            }
            body(app, 2, scopes.push(names), depth);
        }

        private List<String> parameterNames(CoreExpr params, CoreExpr.Application form) {
            List<String> names = new ArrayList<>();
            if (params instanceof CoreExpr.Identifier rest) {
                names.add(rest.name());
            } else if (params instanceof CoreExpr.Application list) {
                for (CoreExpr p : list.elements()) {
                    if (p instanceof CoreExpr.Identifier id) {
                        names.add(id.name());
                    } else {
                        malformed(keyword(form) + " parameter is not a name", form);
                    }
                }
            } else {
                malformed(keyword(form) + " parameter list is not a list", form);
            }
            return names;
        }

        private void body(CoreExpr.Application app, int from, ScopeStack scopes, int depth) {
            List<CoreExpr> forms = app.drop(from);
            if (forms.isEmpty()) {
                malformed(keyword(app) + " without a body", app);
                return;
            }
            walkAll(forms, scopes, depth);
        }

        private void walkAll(List<CoreExpr> forms, ScopeStack scopes, int depth) {
            for (CoreExpr form : forms) {
                visit(form, scopes, depth + 1);
            }
        }

        private void malformed(String msg, CoreExpr.Application app) {
            if (mode == Mode.STRICT) {
                throw new MalformedExpressionException(msg, app);
            }
            log.debug("Lenient walk past malformed form: {}: {}", msg, app.toSource());
        }
    }

    private static void collectIdentifiers(CoreExpr expr, List<String> into) {
        if (expr instanceof CoreExpr.Identifier id) {
            into.add(id.name());
        } else if (expr instanceof CoreExpr.Application app) {
            for (CoreExpr e : app.elements()) {
                collectIdentifiers(e, into);
            }
        }
    }

    private static String keyword(CoreExpr.Application app) {
        return ((CoreExpr.Identifier) app.get(0)).name();
    }
}
