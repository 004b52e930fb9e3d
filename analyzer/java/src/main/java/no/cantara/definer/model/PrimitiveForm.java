package no.cantara.definer.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of special-form keywords the external expander may leave in a {@link CoreExpr}.
 */
public enum PrimitiveForm {

    LAMBDA("lambda", Kind.BINDING),
    LET("let", Kind.SEQUENTIAL_BINDING),
    LET_STAR("let*", Kind.SEQUENTIAL_BINDING),
    LETREC("letrec", Kind.SEQUENTIAL_BINDING),
    PARAMETERIZE("parameterize", Kind.SEQUENTIAL_BINDING),
    FLUID_LET("fluid-let", Kind.SEQUENTIAL_BINDING),
    DEFINE("define", Kind.DEFINITION),
    SET("set!", Kind.ASSIGNMENT),
    QUOTE("quote", Kind.QUOTATION),
    QUASIQUOTE("quasiquote", Kind.QUOTATION);

    /**
     * How a form introduces names, which decides how the analyzer walks it.
     */
    public enum Kind {
        /** Parameter list bound over the remaining body forms. */
        BINDING,
        /** List of {@code (name init)} pairs or bare names, bound as one flat scope over the body. */
        SEQUENTIAL_BINDING,
        /** Bare name or function-style target bound over the remaining forms. */
        DEFINITION,
        /** Assigned name bound over the remaining forms. */
        ASSIGNMENT,
        /** Quoted data, never analyzed. */
        QUOTATION
    }

    private static final Map<String, PrimitiveForm> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(PrimitiveForm::keyword, Function.identity()));

    private final String keyword;
    private final Kind kind;

    PrimitiveForm(String keyword, Kind kind) {
        this.keyword = keyword;
        this.kind = kind;
    }

    public String keyword() { return keyword; }
    public Kind kind() { return kind; }

    public static Optional<PrimitiveForm> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }

    /**
     * The form keyed by the head of an application, if the head is a recognized keyword.
     */
    public static Optional<PrimitiveForm> of(CoreExpr head) {
        if (head instanceof CoreExpr.Identifier id) {
            return fromKeyword(id.name());
        }
        return Optional.empty();
    }
}
