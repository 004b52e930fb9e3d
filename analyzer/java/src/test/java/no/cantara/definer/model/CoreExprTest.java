package no.cantara.definer.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static no.cantara.definer.model.CoreExpr.app;
import static no.cantara.definer.model.CoreExpr.atom;
import static no.cantara.definer.model.CoreExpr.id;
import static no.cantara.definer.model.CoreExpr.list;
import static org.junit.jupiter.api.Assertions.*;

class CoreExprTest {

    @Test
    void rendersAsSExpression() {
        CoreExpr expr = app(id("define"), list("f", "x"), app(id("+"), id("x"), atom(1)));
        assertEquals("(define (f x) (+ x 1))", expr.toSource());
    }

    @Test
    void rendersAtoms() {
        assertEquals("\"a \\\"b\\\"\"", atom("a \"b\"").toSource());
        assertEquals("#t", atom(true).toSource());
        assertEquals("#f", atom(false).toSource());
        assertEquals("2.5", atom(2.5).toSource());
        assertEquals("()", app().toSource());
    }

    @Test
    void applicationCopiesItsElements() {
        List<CoreExpr> elements = new ArrayList<>(List.of(id("f")));
        CoreExpr.Application app = new CoreExpr.Application(elements);
        elements.add(id("g"));
        assertEquals(1, app.size());
        assertThrows(UnsupportedOperationException.class, () -> app.elements().add(id("h")));
    }

    @Test
    void dropPastEndIsEmpty() {
        CoreExpr.Application app = app(id("lambda"), list("x"));
        assertEquals(List.of(), app.drop(2));
        assertEquals(List.of(list("x")), app.drop(1));
    }

    @Test
    void blankIdentifierIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> id(" "));
    }

    @Test
    void equalStructuresAreEqual() {
        assertEquals(app(id("f"), atom(1)), app(id("f"), atom(1)));
        assertNotEquals(id("x"), atom("x"));
    }

    // -----------------------------------------------------------------------
    // PrimitiveForm
    // -----------------------------------------------------------------------

    @Test
    void recognizesEveryKeyword() {
        for (PrimitiveForm form : PrimitiveForm.values()) {
            assertEquals(Optional.of(form), PrimitiveForm.of(id(form.keyword())));
        }
    }

    @Test
    void keywordKinds() {
        assertEquals(PrimitiveForm.Kind.BINDING, PrimitiveForm.LAMBDA.kind());
        assertEquals(PrimitiveForm.Kind.SEQUENTIAL_BINDING, PrimitiveForm.fromKeyword("let*").orElseThrow().kind());
        assertEquals(PrimitiveForm.Kind.ASSIGNMENT, PrimitiveForm.fromKeyword("set!").orElseThrow().kind());
        assertEquals(PrimitiveForm.Kind.QUOTATION, PrimitiveForm.QUASIQUOTE.kind());
    }

    @Test
    void onlyIdentifierHeadsAreKeywords() {
        assertTrue(PrimitiveForm.of(atom("lambda")).isEmpty());
        assertTrue(PrimitiveForm.of(app(id("lambda"))).isEmpty());
        assertTrue(PrimitiveForm.of(id("begin")).isEmpty());
    }
}
