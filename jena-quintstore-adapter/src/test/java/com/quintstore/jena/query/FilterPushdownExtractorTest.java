package com.quintstore.jena.query;

import com.quintstore.jena.codec.TermCodec;
import com.quintstore.jena.store.OperatorValue;
import com.quintstore.jena.store.TermName;
import com.quintstore.jena.store.TermOperators;
import java.util.List;
import java.util.Map;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.expr.Expr;
import org.apache.jena.sparql.util.ExprUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterPushdownExtractor.
 */
public class FilterPushdownExtractorTest {

    private static final Var S = Var.alloc("s");
    private static final Var P = Var.alloc("p");
    private static final Var O = Var.alloc("o");
    private static final Node ALICE = NodeFactory.createURI("http://example.org/alice");
    private static final Node BOB = NodeFactory.createURI("http://example.org/bob");

    private final FilterPushdownExtractor extractor = new FilterPushdownExtractor();
    private final Map<Var, TermName> positions =
        FilterPushdownExtractor.positions(Triple.create(S, P, O), null);

    private PushdownResult extract(final String expression) {
        return extractor.extract(ExprUtils.parse(expression), positions);
    }

    private static OperatorValue term(final Node node) {
        return new OperatorValue.TermValue(node);
    }

    private static Node integer(final int value) {
        return NodeFactory.createLiteral(Integer.toString(value), XSDDatatype.XSDinteger);
    }

    @Test
    @DisplayName("Test variable positions of a pattern")
    public void testPositions() {
        Var g = Var.alloc("g");
        Map<Var, TermName> repeated = FilterPushdownExtractor.positions(
            Triple.create(S, ALICE, S), g);
        assertEquals(Map.of(S, TermName.SUBJECT, g, TermName.GRAPH), repeated,
            "A repeated variable should keep its first position");
    }

    @Test
    @DisplayName("Test IRI equality is pushed exactly")
    public void testIriEquality() {
        PushdownResult result = extract("?s = <http://example.org/alice>");
        assertEquals(term(ALICE), result.filters().get(S).getEq());
        assertTrue(result.remainder().isEmpty(), "IRI equality should need no re-check");
    }

    @Test
    @DisplayName("Test numeric comparison is a prefilter")
    public void testNumericComparison() {
        PushdownResult result = extract("?o > 5");
        assertEquals(term(integer(5)), result.filters().get(O).getGt());
        assertEquals(1, result.remainder().size(),
            "Numeric comparison should be re-evaluated");
    }

    @Test
    @DisplayName("Test constant on the left flips the comparison")
    public void testFlippedComparison() {
        PushdownResult result = extract("5 < ?o");
        assertEquals(term(integer(5)), result.filters().get(O).getGt());
        assertNull(result.filters().get(O).getLt());
    }

    @Test
    @DisplayName("Test numeric equality becomes a closed range")
    public void testNumericEquality() {
        TermOperators ops = extract("?o = 30").filters().get(O);
        assertEquals(term(integer(30)), ops.getGte());
        assertEquals(term(integer(30)), ops.getLte());
    }

    @Test
    @DisplayName("Test ordering on a non-object column is not pushed")
    public void testRangeOutsideObject() {
        PushdownResult result = extract("?s > 5");
        assertFalse(result.hasFilters());
        assertEquals(1, result.remainder().size());
    }

    @Test
    @DisplayName("Test language literal equality is not pushed")
    public void testLanguageEquality() {
        PushdownResult result = extract("?o = \"chat\"@fr");
        assertFalse(result.hasFilters(), "Language literal equality is value based");
        assertEquals(1, result.remainder().size());
    }

    @Test
    @DisplayName("Test conjunction of range bounds")
    public void testConjunction() {
        PushdownResult result = extract("?o > 5 && ?o < 10");
        TermOperators ops = result.filters().get(O);
        assertEquals(term(integer(5)), ops.getGt());
        assertEquals(term(integer(10)), ops.getLt());
        assertEquals(2, result.remainder().size());
    }

    @Test
    @DisplayName("Test repeated operator keeps the later test in the remainder")
    public void testOverlappingConditions() {
        PushdownResult result = extract(
            "?s = <http://example.org/alice> && ?s = <http://example.org/bob>");
        assertEquals(term(ALICE), result.filters().get(S).getEq());
        assertEquals(1, result.remainder().size(), "Second equality should be evaluated");
    }

    @Test
    @DisplayName("Test disjunction of equalities becomes a membership test")
    public void testDisjunction() {
        PushdownResult result = extract(
            "?s = <http://example.org/alice> || ?s = <http://example.org/bob>");
        assertEquals(List.of(term(ALICE), term(BOB)), result.filters().get(S).getIn());
        assertTrue(result.remainder().isEmpty());

        PushdownResult mixed = extract("?s = <http://example.org/alice> || ?o = 5");
        assertFalse(mixed.hasFilters(), "Disjunction across variables is not pushed");
    }

    @Test
    @DisplayName("Test IN and NOT IN lists")
    public void testMembership() {
        PushdownResult in = extract("?s IN (<http://example.org/alice>, <http://example.org/bob>)");
        assertEquals(List.of(term(ALICE), term(BOB)), in.filters().get(S).getIn());
        assertTrue(in.remainder().isEmpty());

        PushdownResult numbers = extract("?o IN (1, 2)");
        assertFalse(numbers.hasFilters(), "Numeric membership is value based");

        PushdownResult notIn = extract("?o NOT IN (<http://example.org/alice>)");
        assertEquals(List.of(term(ALICE)), notIn.filters().get(O).getNotIn());
        assertTrue(notIn.remainder().isEmpty());

        PushdownResult notInLiteral = extract("?o NOT IN (\"x\")");
        assertTrue(notInLiteral.hasFilters());
        assertEquals(1, notInLiteral.remainder().size());
    }

    @Test
    @DisplayName("Test BOUND and isBlank are exact")
    public void testBoundAndBlank() {
        PushdownResult bound = extract("BOUND(?o)");
        assertEquals(Boolean.FALSE, bound.filters().get(O).getIsNull());
        assertTrue(bound.remainder().isEmpty());

        PushdownResult notBound = extract("!BOUND(?o)");
        assertEquals(Boolean.TRUE, notBound.filters().get(O).getIsNull());

        PushdownResult blank = extract("isBlank(?s)");
        assertEquals("_:", blank.filters().get(S).getStartsWith());
        assertTrue(blank.remainder().isEmpty());
    }

    @Test
    @DisplayName("Test type tests are prefilters")
    public void testTypeTests() {
        PushdownResult numeric = extract("isNumeric(?o)");
        assertEquals(TermCodec.NUMERIC_PREFIX, numeric.filters().get(O).getStartsWith());
        assertEquals(1, numeric.remainder().size());

        assertNotNull(extract("isIRI(?o)").filters().get(O).getRegex());
        assertNotNull(extract("isLiteral(?o)").filters().get(O).getRegex());
    }

    @Test
    @DisplayName("Test string functions")
    public void testStringFunctions() {
        assertEquals("http://pod/",
            extract("STRSTARTS(STR(?s), \"http://pod/\")").filters().get(S).getStartsWith());
        assertEquals("\"Al",
            extract("STRSTARTS(?o, \"Al\")").filters().get(O).getStartsWith(),
            "Literal prefix should include the opening quote");
        assertEquals("ice\"",
            extract("STRENDS(?o, \"ice\")").filters().get(O).getContains());
        assertEquals("/card",
            extract("STRENDS(STR(?s), \"/card\")").filters().get(S).getEndsWith());
        assertEquals("lic",
            extract("CONTAINS(?o, \"lic\")").filters().get(O).getContains());
    }

    @Test
    @DisplayName("Test regex push-down")
    public void testRegex() {
        assertEquals("^http://pod",
            extract("REGEX(STR(?s), \"^http://pod\")").filters().get(S).getRegex());
        assertEquals("lic",
            extract("REGEX(?o, \"lic\")").filters().get(O).getRegex());
        assertFalse(extract("REGEX(?o, \"^A\")").hasFilters(),
            "Anchored regex over a literal is not pushed");
        assertFalse(extract("REGEX(?o, \"a\", \"i\")").hasFilters(),
            "Regex flags are not pushed");
    }

    @Test
    @DisplayName("Test language match")
    public void testLangMatches() {
        assertEquals("(?i)\"@en(-|$)",
            extract("LANGMATCHES(LANG(?o), \"en\")").filters().get(O).getRegex());
        assertEquals("\"@",
            extract("LANGMATCHES(LANG(?o), \"*\")").filters().get(O).getContains());
    }

    @Test
    @DisplayName("Test variables outside the pattern stay in the remainder")
    public void testUnknownVariable() {
        PushdownResult result = extract("?x = <http://example.org/alice> && ?o > 1");
        assertFalse(result.filters().containsKey(Var.alloc("x")));
        assertTrue(result.filters().containsKey(O));
        assertEquals(2, result.remainder().size());
    }

    @Test
    @DisplayName("Test expression lists are read as a conjunction")
    public void testExpressionList() {
        List<Expr> exprs = List.of(ExprUtils.parse("?o > 1"), ExprUtils.parse("?o < 3"));
        PushdownResult result = extractor.extract(exprs, positions);
        assertNotNull(result.filters().get(O).getGt());
        assertNotNull(result.filters().get(O).getLt());
        assertFalse(PushdownResult.EMPTY.hasFilters());
    }
}
