package com.quintstore.jena.store;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.vocabulary.RDF;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every quint store backend must show. Subclasses supply an open,
 * empty store.
 */
public abstract class QuintStoreTestBase {

    protected static final String EX = "http://example.org/";
    protected static final Node ALICE = NodeFactory.createURI(EX + "alice");
    protected static final Node BOB = NodeFactory.createURI(EX + "bob");
    protected static final Node PERSON = NodeFactory.createURI(EX + "Person");
    protected static final Node NAME = NodeFactory.createURI(EX + "name");
    protected static final Node AGE = NodeFactory.createURI(EX + "age");
    protected static final Node KNOWS = NodeFactory.createURI(EX + "knows");
    protected static final Node GRAPH = NodeFactory.createURI("http://pod.example/alice/profile");

    protected QuintStore store;

    /**
     * Create a store for one test. It does not need to be open.
     *
     * @return the store
     * @throws SQLException if the backend cannot be reached
     */
    protected abstract QuintStore createStore() throws SQLException;

    @BeforeEach
    public void setUp() throws SQLException {
        store = createStore();
        store.open();
        store.clear();
    }

    @AfterEach
    public void tearDown() throws SQLException {
        if (store != null) {
            store.close();
        }
    }

    protected static Node integer(final int value) {
        return NodeFactory.createLiteral(Integer.toString(value), XSDDatatype.XSDinteger);
    }

    protected static Node string(final String value) {
        return NodeFactory.createLiteralString(value);
    }

    protected void loadPeople() throws SQLException {
        store.multiPut(List.of(
            new Quint(GRAPH, ALICE, RDF.type.asNode(), PERSON),
            new Quint(GRAPH, ALICE, NAME, string("Alice")),
            new Quint(GRAPH, ALICE, AGE, integer(30)),
            new Quint(GRAPH, ALICE, KNOWS, BOB),
            new Quint(GRAPH, BOB, RDF.type.asNode(), PERSON),
            new Quint(GRAPH, BOB, NAME, string("Bob"))));
    }

    @Test
    @DisplayName("Test put and get a quint")
    public void testPutAndGet() throws SQLException {
        Quint quint = new Quint(GRAPH, ALICE, NAME, string("Alice"));
        store.put(quint);

        List<Quint> found = store.get(QuintPattern.builder().subject(ALICE).build());
        assertEquals(List.of(quint), found, "Stored quint should be returned");
    }

    @Test
    @DisplayName("Test put of an existing quint does not duplicate it")
    public void testUpsert() throws SQLException {
        Quint quint = new Quint(GRAPH, ALICE, NAME, string("Alice"));
        store.put(quint);
        store.put(quint);
        store.multiPut(List.of(quint, quint));

        assertEquals(1, store.count(QuintPattern.empty()),
            "Repeated puts should keep exactly one row");
    }

    @Test
    @DisplayName("Test terms of every kind survive storage")
    public void testTermKinds() throws SQLException {
        List<Node> objects = List.of(
            NodeFactory.createBlankNode("b0"),
            NodeFactory.createLiteralLang("hallo", "de"),
            NodeFactory.createLiteral("3.14", XSDDatatype.XSDdecimal),
            NodeFactory.createLiteral("2024-02-29T12:00:00Z", XSDDatatype.XSDdateTime),
            NodeFactory.createLiteral("true", XSDDatatype.XSDboolean),
            string("line\nbreak"));
        var quints = new ArrayList<Quint>();
        for (Node object : objects) {
            quints.add(new Quint(GRAPH, ALICE, NAME, object));
        }
        store.multiPut(quints);

        for (Node object : objects) {
            List<Quint> found = store.get(QuintPattern.builder().object(object).build());
            assertEquals(1, found.size(), "Object " + object + " should be found exactly");
            assertEquals(object, found.get(0).getObject());
        }
    }

    @Test
    @DisplayName("Test default graph quints")
    public void testDefaultGraph() throws SQLException {
        store.put(new Quint(Quad.defaultGraphIRI, ALICE, NAME, string("Alice")));
        store.put(new Quint(GRAPH, BOB, NAME, string("Bob")));

        List<Quint> inDefault = store.get(QuintPattern.builder()
            .graph(Quad.defaultGraphIRI).build());
        assertEquals(1, inDefault.size());
        assertTrue(Quad.isDefaultGraph(inDefault.get(0).getGraph()),
            "Graph should decode as the default graph");
    }

    @Test
    @DisplayName("Test match with wildcards")
    public void testMatch() throws SQLException {
        loadPeople();

        List<Quint> names = store.match(null, NAME, null, null).toList();
        assertEquals(2, names.size(), "Both names should match");
        List<Quint> alice = store.match(ALICE, Node.ANY, Node.ANY, GRAPH).toList();
        assertEquals(4, alice.size(), "All of Alice's quints should match");
    }

    @Test
    @DisplayName("Test graph prefix boundary")
    public void testGraphPrefix() throws SQLException {
        Node inside = NodeFactory.createURI("http://pod.example/alice/");
        Node nested = NodeFactory.createURI("http://pod.example/alice/docs/a");
        Node sibling = NodeFactory.createURI("http://pod.example/alicex/");
        Node other = NodeFactory.createURI("http://pod.example/bob/");
        for (Node graph : List.of(inside, nested, sibling, other)) {
            store.put(new Quint(graph, ALICE, NAME, string("Alice")));
        }

        List<Quint> found = store.getByGraphPrefix("http://pod.example/alice/");
        assertEquals(2, found.size(), "Only graphs under the prefix should match");
        for (Quint quint : found) {
            assertTrue(quint.getGraph().getURI().startsWith("http://pod.example/alice/"));
        }
    }

    @Test
    @DisplayName("Test graph prefix matches non-ASCII continuations")
    public void testGraphPrefixNonAscii() throws SQLException {
        store.put(new Quint(NodeFactory.createURI("http://pod.example/alice/caf\u00e9"),
            ALICE, NAME, string("Alice")));
        store.put(new Quint(NodeFactory.createURI("http://pod.example/alice/\u4e2d\u6587"),
            ALICE, NAME, string("Alice")));

        assertEquals(2, store.getByGraphPrefix("http://pod.example/alice/").size(),
            "Characters up to U+FFFF after the prefix should stay in range");
    }

    @Test
    @DisplayName("Test numeric range over integers")
    public void testNumericRange() throws SQLException {
        var quints = new ArrayList<Quint>();
        for (int i = 1; i <= 12; i++) {
            quints.add(new Quint(GRAPH, NodeFactory.createURI(EX + "n" + i), AGE, integer(i)));
        }
        store.multiPut(quints);

        List<Quint> found = store.get(QuintPattern.builder()
            .predicate(AGE)
            .object(TermOperators.builder().gt(5).lt(10).build())
            .build(), QueryOptions.builder().order(TermName.OBJECT).build());
        var values = new ArrayList<String>();
        for (Quint quint : found) {
            values.add(quint.getObject().getLiteralLexicalForm());
        }
        assertEquals(List.of("6", "7", "8", "9"), values,
            "Range should compare values, not lexical forms");
    }

    @Test
    @DisplayName("Test numeric range across numeric datatypes")
    public void testMixedNumericTypes() throws SQLException {
        store.multiPut(List.of(
            new Quint(GRAPH, ALICE, AGE, NodeFactory.createLiteral("2.5", XSDDatatype.XSDdecimal)),
            new Quint(GRAPH, BOB, AGE, integer(3)),
            new Quint(GRAPH, PERSON, AGE, NodeFactory.createLiteral("1.0E1", XSDDatatype.XSDdouble))));

        List<Quint> found = store.get(QuintPattern.builder()
            .object(TermOperators.builder().gte(integer(3)).build())
            .build());
        assertEquals(2, found.size(), "3 and 10.0 should be at least 3");
    }

    @Test
    @DisplayName("Test ordering, reverse and paging")
    public void testOrderingAndPaging() throws SQLException {
        var quints = new ArrayList<Quint>();
        for (int i = 0; i < 5; i++) {
            quints.add(new Quint(GRAPH, NodeFactory.createURI(EX + "s" + i), NAME, string("n" + i)));
        }
        store.multiPut(quints);

        List<Quint> page = store.get(QuintPattern.empty(), QueryOptions.builder()
            .order(TermName.SUBJECT).reverse(true).limit(2).offset(1).build());
        assertEquals(2, page.size());
        assertEquals(EX + "s3", page.get(0).getSubject().getURI());
        assertEquals(EX + "s2", page.get(1).getSubject().getURI());

        List<Quint> tail = store.get(QuintPattern.empty(), QueryOptions.builder()
            .order(TermName.SUBJECT).offset(3).build());
        assertEquals(2, tail.size(), "Offset without limit should return the rest");
    }

    @Test
    @DisplayName("Test operator conditions on IRIs")
    public void testIriOperators() throws SQLException {
        loadPeople();

        assertEquals(2, store.get(QuintPattern.builder()
            .subject(TermOperators.builder().inTerms(List.of(BOB)).build()).build()).size());
        assertEquals(0, store.get(QuintPattern.builder()
            .subject(TermOperators.builder().inTerms(List.of()).build()).build()).size(),
            "Empty IN should match nothing");
        assertEquals(4, store.get(QuintPattern.builder()
            .subject(TermOperators.builder().ne(BOB).build()).build()).size());
        assertEquals(2, store.get(QuintPattern.builder()
            .predicate(TermOperators.builder().endsWith("name").build()).build()).size());
        assertEquals(6, store.get(QuintPattern.builder()
            .subject(TermOperators.builder().startsWith(EX).build()).build()).size());
    }

    @Test
    @DisplayName("Test regex runs in the database")
    public void testRegex() throws SQLException {
        loadPeople();

        List<Quint> found = store.get(QuintPattern.builder()
            .object(TermOperators.builder().regex("^\"A").build())
            .build());
        assertEquals(1, found.size());
        assertEquals(string("Alice"), found.get(0).getObject());
    }

    @Test
    @DisplayName("Test null checks on stored columns")
    public void testIsNull() throws SQLException {
        loadPeople();

        assertEquals(0, store.count(QuintPattern.builder()
            .object(TermOperators.builder().isNull(true).build()).build()),
            "Stored columns are never null");
        assertEquals(6, store.count(QuintPattern.builder()
            .object(TermOperators.builder().isNull(false).build()).build()));
    }

    @Test
    @DisplayName("Test delete by pattern")
    public void testDelete() throws SQLException {
        loadPeople();

        int deleted = store.del(QuintPattern.builder().subject(BOB).build());
        assertEquals(2, deleted, "Both of Bob's quints should be deleted");
        assertEquals(4, store.count(QuintPattern.empty()));
    }

    @Test
    @DisplayName("Test batch delete ignores missing quints")
    public void testMultiDelete() throws SQLException {
        loadPeople();

        int deleted = store.multiDel(List.of(
            new Quint(GRAPH, ALICE, NAME, string("Alice")),
            new Quint(GRAPH, ALICE, NAME, string("Nobody"))));
        assertEquals(1, deleted, "Only the existing quint should count");
        assertEquals(5, store.count(QuintPattern.empty()));
        assertEquals(0, store.multiDel(List.of()));
    }

    @Test
    @DisplayName("Test compound join of three patterns")
    public void testCompound() throws SQLException {
        loadPeople();

        var compound = new CompoundPattern(List.of(
            QuintPattern.builder().predicate(RDF.type.asNode()).object(PERSON).build(),
            QuintPattern.builder().predicate(NAME).build(),
            QuintPattern.builder().predicate(AGE).build()),
            TermName.SUBJECT,
            List.of(new CompoundSelect(1, TermName.OBJECT, "name"),
                new CompoundSelect(2, TermName.OBJECT, "age")));

        List<CompoundResult> results = store.getCompound(compound, QueryOptions.NONE);
        assertEquals(1, results.size(), "Only Alice has a type, a name and an age");
        CompoundResult alice = results.get(0);
        assertEquals(ALICE, alice.joinValue());
        assertEquals(string("Alice"), alice.get("name"));
        assertEquals(integer(30), alice.get("age"));
    }

    @Test
    @DisplayName("Test compound join with default projections")
    public void testCompoundDefaultSelect() throws SQLException {
        loadPeople();

        var compound = new CompoundPattern(List.of(
            QuintPattern.builder().predicate(RDF.type.asNode()).build(),
            QuintPattern.builder().predicate(NAME).build()),
            TermName.SUBJECT);

        List<CompoundResult> results = store.getCompound(compound, QueryOptions.NONE);
        assertEquals(2, results.size(), "Alice and Bob both have a type and a name");
        for (CompoundResult result : results) {
            assertEquals(NAME, result.get("p1_predicate"));
            assertNotNull(result.get("p1_object"));
        }
    }

    @Test
    @DisplayName("Test single-pattern compound returns quints")
    public void testCompoundSinglePattern() throws SQLException {
        loadPeople();

        List<CompoundResult> results = store.getCompound(new CompoundPattern(
            List.of(QuintPattern.builder().predicate(NAME).build()), TermName.SUBJECT),
            QueryOptions.NONE);
        assertEquals(2, results.size());
        assertEquals(1, results.get(0).quints().size());
    }

    @Test
    @DisplayName("Test batch attribute lookup")
    public void testAttributes() throws SQLException {
        loadPeople();

        Map<Node, Map<Node, List<Node>>> attributes = store.getAttributes(
            List.of(ALICE, BOB), List.of(NAME, AGE), GRAPH);
        assertEquals(List.of(string("Alice")), attributes.get(ALICE).get(NAME));
        assertEquals(List.of(integer(30)), attributes.get(ALICE).get(AGE));
        assertEquals(List.of(string("Bob")), attributes.get(BOB).get(NAME));
        assertNull(attributes.get(BOB).get(AGE), "Bob has no age");
        assertTrue(store.getAttributes(List.of(), List.of(NAME), null).isEmpty());
    }

    @Test
    @DisplayName("Test vectors are stored and updated")
    public void testVectors() throws SQLException {
        Quint quint = new Quint(GRAPH, ALICE, NAME, string("Alice"), new float[] {0.5f, 1.0f});
        store.put(quint);
        store.put(new Quint(GRAPH, BOB, NAME, string("Bob")));

        Quint stored = store.get(QuintPattern.exact(quint)).get(0);
        assertArrayEquals(new float[] {0.5f, 1.0f}, stored.getVector());
        assertEquals(1, store.stats().vectorCount());

        int updated = store.updateEmbedding(QuintPattern.builder().subject(BOB).build(),
            new float[] {2.0f});
        assertEquals(1, updated);
        assertEquals(2, store.stats().vectorCount(), "Bob should now carry a vector");
    }

    @Test
    @DisplayName("Test vectors with non-finite components are rejected")
    public void testNonFiniteVector() throws SQLException {
        store.put(new Quint(GRAPH, BOB, NAME, string("Bob"), new float[] {1.0f}));

        assertThrows(IllegalArgumentException.class, () -> store.put(
            new Quint(GRAPH, ALICE, NAME, string("Alice"), new float[] {Float.NaN})));
        assertThrows(IllegalArgumentException.class, () -> store.updateEmbedding(
            QuintPattern.builder().subject(BOB).build(),
            new float[] {0.5f, Float.POSITIVE_INFINITY}));

        assertEquals(1, store.count(QuintPattern.empty()), "Rejected quint should not be stored");
        assertArrayEquals(new float[] {1.0f},
            store.get(QuintPattern.builder().subject(BOB).build()).get(0).getVector(),
            "Rejected update should keep the old vector");
    }

    @Test
    @DisplayName("Test graph listing and statistics")
    public void testListGraphsAndStats() throws SQLException {
        loadPeople();
        store.put(new Quint(Quad.defaultGraphIRI, ALICE, KNOWS, BOB));

        List<Node> graphs = store.listGraphs();
        assertEquals(2, graphs.size());
        assertTrue(graphs.contains(GRAPH));

        StoreStats stats = store.stats();
        assertEquals(7, stats.totalCount());
        assertEquals(0, stats.vectorCount());
        assertEquals(2, stats.graphCount());
    }

    @Test
    @DisplayName("Test clear removes everything")
    public void testClear() throws SQLException {
        loadPeople();
        store.clear();
        assertEquals(0, store.count(QuintPattern.empty()));
    }

    @Test
    @DisplayName("Test open and close are idempotent")
    public void testOpenCloseIdempotent() throws SQLException {
        store.open();
        assertTrue(store.isOpen());
        store.close();
        store.close();
        assertFalse(store.isOpen());
    }

    @Test
    @DisplayName("Test operations on a closed store fail")
    public void testNotOpen() throws SQLException {
        store.close();
        var error = assertThrows(IllegalStateException.class,
            () -> store.get(QuintPattern.empty()));
        assertEquals(QuintStore.NOT_OPEN, error.getMessage());
        assertThrows(IllegalStateException.class, () -> store.multiPut(List.of()));
    }
}
