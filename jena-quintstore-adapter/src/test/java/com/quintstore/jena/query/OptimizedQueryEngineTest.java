package com.quintstore.jena.query;

import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.store.QuintStoreFactory;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.shared.AccessDeniedException;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OptimizedQueryEngine.
 */
public class OptimizedQueryEngineTest {

    private static final String EX = "http://example.org/";
    private static final String PREFIX = "PREFIX ex: <" + EX + "> ";
    private static final String BASE = "http://pod.example/alice/";
    private static final Node PROFILE = NodeFactory.createURI(BASE + "profile");
    private static final Node FRIENDS = NodeFactory.createURI(BASE + "friends");
    private static final Node OTHER = NodeFactory.createURI("http://pod.example/carol/profile");
    private static final Node ALICE = NodeFactory.createURI(EX + "alice");
    private static final Node BOB = NodeFactory.createURI(EX + "bob");
    private static final Node CAROL = NodeFactory.createURI(EX + "carol");
    private static final Node NAME = NodeFactory.createURI(EX + "name");
    private static final Node AGE = NodeFactory.createURI(EX + "age");
    private static final Node KNOWS = NodeFactory.createURI(EX + "knows");

    private QuintStore store;
    private OptimizedQueryEngine engine;

    @BeforeEach
    public void setUp() throws SQLException {
        store = QuintStoreFactory.createInMemory();
        store.open();
        store.multiPut(List.of(
            new Quint(PROFILE, ALICE, NAME, string("Alice")),
            new Quint(PROFILE, ALICE, AGE, integer(30)),
            new Quint(PROFILE, ALICE, KNOWS, BOB),
            new Quint(FRIENDS, BOB, NAME, string("Bob")),
            new Quint(FRIENDS, BOB, AGE, integer(25)),
            new Quint(OTHER, CAROL, NAME, string("Carol")),
            new Quint(OTHER, CAROL, AGE, integer(40)),
            new Quint(Quad.defaultGraphIRI, ALICE, NAME, string("Alice"))));
        engine = new OptimizedQueryEngine(store);
    }

    @AfterEach
    public void tearDown() throws SQLException {
        store.close();
    }

    private static Node string(final String value) {
        return NodeFactory.createLiteralString(value);
    }

    private static Node integer(final int value) {
        return NodeFactory.createLiteral(Integer.toString(value), XSDDatatype.XSDinteger);
    }

    private static List<String> values(final List<Binding> rows, final String var) {
        var values = new ArrayList<String>();
        for (Binding row : rows) {
            Node node = row.get(Var.alloc(var));
            values.add(node.isLiteral() ? node.getLiteralLexicalForm() : node.getURI());
        }
        return values;
    }

    @Test
    @DisplayName("Test single pattern query deduplicates the union")
    public void testSelectUnion() {
        List<Binding> rows = engine.select(PREFIX + "SELECT ?s ?n WHERE { ?s ex:name ?n }");
        assertEquals(Set.of("Alice", "Bob", "Carol"), new HashSet<>(values(rows, "n")));
        assertEquals(3, rows.size(), "Alice's name is stored twice but should appear once");
    }

    @Test
    @DisplayName("Test ordering with a limit refetches after deduplication")
    public void testOrderedLimit() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?n WHERE { ?s ex:name ?n } ORDER BY ?n LIMIT 2");
        assertEquals(List.of("Alice", "Bob"), values(rows, "n"));
    }

    @Test
    @DisplayName("Test offset and descending order")
    public void testOffset() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?n WHERE { ?s ex:name ?n } ORDER BY DESC(?n) LIMIT 1 OFFSET 1");
        assertEquals(List.of("Bob"), values(rows, "n"));
    }

    @Test
    @DisplayName("Test maximum LIMIT with an OFFSET")
    public void testHugeLimitWithOffset() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?s WHERE { ?s ex:name ?n } LIMIT 9223372036854775807 OFFSET 1");
        assertEquals(2, rows.size(), "Three distinct subjects minus the offset");
    }

    @Test
    @DisplayName("Test projection keeps only selected variables")
    public void testProjection() {
        List<Binding> rows = engine.select(PREFIX + "SELECT ?n WHERE { ex:bob ex:name ?n }");
        assertEquals(1, rows.size());
        assertNull(rows.get(0).get(Var.alloc("s")));
        assertEquals("Bob", values(rows, "n").get(0));
    }

    @Test
    @DisplayName("Test DISTINCT over projected variables")
    public void testDistinct() {
        List<Binding> rows = engine.select("SELECT DISTINCT ?s WHERE { ?s ?p ?o }");
        assertEquals(Set.of(ALICE.getURI(), BOB.getURI(), CAROL.getURI()),
            new HashSet<>(values(rows, "s")));
        assertEquals(3, rows.size());
    }

    @Test
    @DisplayName("Test graph variable ranges over named graphs only")
    public void testGraphVariable() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?g ?n WHERE { GRAPH ?g { ?s ex:name ?n } }");
        assertEquals(3, rows.size(), "Default graph copy should not be matched");
        assertFalse(values(rows, "g").contains(""));
        assertTrue(values(rows, "g").contains(PROFILE.getURI()));
    }

    @Test
    @DisplayName("Test named graph query")
    public void testNamedGraph() {
        List<Binding> rows = engine.select(
            "SELECT ?p WHERE { GRAPH <" + PROFILE.getURI() + "> { ?s ?p ?o } }");
        assertEquals(3, rows.size());
    }

    @Test
    @DisplayName("Test ASK queries")
    public void testAsk() {
        assertTrue(engine.ask(PREFIX + "ASK { ex:alice ex:knows ex:bob }"));
        assertFalse(engine.ask(PREFIX + "ASK { ex:bob ex:knows ex:alice }"));
        assertTrue(engine.ask(PREFIX + "ASK { ?s ex:age ?a FILTER(?a > 35) }"),
            "Filtered ASK should use the general evaluator");
    }

    @Test
    @DisplayName("Test filter over one pattern")
    public void testFilteredPattern() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?s WHERE { ?s ex:age ?a FILTER(?a >= 30) }");
        assertEquals(Set.of(ALICE.getURI(), CAROL.getURI()), new HashSet<>(values(rows, "s")));

        List<Binding> exact = engine.select(PREFIX
            + "SELECT ?s WHERE { ?s ex:name ?n FILTER(?n = \"Bob\") }");
        assertEquals(List.of(BOB.getURI()), values(exact, "s"));

        List<Binding> anchored = engine.select(PREFIX
            + "SELECT ?n WHERE { ?s ex:name ?n FILTER(REGEX(?n, \"^C\")) }");
        assertEquals(List.of("Carol"), values(anchored, "n"));
    }

    @Test
    @DisplayName("Test join with filter uses the general evaluator")
    public void testJoin() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?n WHERE { ?s ex:name ?n . ?s ex:age ?a FILTER(?a > 26) }");
        assertEquals(Set.of("Alice", "Carol"), new HashSet<>(values(rows, "n")));
        assertEquals(2, rows.size());
    }

    @Test
    @DisplayName("Test OPTIONAL binds per solution")
    public void testOptional() {
        List<Binding> rows = engine.select(PREFIX
            + "SELECT ?s ?f WHERE { ?s ex:name ?n OPTIONAL { ?s ex:knows ?f } }");
        assertEquals(3, rows.size());
        for (Binding row : rows) {
            Node friend = row.get(Var.alloc("f"));
            if (ALICE.equals(row.get(Var.alloc("s")))) {
                assertEquals(BOB, friend);
            } else {
                assertNull(friend, "Only Alice knows someone");
            }
        }
    }

    @Test
    @DisplayName("Test CONSTRUCT and DESCRIBE")
    public void testGraphQueries() {
        Model model = engine.construct(PREFIX
            + "CONSTRUCT { ?s ex:label ?n } WHERE { ?s ex:name ?n }");
        assertEquals(3, model.size());

        Model description = engine.describe(PREFIX + "DESCRIBE ex:bob");
        assertTrue(description.size() >= 2, "Bob's name and age should be described");
    }

    @Test
    @DisplayName("Test SPARQL update writes to the store")
    public void testUpdate() throws SQLException {
        engine.update(PREFIX + "INSERT DATA { GRAPH <" + FRIENDS.getURI()
            + "> { ex:bob ex:knows ex:carol } }");
        assertTrue(engine.ask(PREFIX + "ASK { ex:bob ex:knows ex:carol }"));

        engine.update(PREFIX + "DELETE WHERE { GRAPH ?g { ?s ex:age ?a } }");
        assertEquals(0, store.count(QuintPattern.builder().predicate(AGE).build()));
    }

    @Test
    @DisplayName("Test wrong query forms and parse errors are rejected")
    public void testWrongForms() {
        assertThrows(IllegalArgumentException.class, () -> engine.select("ASK { ?s ?p ?o }"));
        assertThrows(IllegalArgumentException.class,
            () -> engine.ask("SELECT * WHERE { ?s ?p ?o }"));
        assertThrows(IllegalArgumentException.class,
            () -> engine.construct("SELECT * WHERE { ?s ?p ?o }"));
        assertThrows(QueryParseException.class, () -> engine.select("SELECT WHERE {"));
    }

    @Test
    @DisplayName("Test scoped engine sees only graphs in scope")
    public void testScopedEngine() {
        var scoped = new OptimizedQueryEngine(store, SecurityFilters.forBasePath(BASE));
        assertFalse(scoped.getScope().isEmpty());

        List<Binding> names = scoped.select(PREFIX + "SELECT ?n WHERE { ?s ex:name ?n }");
        assertEquals(Set.of("Alice", "Bob"), new HashSet<>(values(names, "n")));

        List<Binding> other = scoped.select(
            "SELECT ?s WHERE { GRAPH <" + OTHER.getURI() + "> { ?s ?p ?o } }");
        assertTrue(other.isEmpty(), "Graph outside the scope should match nothing");

        List<Binding> filtered = scoped.select(PREFIX + "SELECT ?g WHERE { GRAPH ?g "
            + "{ ?s ex:name ?n } FILTER(STRSTARTS(STR(?g), \"http://pod.example/\")) }");
        assertEquals(2, filtered.size(), "Filter on the graph should not widen the scope");

        assertThrows(AccessDeniedException.class, () -> scoped.update(PREFIX
            + "INSERT DATA { GRAPH <" + OTHER.getURI() + "> { ex:carol ex:knows ex:alice } }"));
    }
}
