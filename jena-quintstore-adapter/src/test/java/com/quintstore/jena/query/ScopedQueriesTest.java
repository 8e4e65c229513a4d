package com.quintstore.jena.query;

import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.store.QuintStoreFactory;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.shared.AccessDeniedException;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScopedQueries.
 */
public class ScopedQueriesTest {

    private static final String EX = "http://example.org/";
    private static final String ALICE_POD = "http://pod.example/alice/";
    private static final String BOB_POD = "http://pod.example/bob/";
    private static final Node PROFILE = NodeFactory.createURI(ALICE_POD + "profile");
    private static final Node NOTES = NodeFactory.createURI(ALICE_POD + "notes/1");
    private static final Node BOB_PROFILE = NodeFactory.createURI(BOB_POD + "profile");
    private static final Node NAME = NodeFactory.createURI(EX + "name");
    private static final Node TEXT = NodeFactory.createURI(EX + "text");

    private QuintStore store;
    private ScopedQueries queries;

    @BeforeEach
    public void setUp() throws SQLException {
        store = QuintStoreFactory.createInMemory();
        store.open();
        store.multiPut(List.of(
            new Quint(PROFILE, NodeFactory.createURI(EX + "alice"), NAME,
                NodeFactory.createLiteralString("Alice")),
            new Quint(NOTES, NodeFactory.createURI(EX + "note1"), TEXT,
                NodeFactory.createLiteralString("Buy milk")),
            new Quint(BOB_PROFILE, NodeFactory.createURI(EX + "bob"), NAME,
                NodeFactory.createLiteralString("Bob"))));
        queries = new ScopedQueries(store);
    }

    @AfterEach
    public void tearDown() throws SQLException {
        store.close();
    }

    @Test
    @DisplayName("Test listing a tenant's graphs")
    public void testListGraphs() {
        assertEquals(Set.of(PROFILE.getURI(), NOTES.getURI()), queries.listGraphs(ALICE_POD));
        assertEquals(Set.of(BOB_PROFILE.getURI()), queries.listGraphs(BOB_POD));
        assertTrue(queries.listGraphs("http://pod.example/nobody/").isEmpty());
    }

    @Test
    @DisplayName("Test SELECT sees only the tenant's data")
    public void testSelect() {
        List<Binding> rows = queries.select(
            "SELECT ?n WHERE { ?s <" + NAME.getURI() + "> ?n }", ALICE_POD);
        assertEquals(1, rows.size());
        assertEquals("Alice", rows.get(0).get(Var.alloc("n")).getLiteralLexicalForm());
        assertFalse(queries.ask("ASK { ?s ?p \"Bob\" }", ALICE_POD));
        assertTrue(queries.ask("ASK { ?s ?p \"Bob\" }", BOB_POD));
    }

    @Test
    @DisplayName("Test resource scope covers the graph and its metadata")
    public void testResourceScope() throws SQLException {
        Node metadata = NodeFactory.createURI(PROFILE.getURI() + SecurityFilters.METADATA_SUFFIX);
        store.put(new Quint(metadata, PROFILE, NodeFactory.createURI(EX + "modified"),
            NodeFactory.createLiteralString("today")));

        List<Binding> rows = queries.select("SELECT ?s WHERE { ?s ?p ?o }", PROFILE.getURI());
        assertEquals(2, rows.size(), "Profile and its metadata graph should be visible");
    }

    @Test
    @DisplayName("Test copying one graph")
    public void testConstructGraph() {
        Model profile = queries.constructGraph(PROFILE.getURI(), ALICE_POD);
        assertEquals(1, profile.size());

        Model foreign = queries.constructGraph(BOB_PROFILE.getURI(), ALICE_POD);
        assertTrue(foreign.isEmpty(), "Graph outside the scope should copy as empty");
    }

    @Test
    @DisplayName("Test CONSTRUCT within the scope")
    public void testConstruct() {
        Model model = queries.construct(
            "CONSTRUCT { ?s ?p ?o } WHERE { ?s ?p ?o }", ALICE_POD);
        assertEquals(2, model.size());
    }

    @Test
    @DisplayName("Test updates are confined to the scope")
    public void testUpdate() {
        queries.update("INSERT DATA { GRAPH <" + NOTES.getURI() + "> { <" + EX
            + "note1> <" + TEXT.getURI() + "> \"Buy bread\" } }", ALICE_POD);
        assertTrue(queries.ask("ASK { ?s ?p \"Buy bread\" }", ALICE_POD));

        assertThrows(AccessDeniedException.class, () -> queries.update(
            "INSERT DATA { GRAPH <" + BOB_PROFILE.getURI() + "> { <" + EX
            + "bob> <" + NAME.getURI() + "> \"Robert\" } }", ALICE_POD));
        assertFalse(queries.ask("ASK { ?s ?p \"Robert\" }", BOB_POD));
    }

    @Test
    @DisplayName("Test engine for a tenant")
    public void testEngine() {
        OptimizedQueryEngine engine = queries.engine(ALICE_POD);
        assertTrue(engine.getScope().allowsGraph(PROFILE));
        assertFalse(engine.getScope().allowsGraph(BOB_PROFILE));
    }
}
