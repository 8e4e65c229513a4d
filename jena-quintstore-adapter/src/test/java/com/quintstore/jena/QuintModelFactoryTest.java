package com.quintstore.jena;

import com.quintstore.jena.query.SecurityFilters;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.store.QuintStoreFactory;
import java.nio.file.Path;
import java.sql.SQLException;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.query.Dataset;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.shared.AccessDeniedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QuintModelFactory.
 */
public class QuintModelFactoryTest {

    private static final String GRAPH = "http://pod.example/alice/profile";
    private static final String OTHER = "http://pod.example/bob/profile";

    private QuintStore store;

    @BeforeEach
    public void setUp() throws SQLException {
        store = QuintStoreFactory.createInMemory();
        store.open();
    }

    @AfterEach
    public void tearDown() throws SQLException {
        store.close();
    }

    @Test
    @DisplayName("Test model over a named graph")
    public void testCreateModel() {
        Model model = QuintModelFactory.createModel(store, GRAPH);
        assertNotNull(model, "Model should not be null");
        assertTrue(model.isEmpty(), "New model should be empty");

        model.createResource("http://example.org/alice")
            .addProperty(model.createProperty("http://example.org/name"), "Alice");
        assertEquals(1, model.size());

        QuintGraph graph = (QuintGraph) model.getGraph();
        assertEquals(NodeFactory.createURI(GRAPH), graph.getGraphNode());
        assertTrue(QuintModelFactory.createModel(store, null).getGraph() instanceof QuintGraph);
        assertTrue(((QuintGraph) QuintModelFactory.createModel(store, "").getGraph()).isUnion(),
            "Empty graph name should give the union view");
    }

    @Test
    @DisplayName("Test default model opens an in-memory store")
    public void testCreateDefaultModel() {
        Model model = QuintModelFactory.createDefaultModel();
        QuintGraph graph = (QuintGraph) model.getGraph();
        assertTrue(graph.getStore().isOpen(), "Store should be opened by the factory");
        assertTrue(graph.isUnion());
    }

    @Test
    @DisplayName("Test dataset over a store")
    public void testCreateDataset() {
        Dataset dataset = QuintModelFactory.createDataset(store);
        dataset.getNamedModel(GRAPH).createResource("http://example.org/alice")
            .addProperty(dataset.getDefaultModel().createProperty("http://example.org/name"),
                "Alice");
        assertTrue(dataset.containsNamedModel(GRAPH));
        assertEquals(1, dataset.getDefaultModel().size());

        Dataset scoped = QuintModelFactory.createDataset(store,
            SecurityFilters.forBasePath("http://pod.example/bob/"));
        assertFalse(scoped.containsNamedModel(GRAPH));
    }

    @Test
    @DisplayName("Test builder with a store and base path")
    public void testBuilderScope() {
        Model allowed = QuintModelFactory.builder()
            .store(store)
            .graph(GRAPH)
            .basePath("http://pod.example/alice/")
            .build();
        allowed.createResource("http://example.org/alice")
            .addProperty(allowed.createProperty("http://example.org/name"), "Alice");
        assertEquals(1, allowed.size());

        Model denied = QuintModelFactory.builder()
            .store(store)
            .graph(OTHER)
            .basePath("http://pod.example/alice/")
            .build();
        var bob = denied.createResource("http://example.org/bob");
        var name = denied.createProperty("http://example.org/name");
        assertThrows(AccessDeniedException.class, () -> bob.addProperty(name, "Bob"));

        Dataset dataset = QuintModelFactory.builder()
            .store(store)
            .basePath("http://pod.example/bob/")
            .buildDataset();
        assertTrue(dataset.getDefaultModel().isEmpty(),
            "Bob's scope should not see Alice's graph");
    }

    @Test
    @DisplayName("Test builder with a file endpoint")
    public void testBuilderEndpoint(@TempDir final Path tempDir) throws SQLException {
        String endpoint = "sqlite:" + tempDir.resolve("quints.db");
        Model model = QuintModelFactory.builder()
            .endpoint(endpoint)
            .graph(GRAPH)
            .build();
        model.createResource("http://example.org/alice")
            .addProperty(model.createProperty("http://example.org/name"), "Alice");
        ((QuintGraph) model.getGraph()).getStore().close();

        Model reopened = QuintModelFactory.createModel(endpoint, GRAPH);
        assertEquals(1, reopened.size(), "Data should persist in the database file");
        ((QuintGraph) reopened.getGraph()).getStore().close();
    }

    @Test
    @DisplayName("Test builder opens a closed store")
    public void testBuilderOpensStore() throws SQLException {
        QuintStore closed = QuintStoreFactory.createInMemory();
        try {
            QuintModelFactory.builder().store(closed).build();
            assertTrue(closed.isOpen());
        } finally {
            closed.close();
        }
    }
}
