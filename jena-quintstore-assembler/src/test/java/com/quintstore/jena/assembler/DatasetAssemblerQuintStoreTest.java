package com.quintstore.jena.assembler;

import org.apache.jena.assembler.Assembler;
import org.apache.jena.assembler.Mode;
import org.apache.jena.assembler.exceptions.AssemblerException;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.sys.JenaSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.quintstore.jena.QuintDatasetGraph;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DatasetAssemblerQuintStore and QuintStoreAssembler, run against
 * in-memory SQLite stores.
 */
public class DatasetAssemblerQuintStoreTest {

    private static final String CONFIG = "http://example.org/config#";

    private Model configModel;

    @BeforeEach
    public void setUp() {
        JenaSystem.init();
        configModel = RDFDataMgr.loadModel("quintstore-dataset.ttl");
    }

    @Test
    @DisplayName("Test dataset assembler builds a scoped quint dataset")
    public void testCreateScopedDataset() {
        Resource root = configModel.getResource(CONFIG + "dataset");
        Dataset dataset = new DatasetAssemblerQuintStore()
            .open(Assembler.general(), root, Mode.DEFAULT);

        assertNotNull(dataset, "Assembler should return a dataset");
        assertInstanceOf(QuintDatasetGraph.class, dataset.asDatasetGraph(),
            "Dataset should be backed by the quint store");
        QuintDatasetGraph dsg = (QuintDatasetGraph) dataset.asDatasetGraph();
        assertTrue(dsg.getScope().allowsGraph(
            NodeFactory.createURI("http://pod.example/alice/notes")),
            "Graphs under the base path should be in scope");
        assertFalse(dsg.getScope().allowsGraph(
            NodeFactory.createURI("http://pod.example/bob/notes")),
            "Graphs of other tenants should be out of scope");
    }

    @Test
    @DisplayName("Test assembled dataset stores and finds quads")
    public void testAssembledDatasetRoundTrip() {
        Resource root = configModel.getResource(CONFIG + "dataset");
        Dataset dataset = new DatasetAssemblerQuintStore().createDataset(
            Assembler.general(), root);
        Quad quad = Quad.create(
            NodeFactory.createURI("http://pod.example/alice/notes"),
            NodeFactory.createURI("http://example.org/note1"),
            NodeFactory.createURI("http://purl.org/dc/terms/title"),
            NodeFactory.createLiteralString("Groceries"));

        dataset.asDatasetGraph().add(quad);

        assertTrue(dataset.asDatasetGraph().contains(quad),
            "Added quad should be found");
        assertTrue(dataset.containsNamedModel("http://pod.example/alice/notes"),
            "Graph should be listed as a named model");
    }

    @Test
    @DisplayName("Test dataset type is registered through the subsystem")
    public void testRegisteredDatasetType() {
        Resource root = configModel.getResource(CONFIG + "dataset");
        Dataset dataset = DatasetFactory.assemble(root);
        assertInstanceOf(QuintDatasetGraph.class, dataset.asDatasetGraph(),
            "qs:QuintStoreDataset should be assembled by the quint store assembler");
    }

    @Test
    @DisplayName("Test model assembler builds a model for one graph")
    public void testModelAssembler() {
        Resource root = configModel.getResource(CONFIG + "model");
        Model model = (Model) Assembler.general().open(root);

        model.createResource("http://example.org/me")
            .addProperty(model.createProperty("http://xmlns.com/foaf/0.1/name"), "Alice");

        assertEquals(1, model.size(), "Model should hold the added statement");
    }

    @Test
    @DisplayName("Test non-integer pool size is rejected")
    public void testInvalidPoolSize() {
        Model config = ModelFactory.createDefaultModel();
        Resource root = config.createResource(CONFIG + "broken")
            .addProperty(QuintStoreVocab.endpoint, "sqlite::memory:")
            .addProperty(QuintStoreVocab.maximumPoolSize, "many");

        assertThrows(AssemblerException.class,
            () -> new DatasetAssemblerQuintStore().createDataset(
                Assembler.general(), root),
            "A pool size that is not an integer should fail assembly");
    }
}
