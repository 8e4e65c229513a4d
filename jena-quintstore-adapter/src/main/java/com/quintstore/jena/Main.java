package com.quintstore.jena;

import com.quintstore.jena.query.OptimizedQueryEngine;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.store.QuintStoreFactory;
import java.sql.SQLException;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.rdf.model.StmtIterator;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;
import org.apache.jena.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple demo application that shows basic usage of the quint store.
 * <p>
 * This class is intended for local manual testing and examples; it opens a
 * store, writes a small RDF dataset into a named graph, runs a SPARQL query
 * through the push-down engine and prints the results.
 * <p>
 * Connection settings can be configured via environment variables:
 * <ul>
 *   <li>QUINTSTORE_ENDPOINT - store endpoint (default: sqlite::memory:)</li>
 * </ul>
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Sample age used in the demo person resource. */
    private static final int SAMPLE_AGE = 30;

    /** Environment variable name for the store endpoint. */
    private static final String ENV_ENDPOINT = "QUINTSTORE_ENDPOINT";

    /** Graph the demo writes to. */
    static final String DEMO_GRAPH = "http://example.org/graphs/demo";

    /** Prevent instantiation of this utility/demo class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Demo entry point.
     *
     * @param args command line arguments (ignored)
     */
    public static void main(final String[] args) {
        String endpoint = System.getenv(ENV_ENDPOINT);
        if (endpoint == null || endpoint.isEmpty()) {
            endpoint = QuintStoreFactory.DEFAULT_ENDPOINT;
        }
        runDemo(endpoint);
    }

    /**
     * Run the demo against the given endpoint.
     * This method is package-private to allow testing.
     *
     * @param endpoint the store endpoint
     * @return true when the demo completed
     */
    static boolean runDemo(final String endpoint) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Jena QuintStore Demo");
            LOGGER.info("===============================================");
        }

        try (QuintStore store = QuintStoreFactory.create(endpoint)) {
            store.open();
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Opened store at {}", endpoint);
            }

            Model model = QuintModelFactory.createModel(store, DEMO_GRAPH);
            Property name = model.createProperty("http://example.org/name");
            Property age = model.createProperty("http://example.org/age");
            Resource person = setupSampleData(model, name, age);
            printAllStatements(model);

            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("\n=== Querying: People older than 18 ===");
            }
            var engine = new OptimizedQueryEngine(store);
            for (Binding row : engine.select(
                    "SELECT ?person ?name WHERE { "
                    + "?person <http://example.org/name> ?name . "
                    + "?person <http://example.org/age> ?age . "
                    + "FILTER(?age > 18) }")) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info("  {} -> {}", row.get(Var.alloc("person")),
                        row.get(Var.alloc("name")));
                }
            }

            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("\n=== Deleting: Remove age property ===");
            }
            person.removeAll(age);
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Model size after delete: {}", model.size());
                LOGGER.info("Store stats: {}", store.stats());
                LOGGER.info("\nDemo completed successfully");
            }
            return true;
        } catch (SQLException | RuntimeException e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("Error: {}", e.getMessage());
                LOGGER.error("Make sure the store at {} is reachable", endpoint);
            }
            LOGGER.error("Stack trace:", e);
            return false;
        }
    }

    private static Resource setupSampleData(final Model model,
            final Property name, final Property age) {
        Resource person = model.createResource(
            "http://example.org/person/john"
        );
        person.addProperty(RDF.type, model.createResource(
            "http://example.org/Person"
        ));
        person.addProperty(name, "John Doe");
        person.addProperty(age, model.createTypedLiteral(SAMPLE_AGE));

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Added sample RDF data");
            LOGGER.info("Model size: {}", model.size());
        }
        return person;
    }

    private static void printAllStatements(final Model model) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("\n=== Querying: List All Statements ===");
        }
        StmtIterator iter = model.listStatements();
        while (iter.hasNext()) {
            Statement stmt = iter.nextStatement();
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("{}", stmt);
            }
        }
    }
}
