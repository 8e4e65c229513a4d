package com.quintstore.jena;

import com.quintstore.jena.query.SecurityFilters;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.store.QuintStoreFactory;
import java.sql.SQLException;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.shared.JenaException;

/**
 * Factory and convenience methods for creating Jena {@link Model} and
 * {@link Dataset} instances backed by a quint store.
 */
public final class QuintModelFactory {

    private QuintModelFactory() {
        throw new AssertionError("No instances");
    }

    /**
     * Create a {@link Model} over one named graph of an open store.
     *
     * @param store the store, already open
     * @param graphIri the graph IRI, or null for the union of all graphs
     * @return a Jena {@link Model} backed by the store
     */
    public static Model createModel(final QuintStore store,
                                    final String graphIri) {
        Graph graph = new QuintGraph(store, graphNode(graphIri));
        return ModelFactory.createModelForGraph(graph);
    }

    /**
     * Open a store at an endpoint and create a {@link Model} over one graph.
     *
     * @param endpoint the store endpoint
     * @param graphIri the graph IRI, or null for the union of all graphs
     * @return a Jena {@link Model} backed by the store
     */
    public static Model createModel(final String endpoint,
                                    final String graphIri) {
        return createModel(open(QuintStoreFactory.create(endpoint)), graphIri);
    }

    /**
     * Create a {@link Model} over the union of all graphs in a fresh
     * in-memory store.
     *
     * @return a Jena {@link Model} backed by an in-memory store
     */
    public static Model createDefaultModel() {
        return createModel(QuintStoreFactory.DEFAULT_ENDPOINT, null);
    }

    /**
     * Create a {@link Dataset} over an open store.
     *
     * @param store the store, already open
     * @return a dataset whose default graph is the union of all graphs
     */
    public static Dataset createDataset(final QuintStore store) {
        return DatasetFactory.wrap(new QuintDatasetGraph(store));
    }

    /**
     * Create a {@link Dataset} restricted to a tenant scope.
     *
     * @param store the store, already open
     * @param scope the tenant scope
     * @return the scoped dataset
     */
    public static Dataset createDataset(final QuintStore store,
                                        final SecurityFilters scope) {
        return DatasetFactory.wrap(new QuintDatasetGraph(store, scope));
    }

    /**
     * Obtain a {@link Builder} to configure and create a store-backed
     * {@link Model} or {@link Dataset}.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    private static Node graphNode(final String graphIri) {
        return graphIri == null || graphIri.isEmpty()
            ? null : NodeFactory.createURI(graphIri);
    }

    private static QuintStore open(final QuintStore store) {
        try {
            store.open();
            return store;
        } catch (SQLException e) {
            throw new JenaException("Failed to open quint store", e);
        }
    }

    /**
     * Builder for creating store-backed Jena {@link Model} and
     * {@link Dataset} instances.
     */
    public static class Builder {
        /** Store endpoint to connect to. */
        private String endpoint = QuintStoreFactory.DEFAULT_ENDPOINT;
        /** Graph the model is created for; null for the union. */
        private String graphIri = null;
        /** Graph base path restricting what the dataset sees (optional). */
        private String basePath = null;
        /** Custom store instance (optional). */
        private QuintStore store = null;

        /**
         * Creates a new Builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Set the store endpoint, e.g. {@code sqlite:/var/data/quints.db}
         * or {@code postgres://user:pw@host/db}.
         *
         * @param value the endpoint
         * @return this builder
         */
        public Builder endpoint(final String value) {
            this.endpoint = value;
            return this;
        }

        /**
         * Set the graph the created model reads and writes.
         *
         * @param value the graph IRI
         * @return this builder
         */
        public Builder graph(final String value) {
            this.graphIri = value;
            return this;
        }

        /**
         * Restrict created datasets to graphs under a base path.
         *
         * @param value the base path
         * @return this builder
         */
        public Builder basePath(final String value) {
            this.basePath = value;
            return this;
        }

        /**
         * Set a custom store instance to use.
         * If set, the endpoint setting will be ignored.
         *
         * @param value the store; opened on build if it is not yet open
         * @return this builder
         */
        public Builder store(final QuintStore value) {
            this.store = value;
            return this;
        }

        /**
         * Build a Jena {@link Model} configured with the builder values.
         * With a base path set, writes outside it are refused.
         *
         * @return a store-backed {@link Model}
         */
        public Model build() {
            return ModelFactory.createModelForGraph(
                new QuintGraph(resolveStore(), graphNode(graphIri), scope()));
        }

        /**
         * Build a Jena {@link Dataset} configured with the builder values.
         *
         * @return a store-backed {@link Dataset}
         */
        public Dataset buildDataset() {
            return createDataset(resolveStore(), scope());
        }

        private SecurityFilters scope() {
            return basePath == null
                ? SecurityFilters.none() : SecurityFilters.forBasePath(basePath);
        }

        private QuintStore resolveStore() {
            if (store != null) {
                return store.isOpen() ? store : open(store);
            }
            return open(QuintStoreFactory.create(endpoint));
        }
    }
}
