package com.quintstore.jena.assembler;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.ResourceFactory;

/**
 * Vocabulary for declaring quint-store-backed datasets and models in
 * assembler configuration files.
 *
 * <p>Example configuration in Turtle format:</p>
 * <pre>
 * {@literal @}prefix qs: &lt;http://quintstore.com/jena/assembler#&gt; .
 *
 * :dataset a qs:QuintStoreDataset ;
 *     qs:endpoint "sqlite:/var/data/quints.db" ;
 *     qs:maximumPoolSize 10 ;
 *     qs:basePath "http://pod.example/alice/" .
 * </pre>
 */
public final class QuintStoreVocab {

    /**
     * The namespace URI for the quint store assembler vocabulary.
     */
    public static final String NS = "http://quintstore.com/jena/assembler#";

    /**
     * Returns the namespace URI for the quint store assembler vocabulary.
     *
     * @return the namespace URI
     */
    public static String getURI() {
        return NS;
    }

    private static Resource resource(final String localName) {
        return ResourceFactory.createResource(NS + localName);
    }

    private static Property property(final String localName) {
        return ResourceFactory.createProperty(NS, localName);
    }

    /**
     * The type for a store-backed dataset.
     * Usage: {@code :dataset a qs:QuintStoreDataset .}
     */
    public static final Resource QuintStoreDataset = resource("QuintStoreDataset");

    /**
     * The type for a store-backed model over one graph.
     * Usage: {@code :model a qs:QuintStoreModel ; qs:graph "http://..." .}
     */
    public static final Resource QuintStoreModel = resource("QuintStoreModel");

    /**
     * Store endpoint, e.g. {@code sqlite:/path/db} or
     * {@code postgres://user:pw@host/db}.
     * Default value: "sqlite::memory:"
     */
    public static final Property endpoint = property("endpoint");

    /**
     * Connection pool size for PostgreSQL endpoints.
     * Default value: 10
     */
    public static final Property maximumPoolSize = property("maximumPoolSize");

    /**
     * Graph base path restricting what a dataset sees. Optional.
     */
    public static final Property basePath = property("basePath");

    /**
     * Graph IRI of a model. Optional; without it the model is the union of
     * all graphs.
     */
    public static final Property graph = property("graph");

    /** Private constructor to prevent instantiation. */
    private QuintStoreVocab() {
        throw new AssertionError("No instances");
    }
}
