package com.quintstore.jena.assembler;

import com.quintstore.jena.QuintModelFactory;
import com.quintstore.jena.store.QuintStoreFactory;
import org.apache.jena.assembler.Assembler;
import org.apache.jena.assembler.Mode;
import org.apache.jena.assembler.assemblers.AssemblerBase;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembler for a Model over one graph of a quint store.
 *
 * <p>Configuration properties:</p>
 * <ul>
 *   <li>{@code qs:endpoint} - store endpoint (default: "sqlite::memory:")</li>
 *   <li>{@code qs:maximumPoolSize} - pool size (default: 10)</li>
 *   <li>{@code qs:graph} - graph IRI (default: the union of all graphs)</li>
 * </ul>
 */
public class QuintStoreAssembler extends AssemblerBase {

    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintStoreAssembler.class);

    /** Singleton instance of this assembler. */
    public static final Assembler INSTANCE = new QuintStoreAssembler();

    @Override
    public Model open(final Assembler a, final Resource root, final Mode mode) {
        String endpoint = AssemblerProperties.getString(root,
            QuintStoreVocab.endpoint, QuintStoreFactory.DEFAULT_ENDPOINT);
        int poolSize = AssemblerProperties.getInt(root,
            QuintStoreVocab.maximumPoolSize,
            QuintStoreFactory.DEFAULT_MAXIMUM_POOL_SIZE);
        String graph = AssemblerProperties.getString(root,
            QuintStoreVocab.graph, null);

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Creating quint store model: endpoint={}, graph={}",
                endpoint, graph == null ? "(union)" : graph);
        }

        return QuintModelFactory.builder()
            .store(QuintStoreFactory.builder()
                .endpoint(endpoint)
                .maximumPoolSize(poolSize)
                .build())
            .graph(graph)
            .build();
    }
}
