package com.quintstore.jena.assembler;

import com.quintstore.jena.query.QuintQueryEngineFactory;
import org.apache.jena.assembler.Assembler;
import org.apache.jena.sparql.core.assembler.AssemblerUtils;
import org.apache.jena.sys.JenaSubsystemLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the quint store assemblers when Jena initializes.
 *
 * <p>Loaded through the {@code JenaSubsystemLifecycle} service entry.
 * Store pushdown inside Jena evaluation is not switched on here;
 * applications call {@link QuintQueryEngineFactory#register()} or use
 * {@code OptimizedQueryEngine}, which registers it.</p>
 *
 * @see DatasetAssemblerQuintStore
 * @see QuintStoreAssembler
 * @see QuintStoreVocab
 */
public class QuintStoreInit implements JenaSubsystemLifecycle {

    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintStoreInit.class);

    /**
     * Creates a new QuintStoreInit instance.
     */
    public QuintStoreInit() {
        // Default constructor for SPI discovery
    }

    /**
     * Level 500 runs after core Jena initialization.
     *
     * @return the initialization level
     */
    @Override
    public int level() {
        return 500;
    }

    @Override
    public void start() {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Initializing quint store assembler");
        }
        AssemblerUtils.registerDataset(
            QuintStoreVocab.QuintStoreDataset,
            new DatasetAssemblerQuintStore()
        );
        Assembler.general().implementWith(
            QuintStoreVocab.QuintStoreModel,
            QuintStoreAssembler.INSTANCE
        );
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Quint store assembler registered for types: {}, {}",
                QuintStoreVocab.QuintStoreDataset, QuintStoreVocab.QuintStoreModel);
        }
    }

    @Override
    public void stop() {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Quint store assembler stopped");
        }
    }
}
