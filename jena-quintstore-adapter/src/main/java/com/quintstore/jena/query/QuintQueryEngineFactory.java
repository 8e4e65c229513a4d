package com.quintstore.jena.query;

import com.quintstore.jena.QuintGraph;
import org.apache.jena.graph.Graph;
import org.apache.jena.query.Query;
import org.apache.jena.sparql.algebra.Op;
import org.apache.jena.sparql.core.DatasetGraph;
import org.apache.jena.sparql.engine.Plan;
import org.apache.jena.sparql.engine.QueryEngineFactory;
import org.apache.jena.sparql.engine.QueryEngineRegistry;
import org.apache.jena.sparql.engine.binding.Binding;
import org.apache.jena.sparql.engine.main.QC;
import org.apache.jena.sparql.engine.main.QueryEngineMain;
import org.apache.jena.sparql.util.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query engine factory for quint-store-backed datasets.
 *
 * <p>Engines created here evaluate with {@link QuintOpExecutor}, so single
 * triple patterns and filters over them are answered by the store
 * directly.</p>
 *
 * <h2>Registration:</h2>
 * <pre>{@code
 * QuintQueryEngineFactory.register();
 *
 * Model model = QuintModelFactory.createModel(store, "http://example.org/g");
 * try (QueryExecution qexec = QueryExecutionFactory.create(query, model)) {
 *     ResultSet results = qexec.execSelect();
 * }
 * }</pre>
 */
public final class QuintQueryEngineFactory implements QueryEngineFactory {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintQueryEngineFactory.class);

    /** Singleton instance. */
    private static final QuintQueryEngineFactory INSTANCE =
        new QuintQueryEngineFactory();

    /** Whether the factory has been registered. */
    private static volatile boolean registered = false;

    /** Private constructor for singleton. */
    private QuintQueryEngineFactory() {
        // Singleton
    }

    /**
     * Get the singleton factory instance.
     *
     * @return the factory instance
     */
    public static QuintQueryEngineFactory get() {
        return INSTANCE;
    }

    /**
     * Register this factory with the Jena query engine registry. Calling
     * it again has no effect.
     */
    public static synchronized void register() {
        if (!registered) {
            QueryEngineRegistry.addFactory(INSTANCE);
            registered = true;
            LOGGER.info("Quint store query engine factory registered");
        }
    }

    /**
     * Unregister this factory from the Jena query engine registry.
     */
    public static synchronized void unregister() {
        if (registered) {
            QueryEngineRegistry.removeFactory(INSTANCE);
            registered = false;
            LOGGER.info("Quint store query engine factory unregistered");
        }
    }

    /**
     * Check if the factory is currently registered.
     *
     * @return true if registered
     */
    public static boolean isRegistered() {
        return registered;
    }

    @Override
    public boolean accept(final Query query, final DatasetGraph dsg,
            final Context cxt) {
        return hasQuintGraph(dsg);
    }

    @Override
    public boolean accept(final Op op, final DatasetGraph dsg, final Context cxt) {
        return hasQuintGraph(dsg);
    }

    @Override
    public Plan create(final Query query, final DatasetGraph dsg,
            final Binding input, final Context cxt) {
        return new QuintQueryEngine(query, dsg, input, setupContext(cxt)).getPlan();
    }

    @Override
    public Plan create(final Op op, final DatasetGraph dsg, final Binding input,
            final Context cxt) {
        return new QuintQueryEngine(op, dsg, input, setupContext(cxt)).getPlan();
    }

    private Context setupContext(final Context cxt) {
        Context newContext = cxt != null ? cxt.copy() : new Context();
        QC.setFactory(newContext, new QuintOpExecutor.Factory());
        return newContext;
    }

    /**
     * Check whether the dataset's default graph is a quint graph. Named
     * graphs of a quint dataset are always quint graphs too, so the default
     * graph decides. An inference model over a quint graph is not accepted:
     * its rules need the standard evaluation.
     *
     * @param dsg the dataset graph to check
     * @return true if the default graph is a QuintGraph
     */
    private boolean hasQuintGraph(final DatasetGraph dsg) {
        if (dsg == null) {
            return false;
        }
        Graph defaultGraph = dsg.getDefaultGraph();
        return defaultGraph instanceof QuintGraph;
    }

    /**
     * Query engine evaluating with {@link QuintOpExecutor}.
     */
    private static final class QuintQueryEngine extends QueryEngineMain {

        QuintQueryEngine(final Query query, final DatasetGraph dataset,
                final Binding initial, final Context context) {
            super(query, dataset, initial, context);
        }

        QuintQueryEngine(final Op op, final DatasetGraph dataset,
                final Binding initial, final Context context) {
            super(op, dataset, initial, context);
        }
    }
}
