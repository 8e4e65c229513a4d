package com.quintstore.jena.query;

import com.quintstore.jena.QuintDatasetGraph;
import com.quintstore.jena.store.QueryOptions;
import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.store.TermName;
import com.quintstore.jena.store.TermOperators;
import com.quintstore.jena.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.shared.JenaException;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;
import org.apache.jena.sparql.engine.binding.BindingBuilder;
import org.apache.jena.update.UpdateAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SPARQL entry point over a quint store.
 *
 * <p>SELECT and ASK queries are first offered to the {@link QueryPlanner}.
 * An eligible query is answered with one store lookup: the pattern comes
 * from {@link PatternBuilder}, ordering and the row limit go to the store,
 * and offset, distinct and union-graph deduplication are applied to the
 * fetched rows. Every other query runs on Jena's evaluator over a
 * {@link QuintDatasetGraph}, where {@link QuintOpExecutor} still pushes
 * single triple patterns to the store.</p>
 *
 * <p>The default graph is the union of all graphs in scope. An optional
 * {@link SecurityFilters} scope restricts every read and write.</p>
 */
public class OptimizedQueryEngine {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        OptimizedQueryEngine.class);

    /** Attribute key for whether a query was pushed down. */
    private static final AttributeKey<Boolean> ATTR_PUSHDOWN =
        AttributeKey.booleanKey("quintstore.pushdown");

    /** Attribute key for the query form. */
    private static final AttributeKey<String> ATTR_QUERY_TYPE =
        AttributeKey.stringKey("sparql.query.type");

    /** Attribute key for result count. */
    private static final AttributeKey<Long> ATTR_RESULT_COUNT =
        AttributeKey.longKey("quintstore.result_count");

    /** The backing store. */
    private final QuintStore store;
    /** Dataset seen by the general evaluator. */
    private final QuintDatasetGraph datasetGraph;
    /** Dataset view of {@link #datasetGraph}. */
    private final Dataset dataset;
    /** Query analysis. */
    private final QueryPlanner planner;
    /** Store pattern construction. */
    private final PatternBuilder patternBuilder;
    /** Tracer for query execution. */
    private final Tracer tracer;

    /**
     * Create an unscoped engine.
     *
     * @param store the store, already open
     */
    public OptimizedQueryEngine(final QuintStore store) {
        this(store, SecurityFilters.none());
    }

    /**
     * Create an engine restricted to a scope.
     *
     * @param store the store, already open
     * @param scope the tenant scope, or null for none
     */
    public OptimizedQueryEngine(final QuintStore store, final SecurityFilters scope) {
        this.store = store;
        this.datasetGraph = new QuintDatasetGraph(store, scope);
        this.dataset = DatasetFactory.wrap(datasetGraph);
        this.planner = new QueryPlanner();
        this.patternBuilder = new PatternBuilder(datasetGraph.getScope());
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_QUERY_ENGINE);
        QuintQueryEngineFactory.register();
    }

    /**
     * Get the dataset the general evaluator runs against.
     *
     * @return the dataset graph
     */
    public QuintDatasetGraph getDatasetGraph() {
        return datasetGraph;
    }

    /**
     * Get the tenant scope.
     *
     * @return the scope
     */
    public SecurityFilters getScope() {
        return datasetGraph.getScope();
    }

    /**
     * Run a SELECT query.
     *
     * @param sparql the query text
     * @return the solutions, in result order
     * @throws org.apache.jena.query.QueryParseException if the query does
     *         not parse
     * @throws IllegalArgumentException if the query is not a SELECT
     */
    public List<Binding> select(final String sparql) {
        Query query = QueryFactory.create(sparql);
        if (!query.isSelectType()) {
            throw new IllegalArgumentException("Not a SELECT query");
        }
        Span span = startSpan("select");
        try (Scope scope = span.makeCurrent()) {
            Optional<OptimizeParams> plan = planner.plan(query);
            span.setAttribute(ATTR_PUSHDOWN, plan.isPresent());
            logDecision("SELECT", plan);
            List<Binding> rows = plan.isPresent()
                ? execute(plan.get())
                : evaluate(query);
            span.setAttribute(ATTR_RESULT_COUNT, (long) rows.size());
            span.setStatus(StatusCode.OK);
            return rows;
        } catch (RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Run an ASK query.
     *
     * @param sparql the query text
     * @return whether the pattern has a solution
     * @throws IllegalArgumentException if the query is not an ASK
     */
    public boolean ask(final String sparql) {
        Query query = QueryFactory.create(sparql);
        if (!query.isAskType()) {
            throw new IllegalArgumentException("Not an ASK query");
        }
        Span span = startSpan("ask");
        try (Scope scope = span.makeCurrent()) {
            Optional<OptimizeParams> plan = planner.plan(query);
            span.setAttribute(ATTR_PUSHDOWN, plan.isPresent());
            logDecision("ASK", plan);
            boolean result;
            if (plan.isPresent()) {
                result = !execute(plan.get().withLimit(1)).isEmpty();
            } else {
                try (QueryExecution qexec = QueryExecutionFactory.create(query, dataset)) {
                    result = qexec.execAsk();
                }
            }
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Run a CONSTRUCT query on the general evaluator.
     *
     * @param sparql the query text
     * @return the constructed triples
     */
    public Model construct(final String sparql) {
        Query query = QueryFactory.create(sparql);
        if (!query.isConstructType()) {
            throw new IllegalArgumentException("Not a CONSTRUCT query");
        }
        return graphQuery("construct", query);
    }

    /**
     * Run a DESCRIBE query on the general evaluator.
     *
     * @param sparql the query text
     * @return the description
     */
    public Model describe(final String sparql) {
        Query query = QueryFactory.create(sparql);
        if (!query.isDescribeType()) {
            throw new IllegalArgumentException("Not a DESCRIBE query");
        }
        return graphQuery("describe", query);
    }

    /**
     * Run a SPARQL Update request against the store.
     *
     * @param sparql the update text
     */
    public void update(final String sparql) {
        Span span = startSpan("update");
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute(ATTR_PUSHDOWN, false);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("UPDATE: delegated to the general evaluator");
            }
            UpdateAction.parseExecute(sparql, datasetGraph);
            span.setStatus(StatusCode.OK);
        } catch (RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Model graphQuery(final String form, final Query query) {
        Span span = startSpan(form);
        try (Scope scope = span.makeCurrent();
                QueryExecution qexec = QueryExecutionFactory.create(query, dataset)) {
            span.setAttribute(ATTR_PUSHDOWN, false);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{}: delegated to the general evaluator",
                    form.toUpperCase(Locale.ROOT));
            }
            Model model = query.isConstructType()
                ? qexec.execConstruct()
                : qexec.execDescribe();
            span.setAttribute(ATTR_RESULT_COUNT, model.size());
            span.setStatus(StatusCode.OK);
            return model;
        } catch (RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<Binding> evaluate(final Query query) {
        var rows = new ArrayList<Binding>();
        try (QueryExecution qexec = QueryExecutionFactory.create(query, dataset)) {
            ResultSet results = qexec.execSelect();
            while (results.hasNext()) {
                rows.add(results.nextBinding());
            }
        }
        return rows;
    }

    /**
     * Answer an eligible plan with one store lookup.
     *
     * <p>The store is asked for {@code limit + offset} rows. When union
     * deduplication or DISTINCT removed rows from a full fetch, the fetch
     * is repeated without a limit so the page is still complete.</p>
     *
     * @param params the plan
     * @return the solutions
     */
    List<Binding> execute(final OptimizeParams params) {
        QuintPattern pattern = storePattern(params);
        QueryOptions options = params.queryOptions();
        try {
            List<Quint> quints = store.get(pattern, options);
            var rows = new ArrayList<Binding>(quints.size());
            int dropped = toBindings(params, quints, rows);
            if (dropped > 0 && options.limit() != null
                    && quints.size() >= options.limit()) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Deduplication dropped {} rows from a full page, "
                        + "fetching without limit", dropped);
                }
                quints = store.get(pattern, new QueryOptions(null, null,
                    options.order(), options.reverse()));
                rows.clear();
                toBindings(params, quints, rows);
            }
            return page(rows, params.offset(), params.limit());
        } catch (SQLException e) {
            throw new JenaException("Pushdown query failed", e);
        }
    }

    private QuintPattern storePattern(final OptimizeParams params) {
        QuintPattern pattern = patternBuilder.buildBasePattern(params.triple(),
            params.graph());
        if (!params.hasGraphVariable()) {
            return pattern;
        }
        // GRAPH ?g ranges over named graphs only
        TermOperators named = TermOperators.builder().ne(Quad.defaultGraphIRI).build();
        return pattern.with(TermName.GRAPH,
            PatternBuilder.mergeFilters(pattern.get(TermName.GRAPH), named));
    }

    /**
     * Convert fetched quints to solutions over the projected variables.
     *
     * @return the number of quints dropped as duplicates
     */
    private static int toBindings(final OptimizeParams params,
            final List<Quint> quints, final List<Binding> rows) {
        Map<Var, TermName> variables = params.variables();
        boolean union = params.graph() == null;
        Set<Triple> triples = union ? new HashSet<>() : null;
        Set<String> keys = params.distinct() ? new HashSet<>() : null;
        int dropped = 0;
        for (Quint quint : quints) {
            if (union && !triples.add(quint.asTriple())) {
                dropped++;
                continue;
            }
            BindingBuilder builder = Binding.builder();
            var key = new TreeMap<String, String>();
            for (Map.Entry<Var, TermName> entry : variables.entrySet()) {
                Var var = entry.getKey();
                if (params.projection() != null && !params.projection().contains(var)) {
                    continue;
                }
                Node value = quint.get(entry.getValue());
                builder.add(var, value);
                key.put(var.getVarName(), value.toString());
            }
            if (keys != null && !keys.add(key.toString())) {
                dropped++;
                continue;
            }
            rows.add(builder.build());
        }
        return dropped;
    }

    private static List<Binding> page(final List<Binding> rows, final Long offset,
            final Long limit) {
        int from = offset == null ? 0 : (int) Math.min(offset, rows.size());
        int to = limit == null ? rows.size()
            : (int) Math.min(rows.size(), OptimizeParams.addCapped(from, limit));
        return new ArrayList<>(rows.subList(from, to));
    }

    private void logDecision(final String form, final Optional<OptimizeParams> plan) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{}: {}", form, plan.isPresent()
                ? "pushed down as " + plan.get()
                : "delegated to the general evaluator");
        }
    }

    private Span startSpan(final String operation) {
        return tracer.spanBuilder("OptimizedQueryEngine." + operation)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_QUERY_TYPE, operation)
            .startSpan();
    }
}
