package com.quintstore.jena.query;

import com.quintstore.jena.QuintGraph;
import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.reasoner.InfGraph;
import org.apache.jena.sparql.algebra.op.OpBGP;
import org.apache.jena.sparql.algebra.op.OpFilter;
import org.apache.jena.sparql.core.Substitute;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.ExecutionContext;
import org.apache.jena.sparql.engine.QueryIterator;
import org.apache.jena.sparql.engine.binding.Binding;
import org.apache.jena.sparql.engine.binding.BindingBuilder;
import org.apache.jena.sparql.engine.iterator.QueryIterPlainWrapper;
import org.apache.jena.sparql.engine.main.OpExecutor;
import org.apache.jena.sparql.engine.main.OpExecutorFactory;
import org.apache.jena.sparql.expr.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpExecutor that answers single-triple patterns straight from the quint
 * store.
 *
 * <p>For a basic graph pattern with one triple, each incoming solution is
 * substituted into the triple and the resulting pattern is sent to the
 * store through {@link PatternBuilder}, so the tenant scope always
 * applies. For a FILTER directly over such a pattern, conditions that
 * {@link FilterPushdownExtractor} can express are merged into the store
 * pattern and the remaining expressions are evaluated over the rows the
 * store returns.</p>
 *
 * <p>Larger patterns, and any pattern whose pushdown fails, go through the
 * standard evaluation, which reads the same store through
 * {@link QuintGraph#find}.</p>
 */
public final class QuintOpExecutor extends OpExecutor {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintOpExecutor.class);

    /** Attribute key for the store pattern. */
    private static final AttributeKey<String> ATTR_PATTERN =
        AttributeKey.stringKey("quintstore.pattern");

    /** Attribute key for result count. */
    private static final AttributeKey<Long> ATTR_RESULT_COUNT =
        AttributeKey.longKey("quintstore.result_count");

    /** Attribute key for fallback indicator. */
    private static final AttributeKey<Boolean> ATTR_FALLBACK =
        AttributeKey.booleanKey("quintstore.fallback");

    /** Attribute key for the number of pushed variables. */
    private static final AttributeKey<Long> ATTR_PUSHED_FILTERS =
        AttributeKey.longKey("quintstore.filter.pushed");

    /** Attribute key for optimization type. */
    private static final AttributeKey<String> ATTR_OPTIMIZATION_TYPE =
        AttributeKey.stringKey("quintstore.optimization.type");

    /** Tracer for executor operations. */
    private final Tracer tracer;

    /** The active quint graph, or null if the active graph is not one. */
    private final QuintGraph quintGraph;

    /** Filter extraction. */
    private final FilterPushdownExtractor extractor = new FilterPushdownExtractor();

    /**
     * Factory for creating QuintOpExecutor instances.
     */
    public static class Factory implements OpExecutorFactory {
        /**
         * Constructs a new Factory.
         */
        public Factory() {
            // Default constructor
        }

        @Override
        public OpExecutor create(final ExecutionContext execCxt) {
            return new QuintOpExecutor(execCxt);
        }
    }

    /**
     * Create a new QuintOpExecutor.
     *
     * @param execCxt the execution context
     */
    public QuintOpExecutor(final ExecutionContext execCxt) {
        super(execCxt);
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_QUERY_ENGINE);
        this.quintGraph = findQuintGraph(execCxt.getActiveGraph());
    }

    /**
     * Execute a basic graph pattern. Only single-triple patterns are
     * pushed to the store.
     *
     * @param opBGP the BGP operation
     * @param input the input query iterator
     * @return the result query iterator
     */
    @Override
    protected QueryIterator execute(final OpBGP opBGP, final QueryIterator input) {
        if (quintGraph == null || opBGP.getPattern().size() != 1) {
            return super.execute(opBGP, input);
        }
        List<Binding> parents = drain(input);

        Span span = tracer.spanBuilder("QuintOpExecutor.execute")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPTIMIZATION_TYPE, "BGP_EXECUTION")
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            Triple triple = opBGP.getPattern().get(0);
            PatternBuilder builder = new PatternBuilder(quintGraph.getScope());
            var results = new ArrayList<Binding>();
            for (Binding parent : parents) {
                QuintPattern pattern = builder.buildExistsPattern(triple,
                    quintGraph.getGraphNode(), parent);
                span.setAttribute(ATTR_PATTERN, pattern.toString());
                results.addAll(match(parent, Substitute.substitute(triple, parent),
                    pattern, List.of()));
            }
            span.setAttribute(ATTR_FALLBACK, false);
            span.setAttribute(ATTR_RESULT_COUNT, (long) results.size());
            span.setStatus(StatusCode.OK);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("BGP pushdown: {} input solutions, {} results",
                    parents.size(), results.size());
            }
            return QueryIterPlainWrapper.create(results.iterator(), execCxt);
        } catch (Exception e) {
            span.setAttribute(ATTR_FALLBACK, true);
            TracingUtil.recordFailure(span, e);
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn("Error during BGP pushdown, falling back: {}",
                    e.getMessage());
            }
            return super.execute(opBGP, replay(parents));
        } finally {
            span.end();
        }
    }

    /**
     * Execute a FILTER. Only a filter directly over a single-triple
     * pattern is pushed to the store.
     *
     * @param opFilter the filter operation
     * @param input the input query iterator
     * @return the result query iterator
     */
    @Override
    protected QueryIterator execute(final OpFilter opFilter, final QueryIterator input) {
        if (quintGraph == null || !(opFilter.getSubOp() instanceof OpBGP bgp)
                || bgp.getPattern().size() != 1) {
            return super.execute(opFilter, input);
        }
        List<Binding> parents = drain(input);

        Span span = tracer.spanBuilder("QuintOpExecutor.executeFilter")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPTIMIZATION_TYPE, "FILTER_EXECUTION")
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            Triple triple = bgp.getPattern().get(0);
            PatternBuilder builder = new PatternBuilder(quintGraph.getScope());
            var results = new ArrayList<Binding>();
            long pushed = 0;
            for (Binding parent : parents) {
                Triple resolved = Substitute.substitute(triple, parent);
                PushdownResult pushdown = extractor.extract(opFilter.getExprs(),
                    FilterPushdownExtractor.positions(resolved, null));
                pushed = Math.max(pushed, pushdown.filters().size());
                QuintPattern pattern = builder.buildQuintPattern(resolved,
                    quintGraph.getGraphNode(), pushdown.filters());
                span.setAttribute(ATTR_PATTERN, pattern.toString());
                results.addAll(match(parent, resolved, pattern, pushdown.remainder()));
            }
            span.setAttribute(ATTR_FALLBACK, false);
            span.setAttribute(ATTR_PUSHED_FILTERS, pushed);
            span.setAttribute(ATTR_RESULT_COUNT, (long) results.size());
            span.setStatus(StatusCode.OK);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("FILTER pushdown: {} variables pushed, {} results",
                    pushed, results.size());
            }
            return QueryIterPlainWrapper.create(results.iterator(), execCxt);
        } catch (Exception e) {
            span.setAttribute(ATTR_FALLBACK, true);
            TracingUtil.recordFailure(span, e);
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn("Error during FILTER pushdown, falling back: {}",
                    e.getMessage());
            }
            return super.execute(opFilter, replay(parents));
        } finally {
            span.end();
        }
    }

    /**
     * Fetch the rows of a pattern and turn them into solutions extending a
     * parent solution.
     *
     * @param parent the incoming solution
     * @param triple the triple pattern with the parent's values substituted
     * @param pattern the store pattern
     * @param remainder expressions every solution must satisfy
     * @return the solutions
     * @throws SQLException if the store query fails
     */
    private List<Binding> match(final Binding parent, final Triple triple,
            final QuintPattern pattern, final List<Expr> remainder)
            throws SQLException {
        QuintStore store = quintGraph.getStore();
        List<Quint> quints = store.get(pattern);
        Set<Triple> seen = quintGraph.isUnion() ? new HashSet<>() : null;
        var solutions = new ArrayList<Binding>();
        for (Quint quint : quints) {
            if (seen != null && !seen.add(quint.asTriple())) {
                continue;
            }
            Binding solution = bind(parent, triple, quint);
            if (solution != null && satisfies(solution, remainder)) {
                solutions.add(solution);
            }
        }
        return solutions;
    }

    private boolean satisfies(final Binding solution, final List<Expr> remainder) {
        for (Expr expr : remainder) {
            if (!expr.isSatisfied(solution, execCxt)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Extend a parent solution with the variables of a triple pattern.
     *
     * @return the solution, or null when a repeated variable takes two
     *         different values
     */
    private static Binding bind(final Binding parent, final Triple triple,
            final Quint quint) {
        Map<Var, Node> values = new HashMap<>();
        if (!put(values, triple.getSubject(), quint.getSubject())
                || !put(values, triple.getPredicate(), quint.getPredicate())
                || !put(values, triple.getObject(), quint.getObject())) {
            return null;
        }
        BindingBuilder builder = Binding.builder(parent);
        values.forEach(builder::add);
        return builder.build();
    }

    private static boolean put(final Map<Var, Node> values, final Node node,
            final Node value) {
        if (!node.isVariable()) {
            return true;
        }
        Node previous = values.putIfAbsent(Var.alloc(node), value);
        return previous == null || previous.equals(value);
    }

    private static List<Binding> drain(final QueryIterator input) {
        var bindings = new ArrayList<Binding>();
        while (input.hasNext()) {
            bindings.add(input.next());
        }
        input.close();
        return bindings;
    }

    private QueryIterator replay(final List<Binding> bindings) {
        return QueryIterPlainWrapper.create(bindings.iterator(), execCxt);
    }

    /**
     * Find the active quint graph. Inference graphs are not unwrapped: their
     * rules must see every triple, so they keep the standard evaluation.
     *
     * @param graph the graph to search
     * @return the QuintGraph, or null if not found
     */
    private static QuintGraph findQuintGraph(final Graph graph) {
        if (graph instanceof InfGraph) {
            return null;
        }
        return graph instanceof QuintGraph quint ? quint : null;
    }
}
