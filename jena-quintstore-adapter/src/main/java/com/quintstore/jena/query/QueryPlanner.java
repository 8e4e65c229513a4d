package com.quintstore.jena.query;

import com.quintstore.jena.store.TermName;
import com.quintstore.jena.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.query.SortCondition;
import org.apache.jena.sparql.algebra.Algebra;
import org.apache.jena.sparql.algebra.Op;
import org.apache.jena.sparql.algebra.op.Op1;
import org.apache.jena.sparql.algebra.op.OpAssign;
import org.apache.jena.sparql.algebra.op.OpBGP;
import org.apache.jena.sparql.algebra.op.OpDistinct;
import org.apache.jena.sparql.algebra.op.OpExtend;
import org.apache.jena.sparql.algebra.op.OpFilter;
import org.apache.jena.sparql.algebra.op.OpGraph;
import org.apache.jena.sparql.algebra.op.OpGroup;
import org.apache.jena.sparql.algebra.op.OpJoin;
import org.apache.jena.sparql.algebra.op.OpLabel;
import org.apache.jena.sparql.algebra.op.OpLeftJoin;
import org.apache.jena.sparql.algebra.op.OpList;
import org.apache.jena.sparql.algebra.op.OpMinus;
import org.apache.jena.sparql.algebra.op.OpOrder;
import org.apache.jena.sparql.algebra.op.OpProject;
import org.apache.jena.sparql.algebra.op.OpReduced;
import org.apache.jena.sparql.algebra.op.OpSlice;
import org.apache.jena.sparql.algebra.op.OpUnion;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.expr.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a SPARQL query can be answered with one store lookup.
 *
 * <p>The algebra is walked from the outermost operator inward. Projection,
 * slice, distinct/reduced and a single simple ORDER BY are captured; a
 * GRAPH clause captures its graph. The walk succeeds only when it reaches a
 * basic graph pattern holding exactly one triple. FILTER, joins, OPTIONAL,
 * UNION, MINUS, BIND, grouping and any other operator that changes
 * solutions make the query ineligible, as does a second level of solution
 * modifiers (a sub-select). Labels and list markers are transparent.</p>
 *
 * <p>Ineligibility is an ordinary outcome reported as an empty
 * {@link Optional}; the caller then uses the general evaluator. Queries
 * that fail to parse are reported the same way.</p>
 */
public final class QueryPlanner {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QueryPlanner.class);

    /** Variable names that select an ordering column by name. */
    private static final Map<String, TermName> ORDER_NAMES = Map.of(
        "s", TermName.SUBJECT,
        "subject", TermName.SUBJECT,
        "p", TermName.PREDICATE,
        "predicate", TermName.PREDICATE,
        "o", TermName.OBJECT,
        "object", TermName.OBJECT,
        "g", TermName.GRAPH,
        "graph", TermName.GRAPH);

    /** Attribute key for the planning outcome. */
    private static final AttributeKey<Boolean> ATTR_ELIGIBLE =
        AttributeKey.booleanKey("quintstore.plan.eligible");

    /** Attribute key for the abort reason. */
    private static final AttributeKey<String> ATTR_REASON =
        AttributeKey.stringKey("quintstore.plan.reason");

    /** Tracer for planning. */
    private final Tracer tracer;

    /**
     * Create a planner.
     */
    public QueryPlanner() {
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_QUERY_ENGINE);
    }

    /**
     * Plan a query string.
     *
     * @param sparql the query text
     * @return the plan, or empty when the query is not eligible or does not
     *         parse
     */
    public Optional<OptimizeParams> plan(final String sparql) {
        Query query;
        try {
            query = QueryFactory.create(sparql);
        } catch (QueryParseException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Query does not parse, not eligible: {}",
                    e.getMessage());
            }
            return Optional.empty();
        }
        return plan(query);
    }

    /**
     * Plan a parsed query. Only SELECT and ASK queries are considered.
     *
     * @param query the query
     * @return the plan, or empty when the query is not eligible
     */
    public Optional<OptimizeParams> plan(final Query query) {
        if (!query.isSelectType() && !query.isAskType()) {
            return Optional.empty();
        }
        Span span = tracer.spanBuilder("QueryPlanner.plan")
            .setSpanKind(SpanKind.INTERNAL)
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            Walk walk = new Walk();
            Optional<OptimizeParams> plan = walk.run(Algebra.compile(query));
            span.setAttribute(ATTR_ELIGIBLE, plan.isPresent());
            if (walk.reason != null) {
                span.setAttribute(ATTR_REASON, walk.reason);
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Plan: {}", plan.map(Object::toString)
                    .orElse("not eligible (" + walk.reason + ")"));
            }
            span.setStatus(StatusCode.OK);
            return plan;
        } catch (RuntimeException e) {
            // analysis failures mean "use the general evaluator"
            TracingUtil.recordFailure(span, e);
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn("Query analysis failed, not eligible: {}",
                    e.getMessage());
            }
            return Optional.empty();
        } finally {
            span.end();
        }
    }

    /**
     * Accumulated state of one algebra walk.
     */
    private static final class Walk {
        private List<Var> projection;
        private Long limit;
        private Long offset;
        private Var orderVar;
        private boolean reverse;
        private boolean distinct;
        private Node graph;
        private boolean sliced;
        private boolean ordered;
        private String reason;

        Optional<OptimizeParams> run(final Op root) {
            Op op = root;
            while (op != null) {
                if (op instanceof OpSlice slice) {
                    if (sliced) {
                        return abort("nested slice");
                    }
                    sliced = true;
                    if (slice.getLength() != Query.NOLIMIT) {
                        limit = slice.getLength();
                    }
                    if (slice.getStart() != Query.NOLIMIT && slice.getStart() > 0) {
                        offset = slice.getStart();
                    }
                    op = slice.getSubOp();
                } else if (op instanceof OpProject project) {
                    if (projection != null) {
                        return abort("sub-select");
                    }
                    projection = project.getVars();
                    op = project.getSubOp();
                } else if (op instanceof OpDistinct || op instanceof OpReduced) {
                    distinct = true;
                    op = ((Op1) op).getSubOp();
                } else if (op instanceof OpOrder order) {
                    if (ordered || !captureOrder(order)) {
                        return abort("order by is not a single variable");
                    }
                    ordered = true;
                    op = order.getSubOp();
                } else if (op instanceof OpGraph opGraph) {
                    if (graph != null) {
                        return abort("nested graph");
                    }
                    graph = opGraph.getNode();
                    op = opGraph.getSubOp();
                } else if (op instanceof OpBGP bgp) {
                    return single(bgp);
                } else if (op instanceof OpFilter) {
                    return abort("filter");
                } else if (op instanceof OpJoin || op instanceof OpLeftJoin
                        || op instanceof OpUnion || op instanceof OpMinus) {
                    return abort(op.getName());
                } else if (op instanceof OpExtend || op instanceof OpAssign
                        || op instanceof OpGroup) {
                    return abort(op.getName());
                } else if (op instanceof OpLabel || op instanceof OpList) {
                    op = ((Op1) op).getSubOp();
                } else {
                    return abort(op.getName());
                }
            }
            return abort("no pattern");
        }

        private boolean captureOrder(final OpOrder order) {
            List<SortCondition> conditions = order.getConditions();
            if (conditions.size() != 1) {
                return false;
            }
            SortCondition condition = conditions.get(0);
            Expr expr = condition.getExpression();
            if (!expr.isVariable()) {
                return false;
            }
            orderVar = expr.asVar();
            reverse = condition.getDirection() == Query.ORDER_DESCENDING;
            return true;
        }

        private Optional<OptimizeParams> single(final OpBGP bgp) {
            List<Triple> triples = bgp.getPattern().getList();
            if (triples.size() != 1) {
                return abort(triples.size() + " triple patterns");
            }
            Triple triple = triples.get(0);
            if (hasRepeatedVariable(triple)) {
                return abort("repeated variable");
            }
            var params = new OptimizeParams(triple, graph, projection, limit,
                offset, null, reverse, distinct);
            if (orderVar == null) {
                return Optional.of(params);
            }
            TermName column = params.variables().get(orderVar);
            if (column == null) {
                column = ORDER_NAMES.get(orderVar.getVarName().toLowerCase(Locale.ROOT));
            }
            if (column == null) {
                return abort("order variable ?" + orderVar.getVarName()
                    + " has no column");
            }
            return Optional.of(new OptimizeParams(triple, graph, projection,
                limit, offset, column, reverse, distinct));
        }

        private boolean hasRepeatedVariable(final Triple triple) {
            Set<Node> seen = new HashSet<>();
            for (Node node : new Node[] {triple.getSubject(),
                    triple.getPredicate(), triple.getObject(), graph}) {
                if (node != null && node.isVariable() && !seen.add(node)) {
                    return true;
                }
            }
            return false;
        }

        private Optional<OptimizeParams> abort(final String why) {
            reason = why;
            return Optional.empty();
        }
    }
}
