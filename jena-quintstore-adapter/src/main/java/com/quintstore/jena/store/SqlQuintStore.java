package com.quintstore.jena.store;

import com.quintstore.jena.codec.TermCodec;
import com.quintstore.jena.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.util.iterator.ExtendedIterator;
import org.apache.jena.util.iterator.WrappedIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The quint store over a SQL database.
 *
 * <p>All backends share this class; what differs between them is the
 * {@link SqlExecutor} that runs the statements and the {@link SqlDialect}
 * that renders the few engine-specific forms. The executor is created on
 * {@link #open()}, which also creates the table and its six indexes.</p>
 *
 * <p>Result sets are read in full before being returned.</p>
 */
public final class SqlQuintStore implements QuintStore {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SqlQuintStore.class);

    /** Columns read back for a quint, in table order. */
    private static final String QUINT_COLUMNS =
        "graph, subject, predicate, object, vector";

    /** Attribute key for the pattern or argument summary. */
    private static final AttributeKey<String> ATTR_PATTERN =
        AttributeKey.stringKey("quintstore.pattern");

    /**
     * Creates the executor when the store is opened.
     */
    @FunctionalInterface
    public interface ExecutorFactory {
        /**
         * Connect to the database.
         *
         * @return a ready executor
         * @throws SQLException if the database cannot be reached
         */
        SqlExecutor create() throws SQLException;
    }

    /** Work done against an open executor. */
    @FunctionalInterface
    private interface StoreCall<T> {
        T call(SqlExecutor executor) throws SQLException;
    }

    /** The engine statements are rendered for. */
    private final SqlDialect dialect;
    /** Source of the executor. */
    private final ExecutorFactory executorFactory;
    /** Pattern to SQL translation. */
    private final PatternTranslator translator;
    /** Tracer for store operations. */
    private final Tracer tracer;
    /** The executor while open, otherwise null. */
    private volatile SqlExecutor executor;

    /**
     * Create a closed store.
     *
     * @param dialect the engine statements are rendered for
     * @param executorFactory creates the executor on open
     */
    public SqlQuintStore(final SqlDialect dialect,
            final ExecutorFactory executorFactory) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.executorFactory = Objects.requireNonNull(executorFactory,
            "executorFactory");
        this.translator = new PatternTranslator(dialect);
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_QUINT_STORE);
    }

    /**
     * Get the dialect.
     *
     * @return the engine statements are rendered for
     */
    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public synchronized void open() throws SQLException {
        if (executor != null) {
            return;
        }
        Span span = TracingUtil.databaseSpan(tracer, "QuintStore.open",
                SpanKind.INTERNAL, dialect.system())
            .setAttribute(TracingUtil.ATTR_STORE_OPERATION, "open")
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            SqlExecutor created = executorFactory.create();
            try {
                for (String ddl : QuintSchema.statements(dialect)) {
                    created.exec(ddl);
                }
            } catch (SQLException | RuntimeException e) {
                try {
                    created.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
            executor = created;
            span.setStatus(StatusCode.OK);
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Opened {} quint store", dialect.system());
            }
        } catch (SQLException | RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        SqlExecutor current = executor;
        if (current == null) {
            return;
        }
        executor = null;
        current.close();
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Closed {} quint store", dialect.system());
        }
    }

    @Override
    public boolean isOpen() {
        return executor != null;
    }

    @Override
    public List<Quint> get(final QuintPattern pattern, final QueryOptions options)
            throws SQLException {
        return traced("get", pattern.toString(), ex -> {
            SqlFragment where = translator.where(pattern);
            var params = new ArrayList<Object>(where.params());
            String sql = "SELECT " + QUINT_COLUMNS + " FROM " + QuintSchema.TABLE
                + where.toWhereClause() + orderClause(options)
                + dialect.pagingClause(options, params);
            return toQuints(ex.query(sql, params));
        });
    }

    @Override
    public ExtendedIterator<Quint> match(final Node subject, final Node predicate,
            final Node object, final Node graph) throws SQLException {
        var pattern = QuintPattern.builder()
            .subject(concrete(subject))
            .predicate(concrete(predicate))
            .object(concrete(object))
            .graph(graph == null || Quad.isDefaultGraph(graph) ? null : concrete(graph))
            .build();
        return WrappedIterator.create(get(pattern).iterator());
    }

    @Override
    public List<Quint> getByGraphPrefix(final String prefix,
            final QueryOptions options) throws SQLException {
        return traced("getByGraphPrefix", prefix, ex -> {
            var params = new ArrayList<Object>();
            params.add(prefix);
            params.add(prefix + TermCodec.MAX_SUFFIX);
            String sql = "SELECT " + QUINT_COLUMNS + " FROM " + QuintSchema.TABLE
                + " WHERE graph >= ? AND graph < ?" + orderClause(options)
                + dialect.pagingClause(options, params);
            return toQuints(ex.query(sql, params));
        });
    }

    @Override
    public long count(final QuintPattern pattern) throws SQLException {
        return traced("count", pattern.toString(), ex -> {
            SqlFragment where = translator.where(pattern);
            return countOf(ex, "SELECT COUNT(*) AS count FROM " + QuintSchema.TABLE
                + where.toWhereClause(), where.params());
        });
    }

    @Override
    public void put(final Quint quint) throws SQLException {
        traced("put", quint.toString(),
            ex -> ex.execute(dialect.upsertSql(), upsertParams(quint)));
    }

    @Override
    public void multiPut(final List<Quint> quints) throws SQLException {
        if (quints.isEmpty()) {
            ensureOpen();
            return;
        }
        traced("multiPut", quints.size() + " quints", ex -> {
            var statements = new ArrayList<SqlStatement>(quints.size());
            for (Quint quint : quints) {
                statements.add(new SqlStatement(dialect.upsertSql(), upsertParams(quint)));
            }
            return ex.executeInTransaction(statements);
        });
    }

    @Override
    public int updateEmbedding(final QuintPattern pattern, final float[] vector)
            throws SQLException {
        return traced("updateEmbedding", pattern.toString(), ex -> {
            SqlFragment where = translator.where(pattern);
            var params = new ArrayList<Object>();
            params.add(VectorCodec.write(vector));
            params.addAll(where.params());
            return ex.execute("UPDATE " + QuintSchema.TABLE + " SET vector = ?"
                + where.toWhereClause(), params);
        });
    }

    @Override
    public int del(final QuintPattern pattern) throws SQLException {
        return traced("del", pattern.toString(), ex -> {
            SqlFragment where = translator.where(pattern);
            return ex.execute("DELETE FROM " + QuintSchema.TABLE
                + where.toWhereClause(), where.params());
        });
    }

    @Override
    public int multiDel(final List<Quint> quints) throws SQLException {
        if (quints.isEmpty()) {
            ensureOpen();
            return 0;
        }
        return traced("multiDel", quints.size() + " quints", ex -> {
            var statements = new ArrayList<SqlStatement>(quints.size());
            for (Quint quint : quints) {
                SqlFragment where = translator.where(QuintPattern.exact(quint));
                statements.add(new SqlStatement("DELETE FROM " + QuintSchema.TABLE
                    + where.toWhereClause(), where.params()));
            }
            return ex.executeInTransaction(statements);
        });
    }

    @Override
    public List<CompoundResult> getCompound(final CompoundPattern compound,
            final QueryOptions options) throws SQLException {
        List<QuintPattern> patterns = compound.patterns();
        if (patterns.isEmpty()) {
            ensureOpen();
            return List.of();
        }
        if (patterns.size() == 1) {
            var results = new ArrayList<CompoundResult>();
            for (Quint quint : get(patterns.get(0), options)) {
                results.add(new CompoundResult(quint.get(compound.joinOn()),
                    Map.of(), List.of(quint)));
            }
            return results;
        }
        return traced("getCompound", patterns.size() + " patterns on "
                + compound.joinOn().column(), ex -> {
            var params = new ArrayList<Object>();
            String sql = compoundSql(compound, options, params);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Compound SQL: {} ({} params)", sql, params.size());
            }
            var projections = projections(compound);
            var results = new ArrayList<CompoundResult>();
            for (Map<String, Object> row : ex.query(sql, params)) {
                var bindings = new LinkedHashMap<String, Node>();
                for (CompoundSelect select : projections) {
                    Object value = row.get(select.alias());
                    if (value != null) {
                        bindings.put(select.alias(), decode(select.field(), value));
                    }
                }
                results.add(new CompoundResult(
                    decode(compound.joinOn(), row.get(CompoundSelect.JOIN_VALUE)),
                    bindings, List.of()));
            }
            return results;
        });
    }

    @Override
    public Map<Node, Map<Node, List<Node>>> getAttributes(final List<Node> subjects,
            final List<Node> predicates, final Node graph) throws SQLException {
        if (subjects.isEmpty() || predicates.isEmpty()) {
            ensureOpen();
            return Map.of();
        }
        return traced("getAttributes", subjects.size() + " subjects x "
                + predicates.size() + " predicates", ex -> {
            var params = new ArrayList<Object>();
            String sql = "SELECT subject, predicate, object FROM " + QuintSchema.TABLE
                + " WHERE subject IN (" + inList(subjects, TermName.SUBJECT, params)
                + ") AND predicate IN (" + inList(predicates, TermName.PREDICATE, params)
                + ")";
            if (graph != null && !Quad.isDefaultGraph(graph)) {
                sql += " AND graph = ?";
                params.add(TermCodec.encodeTerm(graph));
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("getAttributes SQL: {} ({} params)", sql, params.size());
            }
            var result = new LinkedHashMap<Node, Map<Node, List<Node>>>();
            for (Map<String, Object> row : ex.query(sql, params)) {
                result.computeIfAbsent(TermCodec.decodeTerm(text(row.get("subject"))),
                        k -> new LinkedHashMap<>())
                    .computeIfAbsent(TermCodec.decodeTerm(text(row.get("predicate"))),
                        k -> new ArrayList<>())
                    .add(TermCodec.decodeObject(text(row.get("object"))));
            }
            return result;
        });
    }

    @Override
    public List<Node> listGraphs() throws SQLException {
        return traced("listGraphs", null, ex -> {
            var graphs = new ArrayList<Node>();
            for (Map<String, Object> row : ex.query("SELECT DISTINCT graph FROM "
                    + QuintSchema.TABLE + " ORDER BY graph", List.of())) {
                graphs.add(TermCodec.decodeTerm(text(row.get("graph"))));
            }
            return graphs;
        });
    }

    @Override
    public StoreStats stats() throws SQLException {
        return traced("stats", null, ex -> new StoreStats(
            countOf(ex, "SELECT COUNT(*) AS count FROM " + QuintSchema.TABLE, List.of()),
            countOf(ex, "SELECT COUNT(*) AS count FROM " + QuintSchema.TABLE
                + " WHERE vector IS NOT NULL", List.of()),
            countOf(ex, "SELECT COUNT(DISTINCT graph) AS count FROM "
                + QuintSchema.TABLE, List.of())));
    }

    @Override
    public void clear() throws SQLException {
        traced("clear", null,
            ex -> ex.execute("DELETE FROM " + QuintSchema.TABLE, List.of()));
    }

    /**
     * Build the compound self-join. Every pattern gets its own alias
     * {@code q0..qN}; all copies are joined on the join column and on the
     * graph.
     */
    String compoundSql(final CompoundPattern compound, final QueryOptions options,
            final List<Object> params) {
        String joinColumn = compound.joinOn().column();
        List<QuintPattern> patterns = compound.patterns();
        var sql = new StringBuilder("SELECT q0.").append(joinColumn)
            .append(" AS ").append(CompoundSelect.JOIN_VALUE);
        for (CompoundSelect select : projections(compound)) {
            sql.append(", q").append(select.pattern()).append('.')
                .append(select.field().column())
                .append(" AS \"").append(select.alias()).append('"');
        }
        sql.append(" FROM ").append(QuintSchema.TABLE).append(" q0");
        for (int i = 1; i < patterns.size(); i++) {
            sql.append(" JOIN ").append(QuintSchema.TABLE).append(" q").append(i)
                .append(" ON q0.").append(joinColumn).append(" = q").append(i)
                .append('.').append(joinColumn)
                .append(" AND q0.graph = q").append(i).append(".graph");
        }
        SqlFragment where = SqlFragment.EMPTY;
        for (int i = 0; i < patterns.size(); i++) {
            where = where.and(translator.whereAliased("q" + i, patterns.get(i)));
        }
        sql.append(where.toWhereClause());
        params.addAll(where.params());
        sql.append(dialect.pagingClause(options, params));
        return sql.toString();
    }

    private static List<CompoundSelect> projections(final CompoundPattern compound) {
        if (!compound.select().isEmpty()) {
            return compound.select();
        }
        var defaults = new ArrayList<CompoundSelect>();
        for (int i = 0; i < compound.patterns().size(); i++) {
            defaults.add(new CompoundSelect(i, TermName.OBJECT, "p" + i + "_object"));
            defaults.add(new CompoundSelect(i, TermName.PREDICATE, "p" + i + "_predicate"));
        }
        return defaults;
    }

    private SqlExecutor ensureOpen() {
        SqlExecutor current = executor;
        if (current == null) {
            throw new IllegalStateException(NOT_OPEN);
        }
        return current;
    }

    private <T> T traced(final String operation, final String detail,
            final StoreCall<T> call) throws SQLException {
        SqlExecutor current = ensureOpen();
        Span span = TracingUtil.databaseSpan(tracer, "QuintStore." + operation,
                SpanKind.INTERNAL, dialect.system())
            .setAttribute(TracingUtil.ATTR_STORE_OPERATION, operation)
            .startSpan();
        if (detail != null) {
            span.setAttribute(ATTR_PATTERN, detail);
        }
        try (Scope scope = span.makeCurrent()) {
            T result = call.call(current);
            if (result instanceof Collection<?> collection) {
                span.setAttribute(TracingUtil.ATTR_ROW_COUNT, (long) collection.size());
            } else if (result instanceof Map<?, ?> map) {
                span.setAttribute(TracingUtil.ATTR_ROW_COUNT, (long) map.size());
            } else if (result instanceof Number number) {
                span.setAttribute(TracingUtil.ATTR_ROW_COUNT, number.longValue());
            }
            span.setStatus(StatusCode.OK);
            return result;
        } catch (SQLException | RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static String orderClause(final QueryOptions options) {
        if (options.order().isEmpty()) {
            return "";
        }
        var columns = new ArrayList<String>();
        for (TermName name : options.order()) {
            columns.add(options.reverse() ? name.column() + " DESC" : name.column());
        }
        return " ORDER BY " + String.join(", ", columns);
    }

    private static long countOf(final SqlExecutor ex, final String sql,
            final List<Object> params) throws SQLException {
        List<Map<String, Object>> rows = ex.query(sql, params);
        if (rows.isEmpty()) {
            return 0L;
        }
        Object value = rows.get(0).values().iterator().next();
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static List<Object> upsertParams(final Quint quint) {
        var params = new ArrayList<Object>(5);
        params.add(TermCodec.encodeTerm(quint.getGraph()));
        params.add(TermCodec.encodeTerm(quint.getSubject()));
        params.add(TermCodec.encodeTerm(quint.getPredicate()));
        params.add(TermCodec.encodeObject(quint.getObject()));
        params.add(VectorCodec.write(quint.getVector()));
        return params;
    }

    private static String inList(final List<Node> terms, final TermName name,
            final List<Object> params) {
        var placeholders = new StringBuilder();
        for (Node term : terms) {
            placeholders.append(placeholders.length() == 0 ? "?" : ", ?");
            params.add(PatternTranslator.encode(name, term));
        }
        return placeholders.toString();
    }

    private static List<Quint> toQuints(final List<Map<String, Object>> rows) {
        var quints = new ArrayList<Quint>(rows.size());
        for (Map<String, Object> row : rows) {
            quints.add(new Quint(
                TermCodec.decodeTerm(text(row.get("graph"))),
                TermCodec.decodeTerm(text(row.get("subject"))),
                TermCodec.decodeTerm(text(row.get("predicate"))),
                TermCodec.decodeObject(text(row.get("object"))),
                VectorCodec.read(row.get("vector"))));
        }
        return quints;
    }

    private static Node decode(final TermName name, final Object value) {
        return name == TermName.OBJECT ? TermCodec.decodeObject(text(value))
            : TermCodec.decodeTerm(text(value));
    }

    private static Node concrete(final Node node) {
        return node != null && node.isConcrete() ? node : null;
    }

    private static String text(final Object value) {
        return value == null ? null : value.toString();
    }
}
