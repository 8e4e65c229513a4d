package com.quintstore.jena.store;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.apache.jena.util.iterator.ExtendedIterator;

/**
 * Storage for quints: a graph, subject, predicate and object plus an
 * optional vector.
 *
 * <p>The store must be opened before use; every data method called before
 * {@link #open()} throws {@link IllegalStateException}. {@code open} and
 * {@code close} are idempotent and safe to call concurrently. Database
 * errors reach the caller as {@link SQLException}.</p>
 *
 * <p>{@code (graph, subject, predicate, object)} is the identity of a
 * quint: writing an existing key replaces only its vector.</p>
 */
public interface QuintStore extends AutoCloseable {

    /** Message of the error raised before {@link #open()}. */
    String NOT_OPEN = "Store not open. Call open() first.";

    /**
     * Connect and create the schema if needed.
     *
     * @throws SQLException if the database cannot be reached
     */
    void open() throws SQLException;

    /**
     * Release the connection or pool.
     *
     * @throws SQLException if closing fails
     */
    @Override
    void close() throws SQLException;

    /**
     * Check whether the store is open.
     *
     * @return true between open and close
     */
    boolean isOpen();

    /**
     * Find quints matching a pattern.
     *
     * @param pattern the pattern
     * @param options paging and ordering
     * @return the matches
     * @throws SQLException on database errors
     */
    List<Quint> get(QuintPattern pattern, QueryOptions options) throws SQLException;

    /**
     * Find all quints matching a pattern.
     *
     * @param pattern the pattern
     * @return the matches
     * @throws SQLException on database errors
     */
    default List<Quint> get(final QuintPattern pattern) throws SQLException {
        return get(pattern, QueryOptions.NONE);
    }

    /**
     * Iterator over the quints matching concrete terms. A null or variable
     * position matches anything; a null or default graph matches every
     * graph. Each call runs a new query.
     *
     * @param subject the subject, or null
     * @param predicate the predicate, or null
     * @param object the object, or null
     * @param graph the graph, or null
     * @return the matches
     * @throws SQLException on database errors
     */
    ExtendedIterator<Quint> match(Node subject, Node predicate, Node object,
        Node graph) throws SQLException;

    /**
     * Find quints whose graph IRI starts with a prefix. The match is the
     * range from the prefix up to the prefix followed by U+FFFF, so an IRI
     * whose next character after the prefix is outside the Basic
     * Multilingual Plane is not found.
     *
     * @param prefix the graph prefix
     * @param options paging and ordering
     * @return the matches
     * @throws SQLException on database errors
     */
    List<Quint> getByGraphPrefix(String prefix, QueryOptions options)
        throws SQLException;

    /**
     * Find all quints whose graph IRI starts with a prefix.
     *
     * @param prefix the graph prefix
     * @return the matches
     * @throws SQLException on database errors
     */
    default List<Quint> getByGraphPrefix(final String prefix) throws SQLException {
        return getByGraphPrefix(prefix, QueryOptions.NONE);
    }

    /**
     * Count quints matching a pattern.
     *
     * @param pattern the pattern
     * @return the count
     * @throws SQLException on database errors
     */
    long count(QuintPattern pattern) throws SQLException;

    /**
     * Insert a quint, or replace the vector of an existing one.
     *
     * @param quint the quint
     * @throws SQLException on database errors
     */
    void put(Quint quint) throws SQLException;

    /**
     * Insert or update several quints in one transaction. An empty list
     * does nothing.
     *
     * @param quints the quints
     * @throws SQLException on database errors; nothing is written then
     */
    void multiPut(List<Quint> quints) throws SQLException;

    /**
     * Replace the vector of every quint matching a pattern.
     *
     * @param pattern the pattern
     * @param vector the new vector, or null to remove it
     * @return the number of updated quints
     * @throws SQLException on database errors
     */
    int updateEmbedding(QuintPattern pattern, float[] vector) throws SQLException;

    /**
     * Delete every quint matching a pattern. The empty pattern deletes
     * everything.
     *
     * @param pattern the pattern
     * @return the number of deleted quints
     * @throws SQLException on database errors
     */
    int del(QuintPattern pattern) throws SQLException;

    /**
     * Delete exact quints in one transaction. Quints that are not stored
     * are skipped; the others are deleted together or not at all.
     *
     * @param quints the quints
     * @return the number of deleted quints
     * @throws SQLException on database errors; nothing is deleted then
     */
    int multiDel(List<Quint> quints) throws SQLException;

    /**
     * Run a multi-pattern self-join in one statement.
     *
     * @param compound the patterns and join column
     * @param options paging
     * @return one result per joined row
     * @throws SQLException on database errors
     */
    List<CompoundResult> getCompound(CompoundPattern compound, QueryOptions options)
        throws SQLException;

    /**
     * Fetch the objects of several predicates for several subjects at once.
     *
     * @param subjects the subjects
     * @param predicates the predicates
     * @param graph the graph, or null or the default graph for all graphs
     * @return objects by subject then predicate; empty when either list is
     *         empty
     * @throws SQLException on database errors
     */
    Map<Node, Map<Node, List<Node>>> getAttributes(List<Node> subjects,
        List<Node> predicates, Node graph) throws SQLException;

    /**
     * List the distinct graphs.
     *
     * @return the graphs, in storage order
     * @throws SQLException on database errors
     */
    List<Node> listGraphs() throws SQLException;

    /**
     * Compute row counts.
     *
     * @return the statistics
     * @throws SQLException on database errors
     */
    StoreStats stats() throws SQLException;

    /**
     * Delete every quint.
     *
     * @throws SQLException on database errors
     */
    void clear() throws SQLException;
}
