/**
 * The quint store: a SQL table of graph, subject, predicate, object and
 * vector, with pattern queries, compound joins and batch writes.
 *
 * <p>{@link com.quintstore.jena.store.SqlQuintStore} is the single
 * implementation; {@link com.quintstore.jena.store.SqlExecutor} hides the
 * difference between SQLite and PostgreSQL.</p>
 *
 * @see com.quintstore.jena.store.QuintStoreFactory
 */
package com.quintstore.jena.store;
