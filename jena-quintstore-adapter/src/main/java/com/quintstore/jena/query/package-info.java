/**
 * SPARQL evaluation over the quint store.
 *
 * <p>This package decides which parts of a query the store can answer on
 * its own and hands everything else to Jena's evaluator.</p>
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link com.quintstore.jena.query.QueryPlanner} - Finds queries that
 *       reduce to one triple pattern plus solution modifiers</li>
 *   <li>{@link com.quintstore.jena.query.PatternBuilder} - Builds the store
 *       pattern for a triple pattern, tenant scope and pushed filters</li>
 *   <li>{@link com.quintstore.jena.query.FilterPushdownExtractor} - Turns
 *       FILTER expressions into store conditions</li>
 *   <li>{@link com.quintstore.jena.query.OptimizedQueryEngine} - SPARQL entry
 *       point combining the above with Jena fallback</li>
 *   <li>{@link com.quintstore.jena.query.QuintOpExecutor} - OpExecutor that
 *       pushes single-triple patterns inside Jena evaluation</li>
 * </ul>
 */
package com.quintstore.jena.query;
