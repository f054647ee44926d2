/**
 * Dependency discovery, validation and ordering.
 *
 * <p>
 * {@link io.github.yok.sqlmodelrunner.graph.DependencyGraphBuilder} turns a model set into a
 * validated {@link io.github.yok.sqlmodelrunner.graph.DependencyGraph} with a deterministic
 * execution order.
 * </p>
 */
package io.github.yok.sqlmodelrunner.graph;
