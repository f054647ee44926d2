/**
 * SqlModelRunner: builds a dependency-ordered pipeline of SQL model files and executes it against
 * a JDBC target.
 *
 * <p>
 * {@link io.github.yok.sqlmodelrunner.Main} is the command-line entry point;
 * {@link io.github.yok.sqlmodelrunner.core.ProjectRunner} is the programmatic one.
 * </p>
 */
package io.github.yok.sqlmodelrunner;
