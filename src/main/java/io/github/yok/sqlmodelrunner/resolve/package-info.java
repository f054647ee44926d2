/**
 * Naming policy and reference token substitution.
 */
package io.github.yok.sqlmodelrunner.resolve;
