/**
 * Statement generation per materialization and the resulting execution plan.
 */
package io.github.yok.sqlmodelrunner.plan;
