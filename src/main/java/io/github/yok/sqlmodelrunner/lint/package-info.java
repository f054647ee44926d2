/**
 * Naming rules for models and sources.
 */
package io.github.yok.sqlmodelrunner.lint;
