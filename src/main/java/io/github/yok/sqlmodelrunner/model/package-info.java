/**
 * Immutable model definitions parsed from SQL files.
 */
package io.github.yok.sqlmodelrunner.model;
