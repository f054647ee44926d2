/**
 * Run orchestration: per-model status tracking, failure policy, and the project-level entry point
 * {@link io.github.yok.sqlmodelrunner.core.ProjectRunner}.
 */
package io.github.yok.sqlmodelrunner.core;
