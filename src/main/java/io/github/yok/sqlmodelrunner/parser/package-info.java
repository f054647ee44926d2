/**
 * Model file discovery and header parsing.
 *
 * <p>
 * {@link io.github.yok.sqlmodelrunner.parser.ModelParser} turns file text into a
 * {@link io.github.yok.sqlmodelrunner.model.Model};
 * {@link io.github.yok.sqlmodelrunner.parser.ModelLoader} reads the models directory.
 * </p>
 */
package io.github.yok.sqlmodelrunner.parser;
