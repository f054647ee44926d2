/**
 * Command-line support utilities.
 */
package io.github.yok.sqlmodelrunner.util;
