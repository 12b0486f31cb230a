/**
 * Utility package for DataPorter.
 *
 * <p>
 * Provides stateless helpers shared by the commands: fatal error reporting, size formatting, and
 * quoting of SQL string literals.
 * </p>
 */
package io.github.yok.dataporter.util;
