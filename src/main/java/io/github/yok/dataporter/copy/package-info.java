/**
 * Table copy package.
 *
 * <p>
 * Copies a table between two JDBC databases (for example SQL Server to PostgreSQL), creating the
 * target table from the source column metadata when needed.
 * </p>
 */
package io.github.yok.dataporter.copy;
