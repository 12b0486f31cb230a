/**
 * Database access package.
 *
 * <p>
 * Opens JDBC connections from the configured entries and performs the PostgreSQL catalog and DDL
 * operations needed by the loaders.
 * </p>
 */
package io.github.yok.dataporter.db;
