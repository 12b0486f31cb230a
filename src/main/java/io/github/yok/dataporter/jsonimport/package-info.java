/**
 * JSON import package.
 *
 * <p>
 * Loads the rows of a JSON document, read from a file or an HTTP API, into a PostgreSQL
 * {@code jsonb} table, or analyzes the document to find where its rows are.
 * </p>
 */
package io.github.yok.dataporter.jsonimport;
