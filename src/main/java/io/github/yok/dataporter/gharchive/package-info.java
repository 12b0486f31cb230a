/**
 * GitHub Archive loader.
 *
 * <p>
 * Downloads the hourly event files published at {@code data.gharchive.org}, stores each event as a
 * {@code jsonb} document in PostgreSQL and records load throughput and table growth per hour.
 * </p>
 */
package io.github.yok.dataporter.gharchive;
