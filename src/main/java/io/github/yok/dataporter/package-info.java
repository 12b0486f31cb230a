/**
 * DataPorter command-line application.
 *
 * <p>
 * {@link io.github.yok.dataporter.Main} dispatches to the {@code explain}, {@code gharchive},
 * {@code json-import} and {@code table-copy} commands.
 * </p>
 */
package io.github.yok.dataporter;
