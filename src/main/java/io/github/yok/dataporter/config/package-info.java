/**
 * Configuration package.
 *
 * <p>
 * Contains {@code @ConfigurationProperties} classes bound from {@code application.yml}: named
 * database connections and the per-command defaults.
 * </p>
 */
package io.github.yok.dataporter.config;
