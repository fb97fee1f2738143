/**
 * Configuration model package.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} and the environment:
 * API connection and retry settings, the data directory layout, store settings and run options.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in
 * {@code client}, {@code core} and {@code db}.
 * </p>
 */
package io.github.yok.crmexport.config;
