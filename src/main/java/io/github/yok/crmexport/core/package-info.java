/**
 * Core processing package.
 *
 * <p>
 * {@link io.github.yok.crmexport.core.ExportPipeline} runs a whole export;
 * {@link io.github.yok.crmexport.core.IngestionDriver} runs one resumable phase of one resource
 * type; {@link io.github.yok.crmexport.core.CsvSnapshotExporter} writes the final CSV files.
 * </p>
 */
package io.github.yok.crmexport.core;
