package io.github.yok.crmexport.core;

import io.github.yok.crmexport.checkpoint.CheckpointStore;
import io.github.yok.crmexport.config.ApiConfig;
import io.github.yok.crmexport.config.IngestionConfig;
import io.github.yok.crmexport.config.PathsConfig;
import io.github.yok.crmexport.config.StoreConfig;
import io.github.yok.crmexport.db.DbDialectHandler;
import io.github.yok.crmexport.db.JdbcRecordSink;
import io.github.yok.crmexport.db.RecordSink;
import io.github.yok.crmexport.db.SchemaInitializer;
import io.github.yok.crmexport.fetch.AssociationFetcher;
import io.github.yok.crmexport.fetch.PageFetcherRegistry;
import io.github.yok.crmexport.fetch.PropertyCatalog;
import io.github.yok.crmexport.model.PhaseResult;
import io.github.yok.crmexport.model.ResourceType;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Orchestrates a whole export run.
 *
 * <ol>
 * <li>Check that an access token is configured.</li>
 * <li>With {@code fresh}, remove the state files of the selected types.</li>
 * <li>Open the store and bring its schema up to date.</li>
 * <li>Run the data phase of every type, then the association phase of every type. The association
 * phase of a type whose data phase did not settle writes no completion marker.</li>
 * <li>Write the CSV snapshot of the selected tables and {@code associations}.</li>
 * <li>After a full, unlimited and fully complete run, remove all state files so that the next run
 * starts a new export (disabled with {@code ingestion.reset-state-on-success: false}).</li>
 * </ol>
 *
 * <p>
 * Everything runs sequentially on the calling thread. Any exception aborts the run with the
 * checkpoints of the interrupted phase left in place.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportPipeline {

    private final ApiConfig apiConfig;
    private final PathsConfig pathsConfig;
    private final StoreConfig storeConfig;
    private final IngestionConfig ingestionConfig;
    private final PageFetcherRegistry fetchers;
    private final AssociationFetcher associationFetcher;
    private final PropertyCatalog catalog;
    private final CheckpointStore checkpoints;
    private final SchemaInitializer schemaInitializer;
    private final DbDialectHandler dialect;
    private final CsvSnapshotExporter exporter;

    /**
     * Runs the export.
     *
     * @param options run options
     * @return summary of the run
     * @throws SQLException on store error
     * @throws IOException on snapshot or directory error
     */
    public RunSummary run(RunOptions options) throws SQLException, IOException {
        apiConfig.requireAccessToken();
        List<ResourceType> types = resolveTypes(options.getResourceTypes());
        Integer limit = options.isLimited() ? options.getLimit() : null;
        log.info("Export started. Types: {}, limit: {}, fresh: {}", types,
                limit == null ? "none" : limit, options.isFresh());

        if (options.isFresh()) {
            log.info("Fresh run requested, removing saved state");
            checkpoints.reset(types);
        }
        catalog.invalidate();
        FileUtils.forceMkdir(new File(pathsConfig.getDataPath()));

        List<PhaseResult> results = new ArrayList<>();
        Map<ResourceType, Long> counts = new EnumMap<>(ResourceType.class);
        try (Connection conn = openConnection()) {
            Map<ResourceType, List<String>> columns = schemaInitializer.initialize(conn, types,
                    storeConfig.isDeduplicateAssociations());
            RecordSink sink = new JdbcRecordSink(conn, dialect, columns,
                    storeConfig.isDeduplicateAssociations());
            IngestionDriver driver =
                    new IngestionDriver(fetchers, associationFetcher, checkpoints, sink);

            Map<ResourceType, PhaseResult> dataResults = new EnumMap<>(ResourceType.class);
            for (ResourceType type : types) {
                PhaseResult data = driver.ingestData(type, limit);
                dataResults.put(type, data);
                results.add(data);
            }
            for (ResourceType type : types) {
                boolean idsComplete = dataResults.get(type).getState().isSettled();
                results.add(driver.ingestAssociations(type, limit, idsComplete));
            }
            for (ResourceType type : types) {
                counts.put(type, sink.countRecords(type));
            }

            if (options.isExport()) {
                List<String> tables = types.stream().map(ResourceType::getTableName)
                        .collect(Collectors.toCollection(ArrayList::new));
                tables.add(DbDialectHandler.ASSOCIATIONS_TABLE);
                exporter.exportAll(conn, tables, new File(pathsConfig.getExport()));
            }
        }

        boolean settled = results.stream().allMatch(r -> r.getState().isSettled());
        boolean cleared = false;
        if (settled && limit == null && ingestionConfig.isResetStateOnSuccess()) {
            checkpoints.reset(types);
            cleared = true;
            log.info("All phases complete, saved state removed");
        }

        RunSummary summary = new RunSummary(results, counts, cleared);
        logSummary(summary);
        return summary;
    }

    List<ResourceType> resolveTypes(List<ResourceType> requested) {
        List<ResourceType> configured = ingestionConfig.getResourceTypes();
        if (requested == null || requested.isEmpty()) {
            return List.copyOf(new LinkedHashSet<>(configured));
        }
        Set<ResourceType> ordered = new LinkedHashSet<>();
        configured.stream().filter(requested::contains).forEach(ordered::add);
        ordered.addAll(requested);
        return List.copyOf(ordered);
    }

    private Connection openConnection() throws SQLException {
        String url = storeConfig.getUrl();
        if (StringUtils.isBlank(url)) {
            throw new IllegalStateException(
                    "store.url is not configured. Please set 'store.url' in application.yml.");
        }
        log.info("Opening store {}", url);
        return DriverManager.getConnection(url);
    }

    private void logSummary(RunSummary summary) {
        log.info("===== Export summary =====");
        for (PhaseResult r : summary.getResults()) {
            log.info("{} {}: {} ({} processed)", r.getResourceType().getApiName(), r.getPhase(),
                    r.getState(), r.getProcessed());
        }
        summary.getRecordCounts()
                .forEach((type, count) -> log.info("{}: {} rows", type.getApiName(), count));
    }
}
