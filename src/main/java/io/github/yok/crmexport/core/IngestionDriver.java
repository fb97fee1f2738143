package io.github.yok.crmexport.core;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.crmexport.checkpoint.CheckpointKey;
import io.github.yok.crmexport.checkpoint.CheckpointStore;
import io.github.yok.crmexport.db.RecordSink;
import io.github.yok.crmexport.fetch.AssociationFetcher;
import io.github.yok.crmexport.fetch.PageFetcher;
import io.github.yok.crmexport.fetch.PageFetcherRegistry;
import io.github.yok.crmexport.model.AssociationEdge;
import io.github.yok.crmexport.model.Phase;
import io.github.yok.crmexport.model.PhaseResult;
import io.github.yok.crmexport.model.PhaseState;
import io.github.yok.crmexport.model.RecordPage;
import io.github.yok.crmexport.model.ResourceType;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one phase of one resource type: fetch a page, persist it, then save the resume position
 * before fetching the next one.
 *
 * <p>
 * <strong>Data phase:</strong> the resume position is the cursor of the next page. The phase
 * ends when
 * </p>
 * <ul>
 * <li>an empty page arrives: checkpoint cleared; without a limit the completion marker is written
 * ({@code COMPLETE}), under a limit it is not ({@code DRAINED});</li>
 * <li>the limit is reached: checkpoint cleared, no marker ({@code LIMITED});</li>
 * <li>the cursor did not move for {@value #STUCK_THRESHOLD} consecutive pages: checkpoint kept,
 * no marker ({@code STUCK}).</li>
 * </ul>
 *
 * <p>
 * <strong>Association phase:</strong> the resume position is the index of the next stored id
 * (ids in ascending order) whose associations are still to be fetched. The completion marker is
 * only written when no limit applies and the id list is known to be complete.
 * </p>
 *
 * <p>
 * Transport and store failures propagate unchanged. The checkpoint is only written after the page
 * it points past has been persisted, so an interrupted run reprocesses at most one page.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IngestionDriver {

    static final int STUCK_THRESHOLD = 3;

    private final PageFetcherRegistry fetchers;
    private final AssociationFetcher associationFetcher;
    private final CheckpointStore checkpoints;
    private final RecordSink sink;

    /**
     * Creates a driver.
     *
     * @param fetchers page fetcher per type
     * @param associationFetcher association lookup
     * @param checkpoints resume state
     * @param sink record destination
     */
    public IngestionDriver(PageFetcherRegistry fetchers, AssociationFetcher associationFetcher,
            CheckpointStore checkpoints, RecordSink sink) {
        this.fetchers = checkNotNull(fetchers, "fetchers");
        this.associationFetcher = checkNotNull(associationFetcher, "associationFetcher");
        this.checkpoints = checkNotNull(checkpoints, "checkpoints");
        this.sink = checkNotNull(sink, "sink");
    }

    /**
     * Fetches and stores all records of a type, resuming from the saved cursor if any.
     *
     * @param type resource type
     * @param limit maximum number of records for this run; {@code null} or not positive means
     *        unlimited
     * @return outcome of the phase
     * @throws SQLException on store error
     */
    public PhaseResult ingestData(ResourceType type, Integer limit) throws SQLException {
        CheckpointKey key = CheckpointKey.of(type, Phase.DATA);
        if (checkpoints.isPhaseComplete(key)) {
            log.info("[{}] Already complete, skipping", key);
            return PhaseResult.skipped(type, Phase.DATA);
        }

        Optional<String> saved = checkpoints.load(key);
        String cursor = saved.orElse(null);
        transition(key, saved.isPresent() ? PhaseState.RESUMING : PhaseState.FRESH);
        if (saved.isPresent()) {
            log.info("[{}] Resuming from cursor {}", key, cursor);
        } else {
            log.info("[{}] Starting from the beginning", key);
        }

        PageFetcher fetcher = fetchers.get(type);
        long processed = 0;
        int unchanged = 0;
        while (true) {
            transition(key, PhaseState.FETCHING);
            RecordPage page = fetcher.fetchPage(cursor);
            if (page.isEmpty()) {
                transition(key, PhaseState.DRAINED);
                checkpoints.clear(key);
                log.info("[{}] No more records. {} records stored in this run", key, processed);
                if (!isUnlimited(limit)) {
                    log.info("[{}] Limited run, completion marker not written", key);
                    return new PhaseResult(type, Phase.DATA, PhaseState.DRAINED, processed, cursor);
                }
                checkpoints.markComplete(key);
                return new PhaseResult(type, Phase.DATA, PhaseState.COMPLETE, processed, cursor);
            }

            transition(key, PhaseState.PERSISTING);
            sink.upsertRecords(type, page.getRecords());
            processed += page.size();
            String next = page.nextCursor();
            log.info("[{}] Stored {} records (total {})", key, page.size(), processed);

            if (Objects.equals(next, cursor)) {
                unchanged++;
                if (unchanged >= STUCK_THRESHOLD) {
                    log.warn("[{}] Cursor {} did not advance for {} consecutive pages, stopping",
                            key, cursor, unchanged);
                    return new PhaseResult(type, Phase.DATA, PhaseState.STUCK, processed, cursor);
                }
            } else {
                unchanged = 0;
            }

            if (isLimitReached(processed, limit)) {
                checkpoints.clear(key);
                log.info("[{}] Reached limit of {} records", key, limit);
                return new PhaseResult(type, Phase.DATA, PhaseState.LIMITED, processed, next);
            }

            transition(key, PhaseState.CHECKPOINTING);
            checkpoints.save(key, next);
            cursor = next;
        }
    }

    /**
     * Fetches and stores the associations of every stored object of a type, resuming from the
     * saved index if any.
     *
     * @param type resource type whose objects are the edge sources
     * @param limit index bound for this run; {@code null} or not positive means unlimited
     * @return outcome of the phase
     * @throws SQLException on store error
     */
    public PhaseResult ingestAssociations(ResourceType type, Integer limit) throws SQLException {
        return ingestAssociations(type, limit, true);
    }

    /**
     * Fetches and stores the associations of every stored object of a type.
     *
     * <p>
     * With {@code idsComplete = false} the stored ids are known to be partial (the data phase of
     * the type did not finish), so the ids are processed but no completion marker is written and
     * the next run walks the list again.
     * </p>
     *
     * @param type resource type whose objects are the edge sources
     * @param limit index bound for this run; {@code null} or not positive means unlimited
     * @param idsComplete whether the stored ids cover every object of the type
     * @return outcome of the phase
     * @throws SQLException on store error
     */
    public PhaseResult ingestAssociations(ResourceType type, Integer limit, boolean idsComplete)
            throws SQLException {
        CheckpointKey key = CheckpointKey.of(type, Phase.ASSOCIATIONS);
        if (type.getAssociationTargets().isEmpty()) {
            log.debug("[{}] No association partners", key);
            return PhaseResult.skipped(type, Phase.ASSOCIATIONS);
        }
        if (checkpoints.isPhaseComplete(key)) {
            log.info("[{}] Already complete, skipping", key);
            return PhaseResult.skipped(type, Phase.ASSOCIATIONS);
        }

        List<String> ids = sink.listIds(type);
        int start = resumeIndex(key, ids.size());
        log.info("[{}] Processing {} of {} objects starting at index {}", key,
                ids.size() - start, ids.size(), start);

        long processed = 0;
        int index = start;
        while (index < ids.size()) {
            transition(key, PhaseState.FETCHING);
            String fromId = ids.get(index);
            List<AssociationEdge> edges = associationFetcher.fetchEdges(type, fromId);

            transition(key, PhaseState.PERSISTING);
            sink.insertAssociations(edges);
            processed++;
            log.debug("[{}] {} edges stored for {}", key, edges.size(), fromId);
            index++;

            if (isLimitReached(index, limit)) {
                checkpoints.clear(key);
                log.info("[{}] Reached limit of {} objects", key, limit);
                return new PhaseResult(type, Phase.ASSOCIATIONS, PhaseState.LIMITED, processed,
                        String.valueOf(index));
            }

            transition(key, PhaseState.CHECKPOINTING);
            checkpoints.save(key, String.valueOf(index));
        }

        transition(key, PhaseState.DRAINED);
        checkpoints.clear(key);
        log.info("[{}] Associations of {} objects stored in this run", key, processed);
        if (!isUnlimited(limit) || !idsComplete) {
            log.info("[{}] {}, completion marker not written", key,
                    idsComplete ? "Limited run" : "Stored ids are incomplete");
            return new PhaseResult(type, Phase.ASSOCIATIONS, PhaseState.DRAINED, processed,
                    String.valueOf(index));
        }
        checkpoints.markComplete(key);
        return new PhaseResult(type, Phase.ASSOCIATIONS, PhaseState.COMPLETE, processed,
                String.valueOf(index));
    }

    private int resumeIndex(CheckpointKey key, int size) {
        Optional<String> saved = checkpoints.load(key);
        if (saved.isEmpty()) {
            transition(key, PhaseState.FRESH);
            return 0;
        }
        int index = Integer.parseInt(saved.get());
        if (index > size) {
            log.warn("[{}] Saved index {} exceeds {} stored objects, restarting at 0", key, index,
                    size);
            transition(key, PhaseState.FRESH);
            return 0;
        }
        transition(key, PhaseState.RESUMING);
        return index;
    }

    static boolean isLimitReached(long count, Integer limit) {
        return !isUnlimited(limit) && count >= limit;
    }

    static boolean isUnlimited(Integer limit) {
        return limit == null || limit <= 0;
    }

    private static void transition(CheckpointKey key, PhaseState state) {
        log.trace("[{}] -> {}", key, state);
    }
}
