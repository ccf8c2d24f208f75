package com.pubannotator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Identity and deduplication engine.
 * <p>
 * Policy, stated for callers: when several raw records share an identity key the <b>first
 * occurrence wins as a whole</b>. Its id, payload, locator and metadata are kept unchanged and
 * later copies are reported as {@link DedupResult.Duplicate}s, even when their content differs.
 * No field-level merging happens.
 * <p>
 * Ids: records arriving with an id keep it. A record without one whose identity key the store
 * already knows gets the stored id back. The remaining survivors get ids from the run's
 * {@link IdGenerator} in encounter order, skipping supplied and stored ids, so a record keeps its id
 * across runs even when records before it appear or disappear. If two surviving records arrive
 * with the same id, the later one is given a generated id.
 * <p>
 * Pure in-memory bookkeeping; never touches persistence. Deduplicating the survivors again
 * (see {@link PipelineRecord#toRawRecord()}) returns them unchanged.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class RecordDeduplicator {
    private static final Logger logger = LoggerFactory.getLogger(RecordDeduplicator.class);

    public DedupResult deduplicate(List<RawRecord> input, IdGenerator ids) {
        return deduplicate(input, ids, Map.of());
    }

    /**
     * @param storedIds ids already held by the store, keyed by identity key
     */
    public DedupResult deduplicate(List<RawRecord> input, IdGenerator ids, Map<String, String> storedIds) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(storedIds, "storedIds");

        Map<String, Integer> firstIndexByKey = new LinkedHashMap<>();
        List<String> keys = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            String key = IdentityKeys.canonicalize(input.get(i).naturalKey());
            keys.add(key);
            firstIndexByKey.putIfAbsent(key, i);
        }

        // reserve supplied ids up front so generated ids never collide with later records
        String[] assigned = new String[input.size()];
        for (int index : firstIndexByKey.values()) {
            String supplied = input.get(index).id();
            if (supplied == null) continue;
            if (ids.reserve(supplied)) {
                assigned[index] = supplied;
            } else {
                logger.warn("Id '{}' supplied for {} is already used in this run; a new id will be generated.",
                    supplied, input.get(index).sourceLocator());
            }
        }
        int reused = 0;
        for (Map.Entry<String, Integer> first : firstIndexByKey.entrySet()) {
            int index = first.getValue();
            String stored = storedIds.get(first.getKey());
            if (assigned[index] != null || input.get(index).id() != null || stored == null) continue;
            if (ids.reserve(stored)) {
                assigned[index] = stored;
                reused++;
            } else {
                logger.warn("Stored id '{}' of {} was supplied for another record; a new id will be generated.",
                    stored, first.getKey());
            }
        }
        // ids of stored entries absent from this input stay taken
        storedIds.values().forEach(ids::reserve);

        List<PipelineRecord> survivors = new ArrayList<>(firstIndexByKey.size());
        List<DedupResult.Duplicate> duplicates = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            RawRecord raw = input.get(i);
            String key = keys.get(i);
            int first = firstIndexByKey.get(key);
            if (first != i) {
                duplicates.add(new DedupResult.Duplicate(i, key, raw.sourceLocator(), assigned[first]));
                if (!Objects.equals(raw.rawPayload(), input.get(first).rawPayload())) {
                    logger.info("Duplicate {} differs from first occurrence; keeping first-seen content ({}).", key, assigned[first]);
                }
                continue;
            }
            if (assigned[i] == null) {
                assigned[i] = ids.next();
            }
            survivors.add(new PipelineRecord(i, assigned[i], key, raw.rawPayload(), raw.sourceLocator(), raw.metadata()));
        }
        logger.info("Deduplicated {} raw records into {} unique records ({} duplicates dropped, {} stored ids reused).",
            input.size(), survivors.size(), duplicates.size(), reused);
        return new DedupResult(survivors, duplicates);
    }
}
