package org.datayoinker.adapters;

import org.datayoinker.models.entity.YoinkRecord;

import java.util.List;

/**
 * Append-only, per-topic record store shared by the publish and retrieval paths.
 * <p>
 * Implementations assign ids and timestamps, make appended rows visible to any query issued after
 * {@link #append} returns, and report failures as {@code STORAGE_FAILURE} yoink exceptions.
 */
public interface YoinkStore {

    /**
     * Persists a new record and returns the row as stored.
     */
    YoinkRecord append(String topic, String content);

    /**
     * Returns the records of a topic newest first, ties broken by descending id.
     *
     * @param limit maximum number of rows, or {@code null} for all of them
     */
    List<YoinkRecord> query(String topic, Integer limit);
}
