package taskdock.engine.repository;

import taskdock.engine.model.HistoryRecord;
import taskdock.engine.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for finished-download history.
 */
public interface HistoryRepository {

    /**
     * Save a new record.
     *
     * @param record the record to save
     */
    void save(HistoryRecord record);

    Optional<HistoryRecord> findById(String id);

    /**
     * Most recent records first.
     *
     * @param limit maximum number of results
     */
    List<HistoryRecord> findRecent(int limit);

    /**
     * All records for a URL, most recent first.
     */
    List<HistoryRecord> findByUrl(String url);

    int countByStatus(TaskStatus status);

    int count();

    /**
     * Delete records older than the cutoff.
     *
     * @return number of records deleted
     */
    int deleteBefore(Instant cutoff);

    void clear();
}
