package watchtower.monitor.repository;

import watchtower.monitor.model.AlertRecord;

import java.util.List;

/**
 * Repository interface for alert send records.
 */
public interface AlertRecordRepository {

    /**
     * Save a new record.
     *
     * @param record the record to save
     */
    void save(AlertRecord record);

    /**
     * Persist the send outcome of a record.
     *
     * @param record the record with its outcome
     */
    void updateOutcome(AlertRecord record);

    /**
     * Find all records of a detection.
     *
     * @param detectionId the detection ID
     * @return records ordered by creation time
     */
    List<AlertRecord> findByDetectionId(String detectionId);
}
