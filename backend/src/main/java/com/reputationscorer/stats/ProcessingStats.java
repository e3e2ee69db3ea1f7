package com.reputationscorer.stats;

import org.springframework.stereotype.Component;

/**
 * Processing counters shared between the stream processor (single writer) and the status API (readers).
 * Each record call updates processed, one outcome counter and the timestamp as one unit.
 */
@Component
public class ProcessingStats {

    private long processedCount;
    private long successCount;
    private long failureCount;
    private Long lastProcessedTimestamp;

    /**
     * @param messageTimestamp epoch seconds of the processed message
     */
    public synchronized void recordSuccess(long messageTimestamp) {
        processedCount++;
        successCount++;
        lastProcessedTimestamp = messageTimestamp;
    }

    /**
     * @param messageTimestamp epoch seconds of the processed message
     */
    public synchronized void recordFailure(long messageTimestamp) {
        processedCount++;
        failureCount++;
        lastProcessedTimestamp = messageTimestamp;
    }

    public synchronized StatsSnapshot snapshot() {
        return new StatsSnapshot(processedCount, successCount, failureCount, lastProcessedTimestamp);
    }
}
