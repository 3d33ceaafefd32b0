package com.lumis.invoiceingest.domain.ports;

import com.lumis.invoiceingest.domain.ProcessingResult;

import java.time.OffsetDateTime;

/**
 * One entry per submission attempt, opened when the attempt starts and closed with its result.
 * Both writes commit on their own, whatever happens to the invoice transaction.
 */
public interface ProcessingLogRepository {

    /**
     * @return the id to close the entry with
     */
    Long open(String url, Long userId, String origin, OffsetDateTime requestedAt);

    void close(Long id, ProcessingResult result);
}
