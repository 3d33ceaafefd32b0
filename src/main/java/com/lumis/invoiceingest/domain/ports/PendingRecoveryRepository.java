package com.lumis.invoiceingest.domain.ports;

import com.lumis.invoiceingest.domain.PendingRecoveryEntry;

/**
 * Append-only queue of submissions waiting for manual or automated reprocessing.
 */
public interface PendingRecoveryRepository {

    /**
     * Commits the entry in its own transaction, independent of any transaction in progress.
     *
     * @return the generated id
     */
    Long insert(PendingRecoveryEntry entry);
}
