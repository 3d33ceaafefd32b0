package com.lumis.invoiceingest.domain;

import com.lumis.invoiceingest.exception.InvoiceIngestionException.FailureKind;

/**
 * How a submission attempt ended, written onto its processing log entry.
 *
 * @param failureKind category of the failure, null on success, on duplicates and for failures the
 *                    pipeline did not classify
 */
public record ProcessingResult(
        ProcessingStatus status,
        String cufe,
        FailureKind failureKind,
        String errorMessage,
        long executionTimeMs,
        int scrapedFieldsCount
) {}
