package com.lumis.invoiceingest.domain;

/**
 * Final state of one submission attempt as recorded in the processing log.
 */
public enum ProcessingStatus {
    PROCESSING,
    SUCCESS,
    DUPLICATE,
    SCRAPING_ERROR,
    DATABASE_ERROR
}
