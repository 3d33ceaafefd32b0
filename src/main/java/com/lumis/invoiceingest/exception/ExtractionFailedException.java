package com.lumis.invoiceingest.exception;

/**
 * The fetched document does not match the DGI invoice template at all, or is a portal error page.
 */
public class ExtractionFailedException extends InvoiceIngestionException {

    public ExtractionFailedException(String message) {
        super(FailureKind.EXTRACTION_FAILED, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(FailureKind.EXTRACTION_FAILED, message, cause);
    }
}
