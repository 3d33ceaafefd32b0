package com.lumis.invoiceingest.exception;

/**
 * Base type for every failure the acquisition pipeline can raise.
 * <p>
 * Messages always start with {@link FailureKind#label()} so that operators reading the
 * pending-recovery queue can triage by prefix.
 */
public abstract class InvoiceIngestionException extends RuntimeException {

    public enum FailureKind {
        FETCH_FAILED("Fetch failed"),
        EXTRACTION_FAILED("Extraction failed"),
        NORMALIZATION_FAILED("Normalization failed"),
        DUPLICATE_INVOICE("Duplicate invoice"),
        PERSISTENCE_FAILED("Persistence failed");

        private final String label;

        FailureKind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final FailureKind kind;

    protected InvoiceIngestionException(FailureKind kind, String detail) {
        super(kind.label() + ": " + detail);
        this.kind = kind;
    }

    protected InvoiceIngestionException(FailureKind kind, String detail, Throwable cause) {
        super(kind.label() + ": " + detail, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
