package com.lumis.invoiceingest.exception;

/**
 * A mandatory field is missing, or a present field could not be parsed into its typed form.
 */
public class NormalizationFailedException extends InvoiceIngestionException {

    private final String field;

    public NormalizationFailedException(String field, String reason) {
        super(FailureKind.NORMALIZATION_FAILED, "missing or invalid field '" + field + "' (" + reason + ")");
        this.field = field;
    }

    public NormalizationFailedException(String field, String reason, Throwable cause) {
        super(FailureKind.NORMALIZATION_FAILED, "missing or invalid field '" + field + "' (" + reason + ")", cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
