package com.lumis.invoiceingest.exception;

/**
 * Raised by the storage layer when the CUFE unique constraint rejects a header insert.
 * This is a recognized outcome, not an error.
 */
public class DuplicateInvoiceException extends InvoiceIngestionException {

    private final String cufe;

    public DuplicateInvoiceException(String cufe, Throwable cause) {
        super(FailureKind.DUPLICATE_INVOICE, cufe, cause);
        this.cufe = cufe;
    }

    public String getCufe() {
        return cufe;
    }
}
