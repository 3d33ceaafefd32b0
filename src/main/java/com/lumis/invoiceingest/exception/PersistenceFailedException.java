package com.lumis.invoiceingest.exception;

public class PersistenceFailedException extends InvoiceIngestionException {

    public PersistenceFailedException(String message, Throwable cause) {
        super(FailureKind.PERSISTENCE_FAILED, message, cause);
    }
}
