package com.lumis.invoiceingest.exception;

/**
 * The confirmation page could not be retrieved: network error, timeout, non-success status,
 * redirect problems or a body that is not text.
 */
public class FetchFailedException extends InvoiceIngestionException {

    private final String url;

    public FetchFailedException(String url, String reason) {
        super(FailureKind.FETCH_FAILED, url + " (" + reason + ")");
        this.url = url;
    }

    public FetchFailedException(String url, String reason, Throwable cause) {
        super(FailureKind.FETCH_FAILED, url + " (" + reason + ": " + describe(cause) + ")", cause);
        this.url = url;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public String getUrl() {
        return url;
    }
}
