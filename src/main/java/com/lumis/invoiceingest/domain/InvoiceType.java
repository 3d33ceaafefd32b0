package com.lumis.invoiceingest.domain;

/**
 * How the invoice reached us, as told by the resolved portal URL.
 */
public enum InvoiceType {
    /** Consulted through the QR query page ({@code FacturasPorQR}). */
    QR,
    /** Consulted by CUFE ({@code FacturasPorCUFE} or a {@code chFE} parameter). */
    CUFE,
    GENERIC
}
