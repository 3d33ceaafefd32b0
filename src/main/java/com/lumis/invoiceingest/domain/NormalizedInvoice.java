package com.lumis.invoiceingest.domain;

import java.util.List;

/**
 * Typed result of normalization, ready to be stored as one unit.
 *
 * @param warnings anomalies that did not prevent normalization (e.g. no line items)
 */
public record NormalizedInvoice(InvoiceHeader header,
                                List<InvoiceDetail> details,
                                List<InvoicePayment> payments,
                                List<String> warnings) {

    public NormalizedInvoice {
        details = List.copyOf(details);
        payments = List.copyOf(payments);
        warnings = List.copyOf(warnings);
    }

    public String cufe() {
        return header.getCufe();
    }
}
