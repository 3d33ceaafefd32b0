package com.lumis.invoiceingest.application;

import com.lumis.invoiceingest.domain.InvoiceHeader;
import com.lumis.invoiceingest.domain.NormalizedInvoice;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * What happened to one submission. Exactly one of a stored invoice, a recognized duplicate or a
 * pending-recovery entry results from every call.
 */
public record IngestionOutcome(
        Status status,
        String cufe,
        String issuerName,
        String invoiceNumber,
        BigDecimal totalAmount,
        int itemCount,
        Long pendingId,
        String reason,
        List<String> warnings,
        Long originalUserId,
        OffsetDateTime originalProcessDate
) {

    public enum Status { COMMITTED, DUPLICATE, FALLBACK_PENDING }

    public IngestionOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static IngestionOutcome committed(NormalizedInvoice invoice) {
        InvoiceHeader h = invoice.header();
        return new IngestionOutcome(Status.COMMITTED, h.getCufe(), h.getIssuerName(), h.getInvoiceNumber(),
                h.getTotAmount(), invoice.details().size(), null, null, invoice.warnings(), null, null);
    }

    public static IngestionOutcome duplicate(InvoiceHeader existing) {
        return new IngestionOutcome(Status.DUPLICATE, existing.getCufe(), existing.getIssuerName(),
                existing.getInvoiceNumber(), existing.getTotAmount(), 0, null, "Invoice already stored",
                List.of(), existing.getUserId(), existing.getProcessDate());
    }

    /** Used when the storage constraint rejects the write and the stored row cannot be read back. */
    public static IngestionOutcome duplicate(NormalizedInvoice attempted, String reason) {
        InvoiceHeader h = attempted.header();
        return new IngestionOutcome(Status.DUPLICATE, h.getCufe(), h.getIssuerName(), h.getInvoiceNumber(),
                h.getTotAmount(), 0, null, reason, List.of(), null, null);
    }

    public static IngestionOutcome pending(String cufe, Long pendingId, String reason) {
        return new IngestionOutcome(Status.FALLBACK_PENDING, cufe, null, null, null, 0, pendingId, reason,
                List.of(), null, null);
    }
}
