package com.lumis.invoiceingest.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmissionResponse(
        String status,
        String message,
        String cufe,
        String issuerName,
        String invoiceNumber,
        BigDecimal totalAmount,
        Integer itemCount,
        Long pendingId,
        List<String> warnings,
        Long originalUserId,
        OffsetDateTime originalProcessDate
) {
}
