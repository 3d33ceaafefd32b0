package com.lumis.invoiceingest.api;

import com.lumis.invoiceingest.api.dto.SubmissionResponse;
import com.lumis.invoiceingest.api.dto.SubmitInvoiceRequest;
import com.lumis.invoiceingest.application.IngestionOutcome;
import com.lumis.invoiceingest.application.InvoiceIngestionService;
import com.lumis.invoiceingest.application.SubmitInvoiceCommand;
import com.lumis.invoiceingest.config.AppProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/invoices")
@Tag(name = "Invoice submissions", description = "Submit DGI invoice URLs for acquisition")
public class InvoiceSubmissionController {

    private static final Logger log = LoggerFactory.getLogger(InvoiceSubmissionController.class);

    private final InvoiceIngestionService service;
    private final AppProperties props;

    public InvoiceSubmissionController(InvoiceIngestionService service, AppProperties props) {
        this.service = service;
        this.props = props;
    }

    @PostMapping("/submissions")
    @Operation(summary = "Acquire an invoice from its DGI confirmation URL",
            description = "201 when stored, 200 when already stored, 202 when parked for recovery")
    public ResponseEntity<?> submit(@Valid @RequestBody SubmitInvoiceRequest req) {
        log.info("Invoice submission - userId: {}, source: {}, chatId: {}", req.userId, req.source, req.chatId);

        if (!isAllowedHost(req.url)) {
            log.warn("Rejected submission for foreign host: {}", req.url);
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid invoice URL",
                    "message", "URL must point to " + props.getSubmission().getAllowedHost(),
                    "code", "URL_NOT_ALLOWED"
            ));
        }

        SubmitInvoiceCommand cmd = new SubmitInvoiceCommand(
                req.url.trim(),
                req.userId,
                req.chatId,
                req.channelId,
                req.source.toLowerCase(Locale.ROOT),
                OffsetDateTime.now()
        );
        IngestionOutcome outcome = service.ingest(cmd);

        HttpStatus status = switch (outcome.status()) {
            case COMMITTED -> HttpStatus.CREATED;
            case DUPLICATE -> HttpStatus.OK;
            case FALLBACK_PENDING -> HttpStatus.ACCEPTED;
        };
        return ResponseEntity.status(status).body(toResponse(outcome));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fields.putIfAbsent(error.getField(), error.getDefaultMessage()));
        log.warn("Invalid submission: {}", fields);
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Validation failed",
                "message", "Invalid submission",
                "code", "VALIDATION_ERROR",
                "fields", fields
        ));
    }

    // Lenient parse: scanned QR URLs may carry characters java.net.URI rejects
    private boolean isAllowedHost(String url) {
        String host;
        try {
            host = UriComponentsBuilder.fromHttpUrl(url.trim()).build().getHost();
        } catch (IllegalArgumentException e) {
            log.debug("Submitted URL could not be parsed: {}", e.getMessage());
            return false;
        }
        return host != null && host.equalsIgnoreCase(props.getSubmission().getAllowedHost());
    }

    static SubmissionResponse toResponse(IngestionOutcome outcome) {
        return new SubmissionResponse(
                outcome.status().name(),
                userMessage(outcome),
                outcome.cufe(),
                outcome.issuerName(),
                outcome.invoiceNumber(),
                outcome.totalAmount(),
                outcome.status() == IngestionOutcome.Status.COMMITTED ? outcome.itemCount() : null,
                outcome.pendingId(),
                outcome.warnings().isEmpty() ? null : outcome.warnings(),
                outcome.originalUserId(),
                outcome.originalProcessDate()
        );
    }

    static String userMessage(IngestionOutcome outcome) {
        return switch (outcome.status()) {
            case COMMITTED -> outcome.issuerName() != null && outcome.totalAmount() != null
                    ? "Tu factura de " + outcome.issuerName() + " por valor de $" + outcome.totalAmount().toPlainString()
                      + " fue procesada exitosamente."
                    : "Tu factura fue procesada exitosamente.";
            case DUPLICATE -> "Esta factura ya fue registrada anteriormente.";
            case FALLBACK_PENDING -> "Hemos recibido tu factura. La procesaremos en breve.";
        };
    }
}
