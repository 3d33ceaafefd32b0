package com.lumis.invoiceingest.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumis.invoiceingest.config.AppProperties;
import com.lumis.invoiceingest.domain.*;
import com.lumis.invoiceingest.domain.ports.InvoiceRepository;
import com.lumis.invoiceingest.domain.ports.PendingRecoveryRepository;
import com.lumis.invoiceingest.domain.ports.ProcessingLogRepository;
import com.lumis.invoiceingest.exception.DuplicateInvoiceException;
import com.lumis.invoiceingest.exception.InvoiceIngestionException;
import com.lumis.invoiceingest.exception.InvoiceIngestionException.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one submitted invoice URL through fetch, extraction, normalization, duplicate check and
 * persistence. Every call ends in exactly one {@link IngestionOutcome}; failures are parked in the
 * pending-recovery queue instead of being thrown.
 * <p>
 * Not transactional itself: the invoice write and the pending-recovery write each own their
 * transaction, so a rolled back invoice never takes its pending entry down with it. The same holds
 * for the processing log entry that records each attempt.
 */
@Service
public class InvoiceIngestionService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceIngestionService.class);

    static final String SCRAPING_ERROR_PREFIX = "Scraping error: ";
    static final String SAVE_ERROR_PREFIX = "Save error: ";

    private final DocumentFetcher fetcher;
    private final InvoiceExtractor extractor;
    private final InvoiceRepository invoiceRepo;
    private final PendingRecoveryRepository pendingRepo;
    private final ProcessingLogRepository processingLog;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    private final InvoiceNormalizer normalizer = new InvoiceNormalizer();

    public enum IngestionStage { FETCHING, EXTRACTING, NORMALIZING, DEDUPLICATION_CHECK, PERSISTING }

    public interface DocumentFetcher {
        FetchedDocument fetch(String url);

        record FetchedDocument(String body, String finalUrl, String requestedUrl) {
            public boolean redirected() {
                return !finalUrl.equals(requestedUrl);
            }
        }
    }

    public interface InvoiceExtractor {
        ExtractedData extract(String html);
    }

    public InvoiceIngestionService(DocumentFetcher fetcher, InvoiceExtractor extractor, InvoiceRepository invoiceRepo,
                                   PendingRecoveryRepository pendingRepo, ProcessingLogRepository processingLog,
                                   AppProperties props, ObjectMapper objectMapper) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.invoiceRepo = invoiceRepo;
        this.pendingRepo = pendingRepo;
        this.processingLog = processingLog;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    /** What the processing log needs to know about an attempt beyond its outcome. */
    private static final class Attempt {
        int scrapedFields;
        FailureKind failureKind;
    }

    public IngestionOutcome ingest(SubmitInvoiceCommand cmd) {
        OffsetDateTime receivedAt = cmd.receivedAt != null ? cmd.receivedAt : OffsetDateTime.now();
        long startTime = System.currentTimeMillis();
        log.info("Starting invoice ingestion - url: {}, userId: {}, chatId: {}, source: {}",
                cmd.url, cmd.userId, cmd.chatId, cmd.source);

        Long logId = openProcessingLog(cmd, receivedAt);
        Attempt attempt = new Attempt();
        IngestionOutcome outcome = process(cmd, receivedAt, attempt);
        closeProcessingLog(logId, outcome, attempt, System.currentTimeMillis() - startTime);
        return outcome;
    }

    private IngestionOutcome process(SubmitInvoiceCommand cmd, OffsetDateTime receivedAt, Attempt attempt) {
        IngestionStage stage = IngestionStage.FETCHING;
        NormalizedInvoice invoice;
        try {
            DocumentFetcher.FetchedDocument document = fetcher.fetch(cmd.url);

            stage = IngestionStage.EXTRACTING;
            ExtractedData extracted = extractor.extract(document.body());
            attempt.scrapedFields = extracted.getHeader().size();
            log.info("Extracted {} from {}", extracted, document.finalUrl());

            stage = IngestionStage.NORMALIZING;
            invoice = normalizer.normalize(extracted, document.finalUrl(), cmd.userId, cmd.source, receivedAt);
        } catch (InvoiceIngestionException e) {
            attempt.failureKind = e.getKind();
            log.warn("Invoice ingestion failed while {} - url: {}, reason: {}", stage, cmd.url, e.getMessage());
            return park(cmd, receivedAt, null, SCRAPING_ERROR_PREFIX + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while {} - url: {}", stage, cmd.url, e);
            return park(cmd, receivedAt, null, SCRAPING_ERROR_PREFIX + "Unexpected failure while " + stage + ": " + e);
        }

        String cufe = invoice.cufe();

        stage = IngestionStage.DEDUPLICATION_CHECK;
        Optional<InvoiceHeader> existing = lookupStored(cufe);
        if (existing.isPresent()) {
            InvoiceHeader original = existing.get();
            log.info("Invoice {} already stored - owner userId: {}, processed: {}",
                    cufe, original.getUserId(), original.getProcessDate());
            return IngestionOutcome.duplicate(original);
        }

        stage = IngestionStage.PERSISTING;
        try {
            invoiceRepo.saveInvoice(invoice);
        } catch (DuplicateInvoiceException e) {
            log.info("Invoice {} was stored concurrently by another submission", cufe);
            NormalizedInvoice attempted = invoice;
            return lookupStored(cufe)
                    .map(IngestionOutcome::duplicate)
                    .orElseGet(() -> IngestionOutcome.duplicate(attempted, e.getMessage()));
        } catch (RuntimeException e) {
            attempt.failureKind = e instanceof InvoiceIngestionException
                    ? ((InvoiceIngestionException) e).getKind()
                    : null;
            log.error("Invoice {} could not be saved while {}: {}", cufe, stage, e.getMessage(), e);
            return park(cmd, receivedAt, cufe,
                    SAVE_ERROR_PREFIX + e.getMessage() + " | normalized: " + summarize(invoice));
        }

        log.info("Invoice ingestion completed - cufe: {}, issuer: '{}', total: {}, items: {}, warnings: {}",
                cufe, invoice.header().getIssuerName(), invoice.header().getTotAmount(),
                invoice.details().size(), invoice.warnings());
        return IngestionOutcome.committed(invoice);
    }

    private Long openProcessingLog(SubmitInvoiceCommand cmd, OffsetDateTime receivedAt) {
        try {
            return processingLog.open(cmd.url, cmd.userId, cmd.source, receivedAt);
        } catch (RuntimeException e) {
            log.warn("Processing log entry could not be opened for url {}: {}", cmd.url, e.getMessage());
            return null;
        }
    }

    private void closeProcessingLog(Long logId, IngestionOutcome outcome, Attempt attempt, long elapsedMs) {
        if (logId == null) {
            return;
        }
        ProcessingResult result = switch (outcome.status()) {
            case COMMITTED -> new ProcessingResult(ProcessingStatus.SUCCESS, outcome.cufe(), null, null,
                    elapsedMs, attempt.scrapedFields);
            case DUPLICATE -> new ProcessingResult(ProcessingStatus.DUPLICATE, outcome.cufe(), null, outcome.reason(),
                    elapsedMs, attempt.scrapedFields);
            case FALLBACK_PENDING -> new ProcessingResult(
                    outcome.reason().startsWith(SAVE_ERROR_PREFIX)
                            ? ProcessingStatus.DATABASE_ERROR
                            : ProcessingStatus.SCRAPING_ERROR,
                    outcome.cufe(), attempt.failureKind, outcome.reason(), elapsedMs, attempt.scrapedFields);
        };
        try {
            processingLog.close(logId, result);
        } catch (RuntimeException e) {
            log.warn("Processing log entry {} could not be closed as {}: {}", logId, result.status(), e.getMessage());
        }
    }

    private Optional<InvoiceHeader> lookupStored(String cufe) {
        try {
            return invoiceRepo.findHeaderByCufe(cufe);
        } catch (RuntimeException e) {
            log.warn("Duplicate lookup failed for CUFE {}, relying on the storage constraint: {}", cufe, e.getMessage());
            return Optional.empty();
        }
    }

    private IngestionOutcome park(SubmitInvoiceCommand cmd, OffsetDateTime receivedAt, String cufe, String reason) {
        PendingRecoveryEntry entry = new PendingRecoveryEntry(
                null,
                cmd.url,
                cmd.chatId,
                receivedAt,
                props.getPending().getDocumentType(),
                cmd.userId,
                reason,
                props.getPending().getOriginTag(),
                cmd.channelId
        );
        try {
            Long pendingId = pendingRepo.insert(entry);
            log.info("Submission parked for recovery - pendingId: {}, url: {}", pendingId, cmd.url);
            return IngestionOutcome.pending(cufe, pendingId, reason);
        } catch (RuntimeException e) {
            log.error("Pending-recovery write failed for url {} - the submission is only in this log. Reason was: {}",
                    cmd.url, reason, e);
            return IngestionOutcome.pending(cufe, null, reason + " | pending write failed: " + e.getMessage());
        }
    }

    private String summarize(NormalizedInvoice invoice) {
        InvoiceHeader h = invoice.header();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("cufe", h.getCufe());
        summary.put("no", h.getInvoiceNumber());
        summary.put("date", h.getIssueDate() != null ? h.getIssueDate().toString() : null);
        summary.put("emisor_name", h.getIssuerName());
        summary.put("emisor_ruc", h.getIssuerRuc());
        summary.put("tot_amount", h.getTotAmount() != null ? h.getTotAmount().toPlainString() : null);
        summary.put("tot_itbms", h.getTotItbms() != null ? h.getTotItbms().toPlainString() : null);
        summary.put("type", h.getType() != null ? h.getType().name() : null);
        summary.put("details", invoice.details().size());
        summary.put("payments", invoice.payments().size());
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize normalized summary for {}: {}", h.getCufe(), e.getMessage());
            return summary.toString();
        }
    }
}
