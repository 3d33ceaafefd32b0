package com.lumis.invoiceingest.application;

import com.lumis.invoiceingest.Fixtures;
import com.lumis.invoiceingest.application.InvoiceIngestionService.DocumentFetcher;
import com.lumis.invoiceingest.application.InvoiceIngestionService.DocumentFetcher.FetchedDocument;
import com.lumis.invoiceingest.domain.InvoiceHeader;
import com.lumis.invoiceingest.domain.ports.InvoiceRepository;
import com.lumis.invoiceingest.exception.FetchFailedException;
import com.lumis.invoiceingest.infrastructure.jpa.PendingRecoveryEntity;
import com.lumis.invoiceingest.infrastructure.jpa.ProcessingLogEntity;
import com.lumis.invoiceingest.infrastructure.jpa.SpringInvoiceDetailRepository;
import com.lumis.invoiceingest.infrastructure.jpa.SpringPendingRecoveryRepository;
import com.lumis.invoiceingest.infrastructure.jpa.SpringProcessingLogRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class InvoiceIngestionIntegrationTest {

    @Autowired
    private InvoiceIngestionService service;

    @Autowired
    private InvoiceRepository invoices;

    @Autowired
    private SpringInvoiceDetailRepository detailRows;

    @Autowired
    private SpringPendingRecoveryRepository pendingRows;

    @Autowired
    private SpringProcessingLogRepository processingLogRows;

    @MockBean
    private DocumentFetcher fetcher;

    private static SubmitInvoiceCommand command(String url, long userId) {
        return new SubmitInvoiceCommand(url, userId, "chat-" + userId, null, "whatsapp", OffsetDateTime.now());
    }

    private void servePage(String url, String html) {
        when(fetcher.fetch(url)).thenReturn(new FetchedDocument(html, url, url));
    }

    @Test
    void shouldStoreInvoiceOnceAndReportDuplicateAfterwards() {
        String cufe = Fixtures.uniqueCufe();
        String url = Fixtures.qrUrl(cufe);
        servePage(url, Fixtures.invoicePage("dgi-invoice.html", cufe));

        IngestionOutcome first = service.ingest(command(url, 1L));
        IngestionOutcome second = service.ingest(command(url, 2L));

        assertThat(first.status()).isEqualTo(IngestionOutcome.Status.COMMITTED);
        assertThat(first.issuerName()).isEqualTo("Lum Corporation");
        assertThat(first.itemCount()).isEqualTo(1);

        assertThat(second.status()).isEqualTo(IngestionOutcome.Status.DUPLICATE);
        assertThat(second.originalUserId()).isEqualTo(1L);
        assertThat(second.originalProcessDate()).isNotNull();

        assertThat(detailRows.countByCufe(cufe)).isEqualTo(1);
        assertThat(invoices.findPaymentsByCufe(cufe)).hasSize(1);
        assertThat(pendingRows.findByUrlOrderByIdAsc(url)).isEmpty();

        List<ProcessingLogEntity> attempts = processingLogRows.findByUrlOrderByIdAsc(url);
        assertThat(attempts).extracting(ProcessingLogEntity::getStatus).containsExactly("SUCCESS", "DUPLICATE");
        assertThat(attempts).allSatisfy(entry -> {
            assertThat(entry.getCufe()).isEqualTo(cufe);
            assertThat(entry.getErrorType()).isNull();
            assertThat(entry.getExecutionTimeMs()).isNotNull();
            assertThat(entry.getResponseTimestamp()).isNotNull();
        });
        assertThat(attempts.get(0).getScrapedFieldsCount()).isPositive();
        assertThat(attempts.get(0).getUserId()).isEqualTo(1L);
        assertThat(attempts.get(1).getUserId()).isEqualTo(2L);
    }

    @Test
    void shouldKeepCentsExactThroughStorage() {
        String cufe = Fixtures.uniqueCufe();
        String url = Fixtures.qrUrl(cufe);
        String html = Fixtures.invoicePage("dgi-invoice.html", cufe)
                .replace("<div>107.00</div>", "<div>2.68</div>")
                .replace("<div>7.00</div>", "<div>0.18</div>");
        servePage(url, html);

        assertThat(service.ingest(command(url, 3L)).status()).isEqualTo(IngestionOutcome.Status.COMMITTED);

        InvoiceHeader stored = invoices.findHeaderByCufe(cufe).orElseThrow();
        assertThat(stored.getTotAmount()).isEqualTo(new BigDecimal("2.68"));
        assertThat(stored.getTotItbms()).isEqualTo(new BigDecimal("0.18"));
    }

    @Test
    void shouldTakeCufeFromRedirectedUrl() {
        String cufe = Fixtures.uniqueCufe();
        String shortUrl = "https://dgi-fep.mef.gob.pa/q/" + cufe.substring(cufe.length() - 8);
        String finalUrl = "https://dgi-fep.mef.gob.pa/Consultas/FacturasPorCUFE?chFE=" + cufe;
        when(fetcher.fetch(shortUrl)).thenReturn(
                new FetchedDocument(Fixtures.html("dgi-invoice-no-cufe.html"), finalUrl, shortUrl));

        IngestionOutcome outcome = service.ingest(command(shortUrl, 4L));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.COMMITTED);
        assertThat(outcome.cufe()).isEqualTo(cufe);
        assertThat(invoices.findHeaderByCufe(cufe).orElseThrow().getUrl()).isEqualTo(finalUrl);
    }

    @Test
    void shouldParkTimeoutWithoutStoringAnything() {
        String cufe = Fixtures.uniqueCufe();
        String url = Fixtures.qrUrl(cufe);
        when(fetcher.fetch(url)).thenThrow(
                new FetchFailedException(url, "request failed", new SocketTimeoutException("Read timed out")));

        IngestionOutcome outcome = service.ingest(command(url, 5L));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.FALLBACK_PENDING);
        assertThat(outcome.pendingId()).isNotNull();
        List<PendingRecoveryEntity> rows = pendingRows.findByUrlOrderByIdAsc(url);
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getErrorMessage()).startsWith("Scraping error: Fetch failed").contains("Read timed out");
            assertThat(row.getTypeDocument()).isEqualTo("QR_INVOICE");
            assertThat(row.getUserId()).isEqualTo(5L);
        });
        assertThat(invoices.findHeaderByCufe(cufe)).isEmpty();
        assertThat(processingLogRows.findByUrlOrderByIdAsc(url)).singleElement().satisfies(entry -> {
            assertThat(entry.getStatus()).isEqualTo("SCRAPING_ERROR");
            assertThat(entry.getErrorType()).isEqualTo("FETCH_FAILED");
            assertThat(entry.getErrorMessage()).startsWith("Scraping error: Fetch failed");
        });
    }

    @Test
    void shouldParkSubmissionWithVeryLongUrlAndChatId() {
        String cufe = Fixtures.uniqueCufe();
        String url = Fixtures.qrUrl(cufe) + "&pad=" + "a".repeat(2100);
        String chatId = "c".repeat(300);
        when(fetcher.fetch(url)).thenThrow(new FetchFailedException(url, "HTTP 404"));

        IngestionOutcome outcome = service.ingest(
                new SubmitInvoiceCommand(url, 8L, chatId, null, "telegram", OffsetDateTime.now()));

        assertThat(url).hasSizeGreaterThan(2048);
        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.FALLBACK_PENDING);
        assertThat(outcome.pendingId()).isNotNull();
        assertThat(outcome.reason()).doesNotContain("pending write failed");
        assertThat(pendingRows.findByUrlOrderByIdAsc(url)).singleElement().satisfies(row -> {
            assertThat(row.getUrl()).isEqualTo(url);
            assertThat(row.getChatId()).isEqualTo(chatId);
            assertThat(row.getWsId()).isEqualTo(chatId);
        });
        assertThat(processingLogRows.findByUrlOrderByIdAsc(url)).hasSize(1);
    }

    @Test
    void shouldParkMissingTotalAndStoreNothing() {
        String cufe = Fixtures.uniqueCufe();
        String url = Fixtures.qrUrl(cufe);
        servePage(url, Fixtures.invoicePage("dgi-invoice-missing-total.html", cufe));

        IngestionOutcome outcome = service.ingest(command(url, 6L));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.FALLBACK_PENDING);
        assertThat(pendingRows.findByUrlOrderByIdAsc(url)).singleElement()
                .satisfies(row -> assertThat(row.getErrorMessage()).contains("Normalization failed").contains("'total'"));
        assertThat(invoices.findHeaderByCufe(cufe)).isEmpty();
    }

    @Test
    void shouldParkSaveFailureAndLeaveNoPartialInvoice() {
        String cufe = Fixtures.uniqueCufe();
        String url = Fixtures.qrUrl(cufe);
        String html = Fixtures.invoicePage("dgi-invoice.html", cufe)
                .replace("SERVICIO DE CONSULTORIA", "X".repeat(1500));
        servePage(url, html);

        IngestionOutcome outcome = service.ingest(command(url, 7L));

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.FALLBACK_PENDING);
        assertThat(pendingRows.findByUrlOrderByIdAsc(url)).singleElement()
                .satisfies(row -> assertThat(row.getErrorMessage())
                        .startsWith("Save error: ")
                        .contains(" | normalized: ")
                        .contains(cufe));
        assertThat(invoices.findHeaderByCufe(cufe)).isEmpty();
        assertThat(detailRows.countByCufe(cufe)).isZero();
        assertThat(processingLogRows.findByUrlOrderByIdAsc(url)).singleElement().satisfies(entry -> {
            assertThat(entry.getStatus()).isEqualTo("DATABASE_ERROR");
            assertThat(entry.getErrorType()).isEqualTo("PERSISTENCE_FAILED");
        });
    }
}
