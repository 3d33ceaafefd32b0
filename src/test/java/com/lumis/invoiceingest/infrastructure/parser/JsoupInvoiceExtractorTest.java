package com.lumis.invoiceingest.infrastructure.parser;

import com.lumis.invoiceingest.Fixtures;
import com.lumis.invoiceingest.domain.ExtractedData;
import com.lumis.invoiceingest.exception.ExtractionFailedException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupInvoiceExtractorTest {

    private final JsoupInvoiceExtractor extractor = new JsoupInvoiceExtractor();

    @Test
    void shouldExtractHeaderFieldsFromConfirmationPage() {
        ExtractedData data = extractor.extract(Fixtures.html("dgi-invoice.html"));

        assertThat(data.field(ExtractedData.CUFE)).contains(Fixtures.CUFE);
        assertThat(data.field(ExtractedData.INVOICE_NUMBER)).contains("0031157014");
        assertThat(data.field(ExtractedData.DATE)).contains("15/05/2025 09:50:04");
        assertThat(data.field(ExtractedData.DOCUMENT_TITLE)).contains("FACTURA DE OPERACIÓN INTERNA");
        assertThat(data.field(ExtractedData.TOTAL_AMOUNT)).contains("107.00");
        assertThat(data.field(ExtractedData.TOTAL_ITBMS)).contains("7.00");
        assertThat(data.field(ExtractedData.CHANGE_GIVEN)).contains("3.00");
        assertThat(data.field(ExtractedData.TOTAL_PAID)).contains("110.00");
    }

    @Test
    void shouldMapIssuerAndReceptorPanels() {
        ExtractedData data = extractor.extract(Fixtures.html("dgi-invoice.html"));

        assertThat(data.field(ExtractedData.ISSUER_NAME)).contains("Lum Corporation");
        assertThat(data.field(ExtractedData.ISSUER_RUC)).contains("2679372-1-844");
        assertThat(data.field(ExtractedData.ISSUER_DV)).contains("50");
        assertThat(data.field(ExtractedData.ISSUER_ADDRESS)).contains("Calle 50, Ciudad de Panamá");
        assertThat(data.field(ExtractedData.ISSUER_PHONE)).contains("507-2600000");
        assertThat(data.field(ExtractedData.RECEPTOR_NAME)).contains("Cliente Contado");
        assertThat(data.field(ExtractedData.RECEPTOR_RUC)).contains("8-888-8888");
    }

    @Test
    void shouldSplitLineItemsFromPaymentRows() {
        ExtractedData data = extractor.extract(Fixtures.html("dgi-invoice.html"));

        assertThat(data.getDetails()).hasSize(1);
        Map<String, String> item = data.getDetails().get(0);
        assertThat(item)
                .containsEntry("linea", "1")
                .containsEntry("code", "7501031311309")
                .containsEntry("description", "SERVICIO DE CONSULTORIA")
                .containsEntry("quantity", "1.00")
                .containsEntry("unit_price", "100.00")
                .containsEntry("unit_discount", "0.00")
                .containsEntry("amount", "100.00")
                .containsEntry("itbms", "7.00")
                .containsEntry("total", "107.00")
                .doesNotContainKey("information_of_interest");

        assertThat(data.getPayments()).hasSize(1);
        assertThat(data.getPayments().get(0))
                .containsEntry("forma_de_pago", "Efectivo")
                .containsEntry("valor_pago", "110.00");
    }

    @Test
    void shouldReturnNoDetailsWhenTableIsEmpty() {
        ExtractedData data = extractor.extract(Fixtures.html("dgi-invoice-no-items.html"));

        assertThat(data.getDetails()).isEmpty();
        assertThat(data.field(ExtractedData.CUFE)).isPresent();
    }

    @Test
    void shouldLeaveMissingFieldsAbsent() {
        ExtractedData missingTotal = extractor.extract(Fixtures.html("dgi-invoice-missing-total.html"));
        ExtractedData missingCufe = extractor.extract(Fixtures.html("dgi-invoice-no-cufe.html"));

        assertThat(missingTotal.has(ExtractedData.TOTAL_AMOUNT)).isFalse();
        assertThat(missingTotal.field(ExtractedData.ISSUER_NAME)).contains("Lum Corporation");
        assertThat(missingCufe.field(ExtractedData.CUFE)).isEmpty();
    }

    @Test
    void shouldAppendMidnightToDateWithoutTime() {
        String html = "<div class=\"row\"><div><h4>FACTURA</h4></div><div><h5>0000181356</h5><h5>01/02/2025</h5></div></div>";

        ExtractedData data = extractor.extract(html);

        assertThat(data.field(ExtractedData.INVOICE_NUMBER)).contains("0000181356");
        assertThat(data.field(ExtractedData.DATE)).contains("01/02/2025 00:00:00");
    }

    @Test
    void shouldIgnoreShortCufeCandidate() {
        String html = "<h4>FACTURA</h4><dl><dt>CÓDIGO ÚNICO DE FACTURA ELECTRÓNICA (CUFE)</dt><dd>FE123</dd></dl>";

        assertThat(extractor.extract(html).field(ExtractedData.CUFE)).isEmpty();
    }

    @Test
    void shouldReportPortalErrorPage() {
        assertThatThrownBy(() -> extractor.extract(Fixtures.html("mef-error.html")))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageStartingWith("Extraction failed: MEF portal error")
                .hasMessageContaining("no se encuentra registrada");
    }

    @Test
    void shouldDetectPortalErrorPhraseInBody() {
        String html = "<html><body><h4>FACTURA</h4><p>Servicio no disponible, intente más tarde</p></body></html>";

        assertThatThrownBy(() -> extractor.extract(html))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("servicio no disponible");
    }

    @Test
    void shouldRejectPageWithoutInvoiceHeading() {
        assertThatThrownBy(() -> extractor.extract("<html><body><h1>Bienvenido</h1></body></html>"))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessageContaining("FACTURA");
    }

    @Test
    void shouldNormalizeAccentedLabels() {
        assertThat(JsoupInvoiceExtractor.normalizeLabel(" Información de  interés: ")).isEqualTo("informacion de interes");
        assertThat(JsoupInvoiceExtractor.normalizeLabel("TELÉFONO")).isEqualTo("telefono");
    }
}
