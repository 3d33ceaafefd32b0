package com.lumis.invoiceingest.infrastructure.parser;

import com.lumis.invoiceingest.application.InvoiceIngestionService;
import com.lumis.invoiceingest.domain.ExtractedData;
import com.lumis.invoiceingest.exception.ExtractionFailedException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the fields of a DGI electronic invoice confirmation page.
 * <p>
 * Every field is located from a structural anchor of the page template (headings, definition
 * lists, labelled table cells) and is independently optional. The only hard requirement is the
 * {@code FACTURA} heading that identifies the template.
 */
@Component
public class JsoupInvoiceExtractor implements InvoiceIngestionService.InvoiceExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsoupInvoiceExtractor.class);

    private static final String[] PORTAL_ERROR_SELECTORS = {
            "div.alert-danger",
            "div.alert-warning",
            "div.alert-error",
            "#validacionMensajeCriterioResultado",
            "#cuerpoVentanaMensajes",
            ".error-message",
            ".validation-summary-errors",
            ".field-validation-error"
    };

    private static final String[] PORTAL_ERROR_PHRASES = {
            "factura no encontrada",
            "cufe no encontrado",
            "documento no existe",
            "no se pudo procesar",
            "acceso denegado",
            "página no encontrada",
            "error interno",
            "servicio no disponible",
            "servidor no disponible",
            "sesión expirada",
            "error de conexión"
    };

    private static final Pattern INVOICE_NUMBER_LABELLED = Pattern.compile("(?i)No\\.\\s*(\\d+)");
    private static final Pattern INVOICE_NUMBER_BARE = Pattern.compile("\\d{10}");
    private static final Pattern DATE_TIME = Pattern.compile("\\d{2}/\\d{2}/\\d{4} \\d{2}:\\d{2}:\\d{2}");
    private static final Pattern DATE_ONLY = Pattern.compile("\\d{2}/\\d{2}/\\d{4}");

    private static final int ROW_SEARCH_DEPTH = 3;
    private static final int MIN_CUFE_LENGTH = 50;

    // Keys are accent-free lower case, see normalizeLabel
    private static final Map<String, String> PANEL_FIELDS = Map.of(
            "nombre", "name",
            "ruc", "ruc",
            "cedula de identidad", "ruc",
            "dv", "dv",
            "direccion", "address",
            "telefono", "phone"
    );

    private static final Map<String, String> LINE_ITEM_FIELDS = Map.of(
            "cantidad", "quantity",
            "codigo", "code",
            "descripcion", "description",
            "descuento", "unit_discount",
            "precio", "unit_price",
            "impuesto", "itbms",
            "informacion de interes", "information_of_interest",
            "monto", "amount",
            "total", "total",
            "linea", "linea"
    );

    private static final Map<String, String> PAYMENT_FIELDS = Map.of(
            "forma de pago", "forma_de_pago",
            "valor pago", "valor_pago"
    );

    @Override
    public ExtractedData extract(String html) {
        if (html == null || html.isBlank()) {
            throw new ExtractionFailedException("empty document");
        }
        Document doc = Jsoup.parse(html);

        detectPortalError(doc).ifPresent(message -> {
            log.warn("DGI portal returned an error page: {}", message);
            throw new ExtractionFailedException("MEF portal error: " + message);
        });

        Element anchor = findInvoiceHeading(doc)
                .orElseThrow(() -> new ExtractionFailedException("no FACTURA heading, page does not match the invoice template"));

        ExtractedData data = new ExtractedData();
        data.put(ExtractedData.DOCUMENT_TITLE, anchor.text());

        findHeadingRow(anchor).ifPresent(row -> {
            data.put(ExtractedData.INVOICE_NUMBER, extractInvoiceNumber(row));
            data.put(ExtractedData.DATE, extractDate(row));
        });
        data.put(ExtractedData.CUFE, extractCufe(doc));
        extractPanel(doc, "EMISOR", "emisor", data);
        extractPanel(doc, "RECEPTOR", "receptor", data);
        extractTotals(doc, data);

        try {
            extractTableRows(doc, data);
        } catch (RuntimeException e) {
            throw new ExtractionFailedException("line items could not be read: " + e.getMessage(), e);
        }

        if (data.getDetails().isEmpty()) {
            log.warn("No line items found on invoice page (cufe: {})", data.field(ExtractedData.CUFE).orElse("?"));
        }
        log.debug("Extracted header fields: {}", data.getHeader());
        return data;
    }

    private Optional<String> detectPortalError(Document doc) {
        for (String selector : PORTAL_ERROR_SELECTORS) {
            for (Element element : doc.select(selector)) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        // text() skips script bodies
        String text = doc.body() != null ? doc.body().text().toLowerCase(Locale.ROOT) : "";
        for (String phrase : PORTAL_ERROR_PHRASES) {
            if (text.contains(phrase)) {
                return Optional.of("page reports '" + phrase + "'");
            }
        }
        return Optional.empty();
    }

    private Optional<Element> findInvoiceHeading(Document doc) {
        return doc.select("h4").stream()
                .filter(h4 -> h4.text().toUpperCase(Locale.ROOT).contains("FACTURA"))
                .findFirst();
    }

    private Optional<Element> findHeadingRow(Element anchor) {
        Element current = anchor.parent();
        for (int i = 0; i < ROW_SEARCH_DEPTH && current != null; i++) {
            if (current.className().contains("row")) {
                return Optional.of(current);
            }
            current = current.parent();
        }
        log.debug("FACTURA heading has no row container within {} levels", ROW_SEARCH_DEPTH);
        return Optional.empty();
    }

    private String extractInvoiceNumber(Element row) {
        for (Element h5 : row.select("h5")) {
            String text = h5.text().trim();
            Matcher labelled = INVOICE_NUMBER_LABELLED.matcher(text);
            if (labelled.find()) {
                return labelled.group(1);
            }
            if (INVOICE_NUMBER_BARE.matcher(text).matches()) {
                return text;
            }
        }
        return null;
    }

    private String extractDate(Element row) {
        for (Element h5 : row.select("h5")) {
            String text = h5.text().trim();
            Matcher dateTime = DATE_TIME.matcher(text);
            if (dateTime.find()) {
                return dateTime.group();
            }
            if (DATE_ONLY.matcher(text).matches()) {
                return text + " 00:00:00";
            }
        }
        return null;
    }

    private String extractCufe(Document doc) {
        for (Element dt : doc.select("dt")) {
            String label = dt.text().toUpperCase(Locale.ROOT);
            if (!label.contains("CÓDIGO ÚNICO") || !label.contains("CUFE")) {
                continue;
            }
            Element dd = dt.nextElementSibling();
            if (dd == null || !"dd".equals(dd.tagName())) {
                continue;
            }
            String value = dd.text().trim();
            if (value.startsWith("FE") && value.length() > MIN_CUFE_LENGTH) {
                return value;
            }
            log.debug("Ignoring CUFE candidate that does not look like one: '{}'", value);
        }
        return null;
    }

    private void extractPanel(Document doc, String title, String prefix, ExtractedData data) {
        for (Element heading : doc.select("div.panel-heading")) {
            if (!heading.text().toUpperCase(Locale.ROOT).contains(title)) {
                continue;
            }
            Element body = heading.nextElementSibling();
            while (body != null && !body.hasClass("panel-body")) {
                body = body.nextElementSibling();
            }
            if (body == null) {
                continue;
            }
            for (Element dt : body.select("dt")) {
                Element dd = dt.nextElementSibling();
                if (dd == null || !"dd".equals(dd.tagName())) {
                    continue;
                }
                String label = normalizeLabel(dt.text());
                String suffix = PANEL_FIELDS.getOrDefault(label, label.replace(' ', '_'));
                data.put(prefix + "_" + suffix, dd.text());
            }
            return;
        }
        log.debug("Panel {} not found", title);
    }

    private void extractTotals(Document doc, ExtractedData data) {
        for (Element td : doc.select("td.text-right")) {
            Element div = td.selectFirst("div");
            if (div == null) {
                continue;
            }
            String text = td.text().toUpperCase(Locale.ROOT);
            String value = div.text();
            if (text.contains("VALOR TOTAL:")) {
                data.put(ExtractedData.TOTAL_AMOUNT, value);
            } else if (text.contains("ITBMS TOTAL:")) {
                data.put(ExtractedData.TOTAL_ITBMS, value);
            } else if (text.contains("VUELTO:")) {
                data.put(ExtractedData.CHANGE_GIVEN, value);
            } else if (text.contains("TOTAL PAGADO:")) {
                data.put(ExtractedData.TOTAL_PAID, value);
            }
        }
    }

    private void extractTableRows(Document doc, ExtractedData data) {
        Elements rows = doc.select("div.panel-body.collapse.in tbody tr");
        if (rows.isEmpty()) {
            rows = doc.select("tbody tr:has(td[data-title])");
        }
        for (Element row : rows) {
            Map<String, String> item = new LinkedHashMap<>();
            Map<String, String> payment = new LinkedHashMap<>();
            for (Element td : row.select("td[data-title]")) {
                String label = normalizeLabel(td.attr("data-title"));
                String paymentKey = PAYMENT_FIELDS.get(label);
                if (paymentKey != null) {
                    payment.put(paymentKey, td.text());
                } else {
                    item.put(LINE_ITEM_FIELDS.getOrDefault(label, label.replace(' ', '_')), td.text());
                }
            }
            if (!payment.isEmpty()) {
                data.addPayment(payment);
            } else if (!item.isEmpty()) {
                data.addDetail(item);
            }
        }
    }

    static String normalizeLabel(String label) {
        String decomposed = Normalizer.normalize(label.trim(), Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "")
                .replace(":", "")
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
    }
}
