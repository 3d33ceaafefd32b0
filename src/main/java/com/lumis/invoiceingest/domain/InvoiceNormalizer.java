package com.lumis.invoiceingest.domain;

import com.lumis.invoiceingest.exception.NormalizationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw field bag read from a confirmation page into the typed invoice model.
 * <p>
 * This is the only place that decides which fields are mandatory. Money is parsed into
 * {@link BigDecimal} straight from the page text and never passes through a binary float.
 */
public class InvoiceNormalizer {

    private static final Logger log = LoggerFactory.getLogger(InvoiceNormalizer.class);

    /** DGI prints dates as day/month/year; no other ordering is accepted. */
    public static final DateTimeFormatter DGI_DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    public static final String NO_LINE_ITEMS = "NO_LINE_ITEMS";
    public static final String LINE_TOTAL_MISMATCH = "LINE_TOTAL_MISMATCH";

    private static final Pattern CUFE_URL_PARAM = Pattern.compile("[?&]chFE=([^&#]+)");
    private static final BigDecimal LINE_ROUNDING_TOLERANCE = new BigDecimal("0.01");
    private static final List<String> DETAIL_AMOUNT_FIELDS = List.of("quantity", "unit_price", "amount", "itbms", "total");

    private final Clock clock;

    public InvoiceNormalizer() {
        this(Clock.systemUTC());
    }

    public InvoiceNormalizer(Clock clock) {
        this.clock = clock;
    }

    public NormalizedInvoice normalize(ExtractedData data, String finalUrl, Long userId, String source,
                                       OffsetDateTime receivedAt) {
        log.debug("Normalizing {} from {}", data, finalUrl);

        String cufe = data.field(ExtractedData.CUFE)
                .or(() -> cufeFromUrl(finalUrl))
                .orElseThrow(() -> new NormalizationFailedException("cufe", "not present on the page nor in the URL"));
        String issuerName = require(data, ExtractedData.ISSUER_NAME, "issuer_name");
        String invoiceNumber = require(data, ExtractedData.INVOICE_NUMBER, "no");
        LocalDateTime issueDate = parseDate(require(data, ExtractedData.DATE, "date"));
        BigDecimal totAmount = parseMoney(require(data, ExtractedData.TOTAL_AMOUNT, "total"), "total");
        BigDecimal totItbms = data.field(ExtractedData.TOTAL_ITBMS)
                .map(value -> parseMoney(value, "tot_itbms"))
                .orElse(null);

        OffsetDateTime processDate = OffsetDateTime.now(clock);
        InvoiceType type = classify(finalUrl);

        InvoiceHeader header = new InvoiceHeader(
                cufe,
                invoiceNumber,
                issueDate,
                issuerName,
                data.field(ExtractedData.ISSUER_RUC).orElse(null),
                data.field(ExtractedData.ISSUER_DV).orElse(null),
                data.field(ExtractedData.ISSUER_ADDRESS).orElse(null),
                data.field(ExtractedData.ISSUER_PHONE).orElse(null),
                data.field(ExtractedData.RECEPTOR_NAME).orElse(null),
                data.field(ExtractedData.RECEPTOR_RUC).orElse(null),
                totAmount,
                totItbms,
                finalUrl,
                type,
                userId,
                source,
                processDate,
                receivedAt != null ? receivedAt : processDate
        );

        List<String> warnings = new ArrayList<>();
        List<InvoiceDetail> details = normalizeDetails(cufe, data.getDetails(), warnings);
        if (details.isEmpty()) {
            log.warn("Invoice {} lists no line items", cufe);
            warnings.add(NO_LINE_ITEMS);
        }
        List<InvoicePayment> payments = normalizePayments(cufe, data);

        log.info("Normalized invoice {} - issuer: '{}', no: {}, date: {}, total: {}, itbms: {}, type: {}, details: {}, payments: {}",
                cufe, issuerName, invoiceNumber, issueDate, totAmount, totItbms, type, details.size(), payments.size());

        return new NormalizedInvoice(header, details, payments, warnings);
    }

    public InvoiceType classify(String finalUrl) {
        if (finalUrl == null) {
            return InvoiceType.GENERIC;
        }
        String lower = finalUrl.toLowerCase(Locale.ROOT);
        if (lower.contains("facturasporqr")) {
            return InvoiceType.QR;
        }
        if (lower.contains("facturasporcufe") || CUFE_URL_PARAM.matcher(finalUrl).find()) {
            return InvoiceType.CUFE;
        }
        return InvoiceType.GENERIC;
    }

    public static LocalDateTime parseDate(String raw) {
        try {
            return LocalDateTime.parse(raw.trim(), DGI_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new NormalizationFailedException("date", "expected dd/MM/yyyy HH:mm:ss but was '" + raw + "'", e);
        }
    }

    /**
     * Parses a header amount: at most two fractional digits, returned with scale 2.
     */
    public static BigDecimal parseMoney(String raw, String field) {
        BigDecimal value = parseDecimal(raw, field);
        if (value.stripTrailingZeros().scale() > 2) {
            throw new NormalizationFailedException(field, "more than two decimal places in '" + raw + "'");
        }
        return value.setScale(2);
    }

    /**
     * Parses a line amount exactly as printed, without forcing a scale.
     */
    public static BigDecimal parseDecimal(String raw, String field) {
        String cleaned = raw.replace("B/.", "")
                .replace("$", "")
                .replace(",", "")
                .replaceAll("\\s+", "");
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new NormalizationFailedException(field, "not a decimal amount: '" + raw + "'", e);
        }
    }

    private List<InvoiceDetail> normalizeDetails(String cufe, List<Map<String, String>> rows, List<String> warnings) {
        List<InvoiceDetail> details = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String prefix = "details[" + i + "].";

            boolean hasAmounts = DETAIL_AMOUNT_FIELDS.stream().anyMatch(row::containsKey);
            if (!row.containsKey("description") && !hasAmounts) {
                log.debug("Dropping blank line item #{} of invoice {}: {}", i + 1, cufe, row);
                continue;
            }

            String linea = row.getOrDefault("linea", String.valueOf(i + 1));
            BigDecimal amount = optionalDecimal(row, "amount", prefix);
            BigDecimal itbms = optionalDecimal(row, "itbms", prefix);
            BigDecimal total = optionalDecimal(row, "total", prefix);

            if (amount != null && itbms != null && total != null
                    && amount.add(itbms).subtract(total).abs().compareTo(LINE_ROUNDING_TOLERANCE) > 0) {
                log.warn("Line {} of invoice {} does not add up: amount {} + itbms {} != total {}",
                        linea, cufe, amount, itbms, total);
                warnings.add(LINE_TOTAL_MISMATCH + ":" + linea);
            }

            details.add(new InvoiceDetail(
                    cufe + "_" + linea,
                    cufe,
                    linea,
                    row.get("code"),
                    row.get("description"),
                    optionalDecimal(row, "quantity", prefix),
                    optionalDecimal(row, "unit_price", prefix),
                    optionalDecimal(row, "unit_discount", prefix),
                    amount,
                    itbms,
                    total,
                    row.get("information_of_interest")
            ));
        }
        return details;
    }

    private List<InvoicePayment> normalizePayments(String cufe, ExtractedData data) {
        BigDecimal changeGiven = data.field(ExtractedData.CHANGE_GIVEN)
                .map(value -> parseMoney(value, ExtractedData.CHANGE_GIVEN))
                .orElse(null);
        BigDecimal totalPaid = data.field(ExtractedData.TOTAL_PAID)
                .map(value -> parseMoney(value, ExtractedData.TOTAL_PAID))
                .orElse(null);

        List<InvoicePayment> payments = new ArrayList<>();
        List<Map<String, String>> rows = data.getPayments();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String method = row.get("forma_de_pago");
            BigDecimal amountPaid = row.containsKey("valor_pago")
                    ? parseMoney(row.get("valor_pago"), "payments[" + i + "].valor_pago")
                    : null;
            if (method == null && amountPaid == null) {
                continue;
            }
            payments.add(new InvoicePayment(cufe, method, amountPaid, changeGiven, totalPaid));
        }

        if (payments.isEmpty() && (changeGiven != null || totalPaid != null)) {
            payments.add(new InvoicePayment(cufe, null, null, changeGiven, totalPaid));
        }
        return payments;
    }

    private static BigDecimal optionalDecimal(Map<String, String> row, String key, String prefix) {
        String raw = row.get(key);
        return raw == null ? null : parseDecimal(raw, prefix + key);
    }

    private static String require(ExtractedData data, String key, String field) {
        return data.field(key)
                .orElseThrow(() -> new NormalizationFailedException(field, "missing"));
    }

    static Optional<String> cufeFromUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher m = CUFE_URL_PARAM.matcher(url);
        if (!m.find()) {
            return Optional.empty();
        }
        String cufe = URLDecoder.decode(m.group(1), StandardCharsets.UTF_8).trim();
        if (cufe.isEmpty()) {
            return Optional.empty();
        }
        log.info("CUFE not on the page, taken from the resolved URL: {}", cufe);
        return Optional.of(cufe);
    }
}
