package com.lumis.invoiceingest.domain;

import java.util.*;

/**
 * Raw field bag produced by reading the confirmation page.
 * <p>
 * Nothing here is interpreted: values are the trimmed text of the page. Blank values are never
 * stored, so a field is either present with content or absent. Deciding which fields are
 * mandatory is the normalizer's job.
 */
public class ExtractedData {

    public static final String CUFE = "cufe";
    public static final String INVOICE_NUMBER = "no";
    public static final String DATE = "date";
    public static final String DOCUMENT_TITLE = "document_title";
    public static final String ISSUER_NAME = "emisor_name";
    public static final String ISSUER_RUC = "emisor_ruc";
    public static final String ISSUER_DV = "emisor_dv";
    public static final String ISSUER_ADDRESS = "emisor_address";
    public static final String ISSUER_PHONE = "emisor_phone";
    public static final String RECEPTOR_NAME = "receptor_name";
    public static final String RECEPTOR_RUC = "receptor_ruc";
    public static final String TOTAL_AMOUNT = "tot_amount";
    public static final String TOTAL_ITBMS = "tot_itbms";
    public static final String CHANGE_GIVEN = "vuelto";
    public static final String TOTAL_PAID = "total_pagado";

    private final Map<String, String> header = new LinkedHashMap<>();
    private final List<Map<String, String>> details = new ArrayList<>();
    private final List<Map<String, String>> payments = new ArrayList<>();

    public void put(String field, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        header.put(field, value.trim());
    }

    public Optional<String> field(String field) {
        return Optional.ofNullable(header.get(field));
    }

    public boolean has(String field) {
        return header.containsKey(field);
    }

    public void addDetail(Map<String, String> detail) {
        details.add(withoutBlanks(detail));
    }

    public void addPayment(Map<String, String> payment) {
        payments.add(withoutBlanks(payment));
    }

    public Map<String, String> getHeader() {
        return Collections.unmodifiableMap(header);
    }

    public List<Map<String, String>> getDetails() {
        return Collections.unmodifiableList(details);
    }

    public List<Map<String, String>> getPayments() {
        return Collections.unmodifiableList(payments);
    }

    private static Map<String, String> withoutBlanks(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                copy.put(key, value.trim());
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "ExtractedData{" +
                "headerFields=" + header.keySet() +
                ", details=" + details.size() +
                ", payments=" + payments.size() +
                '}';
    }
}
