package com.lumis.invoiceingest.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

public class InvoiceHeader {

    private final String cufe;
    private final String invoiceNumber;
    private final LocalDateTime issueDate;
    private final String issuerName;
    private final String issuerRuc;
    private final String issuerDv;
    private final String issuerAddress;
    private final String issuerPhone;
    private final String receptorName;
    private final String receptorRuc;
    private final BigDecimal totAmount;
    private final BigDecimal totItbms;
    private final String url;
    private final InvoiceType type;
    private final Long userId;
    private final String source;
    private final OffsetDateTime processDate;
    private final OffsetDateTime receptionDate;

    public InvoiceHeader(String cufe, String invoiceNumber, LocalDateTime issueDate, String issuerName, String issuerRuc,
                         String issuerDv, String issuerAddress, String issuerPhone, String receptorName, String receptorRuc,
                         BigDecimal totAmount, BigDecimal totItbms, String url, InvoiceType type, Long userId, String source,
                         OffsetDateTime processDate, OffsetDateTime receptionDate) {
        this.cufe = cufe;
        this.invoiceNumber = invoiceNumber;
        this.issueDate = issueDate;
        this.issuerName = issuerName;
        this.issuerRuc = issuerRuc;
        this.issuerDv = issuerDv;
        this.issuerAddress = issuerAddress;
        this.issuerPhone = issuerPhone;
        this.receptorName = receptorName;
        this.receptorRuc = receptorRuc;
        this.totAmount = totAmount;
        this.totItbms = totItbms;
        this.url = url;
        this.type = type;
        this.userId = userId;
        this.source = source;
        this.processDate = processDate;
        this.receptionDate = receptionDate;
    }

    public String getCufe() {
        return cufe;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public LocalDateTime getIssueDate() {
        return issueDate;
    }

    public String getIssuerName() {
        return issuerName;
    }

    public String getIssuerRuc() {
        return issuerRuc;
    }

    public String getIssuerDv() {
        return issuerDv;
    }

    public String getIssuerAddress() {
        return issuerAddress;
    }

    public String getIssuerPhone() {
        return issuerPhone;
    }

    public String getReceptorName() {
        return receptorName;
    }

    public String getReceptorRuc() {
        return receptorRuc;
    }

    public BigDecimal getTotAmount() {
        return totAmount;
    }

    public BigDecimal getTotItbms() {
        return totItbms;
    }

    public String getUrl() {
        return url;
    }

    public InvoiceType getType() {
        return type;
    }

    public Long getUserId() {
        return userId;
    }

    public String getSource() {
        return source;
    }

    public OffsetDateTime getProcessDate() {
        return processDate;
    }

    public OffsetDateTime getReceptionDate() {
        return receptionDate;
    }
}
