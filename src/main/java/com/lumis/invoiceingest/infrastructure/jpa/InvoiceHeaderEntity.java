package com.lumis.invoiceingest.infrastructure.jpa;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Header row keyed by CUFE. The id is assigned by the caller, so {@link #isNew()} tells Spring Data
 * to always INSERT a fresh instance; an existing CUFE then fails on the primary key instead of
 * being silently merged over.
 */
@Entity
@Table(name = "invoice_header")
public class InvoiceHeaderEntity implements Persistable<String> {

    @Id
    @Column(name = "cufe", nullable = false, updatable = false)
    private String cufe;

    @Column(name = "invoice_number")
    private String invoiceNumber;

    @Column(name = "issue_date")
    private LocalDateTime issueDate;

    @Column(name = "issuer_name")
    private String issuerName;

    @Column(name = "issuer_ruc")
    private String issuerRuc;

    @Column(name = "issuer_dv")
    private String issuerDv;

    @Column(name = "issuer_address")
    private String issuerAddress;

    @Column(name = "issuer_phone")
    private String issuerPhone;

    @Column(name = "receptor_name")
    private String receptorName;

    @Column(name = "receptor_ruc")
    private String receptorRuc;

    @Column(name = "tot_amount", precision = 18, scale = 2)
    private BigDecimal totAmount;

    @Column(name = "tot_itbms", precision = 18, scale = 2)
    private BigDecimal totItbms;

    @Column(name = "url")
    private String url;

    @Column(name = "invoice_type")
    private String invoiceType;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "source")
    private String source;

    @Column(name = "process_date")
    private OffsetDateTime processDate;

    @Column(name = "reception_date")
    private OffsetDateTime receptionDate;

    @Transient
    private boolean isNew = true;

    public InvoiceHeaderEntity() {}

    @Override
    public String getId() { return cufe; }

    @Override
    public boolean isNew() { return isNew; }

    @PostLoad
    @PostPersist
    void markNotNew() { this.isNew = false; }

    public String getCufe() { return cufe; }
    public void setCufe(String cufe) { this.cufe = cufe; }

    public String getInvoiceNumber() { return invoiceNumber; }
    public void setInvoiceNumber(String invoiceNumber) { this.invoiceNumber = invoiceNumber; }

    public LocalDateTime getIssueDate() { return issueDate; }
    public void setIssueDate(LocalDateTime issueDate) { this.issueDate = issueDate; }

    public String getIssuerName() { return issuerName; }
    public void setIssuerName(String issuerName) { this.issuerName = issuerName; }

    public String getIssuerRuc() { return issuerRuc; }
    public void setIssuerRuc(String issuerRuc) { this.issuerRuc = issuerRuc; }

    public String getIssuerDv() { return issuerDv; }
    public void setIssuerDv(String issuerDv) { this.issuerDv = issuerDv; }

    public String getIssuerAddress() { return issuerAddress; }
    public void setIssuerAddress(String issuerAddress) { this.issuerAddress = issuerAddress; }

    public String getIssuerPhone() { return issuerPhone; }
    public void setIssuerPhone(String issuerPhone) { this.issuerPhone = issuerPhone; }

    public String getReceptorName() { return receptorName; }
    public void setReceptorName(String receptorName) { this.receptorName = receptorName; }

    public String getReceptorRuc() { return receptorRuc; }
    public void setReceptorRuc(String receptorRuc) { this.receptorRuc = receptorRuc; }

    public BigDecimal getTotAmount() { return totAmount; }
    public void setTotAmount(BigDecimal totAmount) { this.totAmount = totAmount; }

    public BigDecimal getTotItbms() { return totItbms; }
    public void setTotItbms(BigDecimal totItbms) { this.totItbms = totItbms; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getInvoiceType() { return invoiceType; }
    public void setInvoiceType(String invoiceType) { this.invoiceType = invoiceType; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public OffsetDateTime getProcessDate() { return processDate; }
    public void setProcessDate(OffsetDateTime processDate) { this.processDate = processDate; }

    public OffsetDateTime getReceptionDate() { return receptionDate; }
    public void setReceptionDate(OffsetDateTime receptionDate) { this.receptionDate = receptionDate; }

    @Override
    public String toString() {
        return "InvoiceHeaderEntity{" +
                "cufe='" + cufe + '\'' +
                ", invoiceNumber='" + invoiceNumber + '\'' +
                ", issuerName='" + issuerName + '\'' +
                ", totAmount=" + totAmount +
                ", invoiceType='" + invoiceType + '\'' +
                ", userId=" + userId +
                '}';
    }
}
