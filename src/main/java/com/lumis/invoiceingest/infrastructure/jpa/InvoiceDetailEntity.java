package com.lumis.invoiceingest.infrastructure.jpa;

import jakarta.persistence.*;

import java.math.BigDecimal;

@Entity
@Table(name = "invoice_detail")
public class InvoiceDetailEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "partkey", nullable = false)
    private String partkey;

    @Column(name = "cufe", nullable = false)
    private String cufe;

    @Column(name = "linea")
    private String linea;

    @Column(name = "code")
    private String code;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "quantity", precision = 18, scale = 6)
    private BigDecimal quantity;

    @Column(name = "unit_price", precision = 18, scale = 6)
    private BigDecimal unitPrice;

    @Column(name = "unit_discount", precision = 18, scale = 6)
    private BigDecimal unitDiscount;

    @Column(name = "amount", precision = 18, scale = 6)
    private BigDecimal amount;

    @Column(name = "itbms", precision = 18, scale = 6)
    private BigDecimal itbms;

    @Column(name = "total", precision = 18, scale = 6)
    private BigDecimal total;

    @Column(name = "information_of_interest", length = 1000)
    private String informationOfInterest;

    public InvoiceDetailEntity() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getPartkey() { return partkey; }
    public void setPartkey(String partkey) { this.partkey = partkey; }

    public String getCufe() { return cufe; }
    public void setCufe(String cufe) { this.cufe = cufe; }

    public String getLinea() { return linea; }
    public void setLinea(String linea) { this.linea = linea; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public BigDecimal getQuantity() { return quantity; }
    public void setQuantity(BigDecimal quantity) { this.quantity = quantity; }

    public BigDecimal getUnitPrice() { return unitPrice; }
    public void setUnitPrice(BigDecimal unitPrice) { this.unitPrice = unitPrice; }

    public BigDecimal getUnitDiscount() { return unitDiscount; }
    public void setUnitDiscount(BigDecimal unitDiscount) { this.unitDiscount = unitDiscount; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public BigDecimal getItbms() { return itbms; }
    public void setItbms(BigDecimal itbms) { this.itbms = itbms; }

    public BigDecimal getTotal() { return total; }
    public void setTotal(BigDecimal total) { this.total = total; }

    public String getInformationOfInterest() { return informationOfInterest; }
    public void setInformationOfInterest(String informationOfInterest) { this.informationOfInterest = informationOfInterest; }
}
