package com.lumis.invoiceingest.domain;

import java.math.BigDecimal;

/**
 * One line item. Amounts are kept exactly as the document states them;
 * {@code total} is expected to equal {@code amount + itbms} up to the issuer's own rounding.
 */
public class InvoiceDetail {

    private final String partkey;
    private final String cufe;
    private final String linea;
    private final String code;
    private final String description;
    private final BigDecimal quantity;
    private final BigDecimal unitPrice;
    private final BigDecimal unitDiscount;
    private final BigDecimal amount;
    private final BigDecimal itbms;
    private final BigDecimal total;
    private final String informationOfInterest;

    public InvoiceDetail(String partkey, String cufe, String linea, String code, String description, BigDecimal quantity,
                         BigDecimal unitPrice, BigDecimal unitDiscount, BigDecimal amount, BigDecimal itbms, BigDecimal total,
                         String informationOfInterest) {
        this.partkey = partkey;
        this.cufe = cufe;
        this.linea = linea;
        this.code = code;
        this.description = description;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.unitDiscount = unitDiscount;
        this.amount = amount;
        this.itbms = itbms;
        this.total = total;
        this.informationOfInterest = informationOfInterest;
    }

    public String getPartkey() { return partkey; }
    public String getCufe() { return cufe; }
    public String getLinea() { return linea; }
    public String getCode() { return code; }
    public String getDescription() { return description; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getUnitPrice() { return unitPrice; }
    public BigDecimal getUnitDiscount() { return unitDiscount; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getItbms() { return itbms; }
    public BigDecimal getTotal() { return total; }
    public String getInformationOfInterest() { return informationOfInterest; }
}
