package com.lumis.invoiceingest.domain;

import java.math.BigDecimal;

public class InvoicePayment {

    private final String cufe;
    private final String paymentMethod;
    private final BigDecimal amountPaid;
    private final BigDecimal changeGiven;
    private final BigDecimal totalPaid;

    public InvoicePayment(String cufe, String paymentMethod, BigDecimal amountPaid, BigDecimal changeGiven, BigDecimal totalPaid) {
        this.cufe = cufe;
        this.paymentMethod = paymentMethod;
        this.amountPaid = amountPaid;
        this.changeGiven = changeGiven;
        this.totalPaid = totalPaid;
    }

    public String getCufe() { return cufe; }
    public String getPaymentMethod() { return paymentMethod; }
    public BigDecimal getAmountPaid() { return amountPaid; }
    public BigDecimal getChangeGiven() { return changeGiven; }
    public BigDecimal getTotalPaid() { return totalPaid; }
}
