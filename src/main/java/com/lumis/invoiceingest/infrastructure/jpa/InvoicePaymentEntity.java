package com.lumis.invoiceingest.infrastructure.jpa;

import jakarta.persistence.*;

import java.math.BigDecimal;

@Entity
@Table(name = "invoice_payment")
public class InvoicePaymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cufe", nullable = false)
    private String cufe;

    @Column(name = "forma_de_pago")
    private String formaDePago;

    @Column(name = "valor_pago", precision = 18, scale = 2)
    private BigDecimal valorPago;

    @Column(name = "vuelto", precision = 18, scale = 2)
    private BigDecimal vuelto;

    @Column(name = "total_pagado", precision = 18, scale = 2)
    private BigDecimal totalPagado;

    public InvoicePaymentEntity() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getCufe() { return cufe; }
    public void setCufe(String cufe) { this.cufe = cufe; }

    public String getFormaDePago() { return formaDePago; }
    public void setFormaDePago(String formaDePago) { this.formaDePago = formaDePago; }

    public BigDecimal getValorPago() { return valorPago; }
    public void setValorPago(BigDecimal valorPago) { this.valorPago = valorPago; }

    public BigDecimal getVuelto() { return vuelto; }
    public void setVuelto(BigDecimal vuelto) { this.vuelto = vuelto; }

    public BigDecimal getTotalPagado() { return totalPagado; }
    public void setTotalPagado(BigDecimal totalPagado) { this.totalPagado = totalPagado; }
}
