package com.lumis.invoiceingest.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpringInvoicePaymentRepository extends JpaRepository<InvoicePaymentEntity, Long> {

    List<InvoicePaymentEntity> findByCufeOrderByIdAsc(String cufe);
}
