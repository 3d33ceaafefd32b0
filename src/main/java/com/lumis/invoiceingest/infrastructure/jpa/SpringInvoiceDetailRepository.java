package com.lumis.invoiceingest.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpringInvoiceDetailRepository extends JpaRepository<InvoiceDetailEntity, Long> {

    // Insertion order is the order lines appear on the page
    List<InvoiceDetailEntity> findByCufeOrderByIdAsc(String cufe);

    long countByCufe(String cufe);
}
