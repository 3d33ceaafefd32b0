package com.lumis.invoiceingest.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SpringInvoiceHeaderRepository extends JpaRepository<InvoiceHeaderEntity, String> {
}
