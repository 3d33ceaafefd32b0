package com.lumis.invoiceingest.domain.ports;

import com.lumis.invoiceingest.domain.InvoiceDetail;
import com.lumis.invoiceingest.domain.InvoiceHeader;
import com.lumis.invoiceingest.domain.InvoicePayment;
import com.lumis.invoiceingest.domain.NormalizedInvoice;

import java.util.List;
import java.util.Optional;

public interface InvoiceRepository {

    Optional<InvoiceHeader> findHeaderByCufe(String cufe);

    /**
     * Stores header, details and payments in a single transaction.
     *
     * @throws com.lumis.invoiceingest.exception.DuplicateInvoiceException if the CUFE is already stored
     * @throws com.lumis.invoiceingest.exception.PersistenceFailedException on any other write failure;
     *         nothing of the invoice is visible afterwards
     */
    void saveInvoice(NormalizedInvoice invoice);

    List<InvoiceDetail> findDetailsByCufe(String cufe);

    List<InvoicePayment> findPaymentsByCufe(String cufe);
}
