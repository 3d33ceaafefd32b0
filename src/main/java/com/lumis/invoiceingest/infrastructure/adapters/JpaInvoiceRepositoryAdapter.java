package com.lumis.invoiceingest.infrastructure.adapters;

import com.lumis.invoiceingest.config.AppProperties;
import com.lumis.invoiceingest.domain.*;
import com.lumis.invoiceingest.domain.ports.InvoiceRepository;
import com.lumis.invoiceingest.exception.DuplicateInvoiceException;
import com.lumis.invoiceingest.exception.PersistenceFailedException;
import com.lumis.invoiceingest.infrastructure.jpa.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

@Component
public class JpaInvoiceRepositoryAdapter implements InvoiceRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaInvoiceRepositoryAdapter.class);

    private final SpringInvoiceHeaderRepository headers;
    private final SpringInvoiceDetailRepository details;
    private final SpringInvoicePaymentRepository payments;
    private final TransactionTemplate tx;

    public JpaInvoiceRepositoryAdapter(SpringInvoiceHeaderRepository headers,
                                       SpringInvoiceDetailRepository details,
                                       SpringInvoicePaymentRepository payments,
                                       PlatformTransactionManager transactionManager,
                                       AppProperties props) {
        this.headers = headers;
        this.details = details;
        this.payments = payments;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setTimeout(props.getPersistence().getTransactionTimeoutSeconds());
        log.info("Invoice repository initialized - transaction timeout: {}s",
                props.getPersistence().getTransactionTimeoutSeconds());
    }

    @Override
    public Optional<InvoiceHeader> findHeaderByCufe(String cufe) {
        return headers.findById(cufe).map(this::toDomain);
    }

    @Override
    public void saveInvoice(NormalizedInvoice invoice) {
        String cufe = invoice.cufe();
        log.debug("Saving invoice {} with {} details and {} payments",
                cufe, invoice.details().size(), invoice.payments().size());
        try {
            tx.executeWithoutResult(status -> {
                headers.saveAndFlush(toEntity(invoice.header()));
                details.saveAll(invoice.details().stream().map(this::toEntity).toList());
                payments.saveAll(invoice.payments().stream().map(this::toEntity).toList());
                details.flush();
                payments.flush();
            });
            log.info("Invoice {} stored", cufe);
        } catch (DataIntegrityViolationException e) {
            if (headers.existsById(cufe)) {
                log.info("Invoice {} rejected by the primary key, already stored", cufe);
                throw new DuplicateInvoiceException(cufe, e);
            }
            log.error("Integrity violation saving invoice {}: {}", cufe, e.getMostSpecificCause().getMessage());
            throw new PersistenceFailedException(e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to save invoice {}: {}", cufe, e.getMessage());
            throw new PersistenceFailedException(e.getMessage(), e);
        }
    }

    @Override
    public List<InvoiceDetail> findDetailsByCufe(String cufe) {
        return details.findByCufeOrderByIdAsc(cufe).stream().map(this::toDomain).toList();
    }

    @Override
    public List<InvoicePayment> findPaymentsByCufe(String cufe) {
        return payments.findByCufeOrderByIdAsc(cufe).stream().map(this::toDomain).toList();
    }

    private InvoiceHeaderEntity toEntity(InvoiceHeader h) {
        InvoiceHeaderEntity e = new InvoiceHeaderEntity();
        e.setCufe(h.getCufe());
        e.setInvoiceNumber(h.getInvoiceNumber());
        e.setIssueDate(h.getIssueDate());
        e.setIssuerName(h.getIssuerName());
        e.setIssuerRuc(h.getIssuerRuc());
        e.setIssuerDv(h.getIssuerDv());
        e.setIssuerAddress(h.getIssuerAddress());
        e.setIssuerPhone(h.getIssuerPhone());
        e.setReceptorName(h.getReceptorName());
        e.setReceptorRuc(h.getReceptorRuc());
        e.setTotAmount(h.getTotAmount());
        e.setTotItbms(h.getTotItbms());
        e.setUrl(h.getUrl());
        e.setInvoiceType(h.getType() != null ? h.getType().name() : null);
        e.setUserId(h.getUserId());
        e.setSource(h.getSource());
        e.setProcessDate(h.getProcessDate());
        e.setReceptionDate(h.getReceptionDate());
        return e;
    }

    private InvoiceDetailEntity toEntity(InvoiceDetail d) {
        InvoiceDetailEntity e = new InvoiceDetailEntity();
        e.setPartkey(d.getPartkey());
        e.setCufe(d.getCufe());
        e.setLinea(d.getLinea());
        e.setCode(d.getCode());
        e.setDescription(d.getDescription());
        e.setQuantity(d.getQuantity());
        e.setUnitPrice(d.getUnitPrice());
        e.setUnitDiscount(d.getUnitDiscount());
        e.setAmount(d.getAmount());
        e.setItbms(d.getItbms());
        e.setTotal(d.getTotal());
        e.setInformationOfInterest(d.getInformationOfInterest());
        return e;
    }

    private InvoicePaymentEntity toEntity(InvoicePayment p) {
        InvoicePaymentEntity e = new InvoicePaymentEntity();
        e.setCufe(p.getCufe());
        e.setFormaDePago(p.getPaymentMethod());
        e.setValorPago(p.getAmountPaid());
        e.setVuelto(p.getChangeGiven());
        e.setTotalPagado(p.getTotalPaid());
        return e;
    }

    private InvoiceHeader toDomain(InvoiceHeaderEntity e) {
        return new InvoiceHeader(
                e.getCufe(),
                e.getInvoiceNumber(),
                e.getIssueDate(),
                e.getIssuerName(),
                e.getIssuerRuc(),
                e.getIssuerDv(),
                e.getIssuerAddress(),
                e.getIssuerPhone(),
                e.getReceptorName(),
                e.getReceptorRuc(),
                e.getTotAmount(),
                e.getTotItbms(),
                e.getUrl(),
                e.getInvoiceType() != null ? InvoiceType.valueOf(e.getInvoiceType()) : null,
                e.getUserId(),
                e.getSource(),
                e.getProcessDate(),
                e.getReceptionDate()
        );
    }

    private InvoiceDetail toDomain(InvoiceDetailEntity e) {
        return new InvoiceDetail(e.getPartkey(), e.getCufe(), e.getLinea(), e.getCode(), e.getDescription(),
                e.getQuantity(), e.getUnitPrice(), e.getUnitDiscount(), e.getAmount(), e.getItbms(), e.getTotal(),
                e.getInformationOfInterest());
    }

    private InvoicePayment toDomain(InvoicePaymentEntity e) {
        return new InvoicePayment(e.getCufe(), e.getFormaDePago(), e.getValorPago(), e.getVuelto(), e.getTotalPagado());
    }
}
