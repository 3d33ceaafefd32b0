package com.lumis.invoiceingest.infrastructure.adapters;

import com.lumis.invoiceingest.domain.PendingRecoveryEntry;
import com.lumis.invoiceingest.domain.ports.PendingRecoveryRepository;
import com.lumis.invoiceingest.infrastructure.jpa.PendingRecoveryEntity;
import com.lumis.invoiceingest.infrastructure.jpa.SpringPendingRecoveryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class JpaPendingRecoveryRepositoryAdapter implements PendingRecoveryRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaPendingRecoveryRepositoryAdapter.class);

    private final SpringPendingRecoveryRepository pending;
    private final TransactionTemplate tx;

    public JpaPendingRecoveryRepositoryAdapter(SpringPendingRecoveryRepository pending,
                                               PlatformTransactionManager transactionManager) {
        this.pending = pending;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Long insert(PendingRecoveryEntry entry) {
        log.info("Queueing pending recovery - url: {}, chatId: {}, origin: {}",
                entry.getUrl(), entry.getChatId(), entry.getOrigin());

        PendingRecoveryEntity e = new PendingRecoveryEntity();
        e.setUrl(entry.getUrl());
        e.setChatId(entry.getChatId());
        e.setReceptionDate(entry.getReceptionDate());
        e.setTypeDocument(entry.getTypeDocument());
        e.setUserId(entry.getUserId());
        e.setErrorMessage(ColumnLimits.truncate(entry.getErrorMessage(), ColumnLimits.ERROR_MESSAGE));
        e.setOrigin(entry.getOrigin());
        e.setWsId(entry.getWsId());

        Long id = tx.execute(status -> pending.saveAndFlush(e).getId());
        log.debug("Pending recovery entry {} committed", id);
        return id;
    }
}
