package com.lumis.invoiceingest.infrastructure.adapters;

import com.lumis.invoiceingest.domain.ProcessingResult;
import com.lumis.invoiceingest.domain.ProcessingStatus;
import com.lumis.invoiceingest.domain.ports.ProcessingLogRepository;
import com.lumis.invoiceingest.infrastructure.jpa.ProcessingLogEntity;
import com.lumis.invoiceingest.infrastructure.jpa.SpringProcessingLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;

@Component
public class JpaProcessingLogRepositoryAdapter implements ProcessingLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaProcessingLogRepositoryAdapter.class);

    private static final String UNCLASSIFIED = "UNKNOWN";

    private final SpringProcessingLogRepository entries;
    private final TransactionTemplate tx;

    public JpaProcessingLogRepositoryAdapter(SpringProcessingLogRepository entries,
                                             PlatformTransactionManager transactionManager) {
        this.entries = entries;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Long open(String url, Long userId, String origin, OffsetDateTime requestedAt) {
        ProcessingLogEntity e = new ProcessingLogEntity();
        e.setUrl(url);
        e.setUserId(userId);
        e.setOrigin(origin);
        e.setStatus(ProcessingStatus.PROCESSING.name());
        e.setScrapedFieldsCount(0);
        e.setRequestTimestamp(requestedAt);

        Long id = tx.execute(status -> entries.saveAndFlush(e).getId());
        log.debug("Processing log entry {} opened for {}", id, url);
        return id;
    }

    @Override
    public void close(Long id, ProcessingResult result) {
        tx.executeWithoutResult(status -> {
            ProcessingLogEntity e = entries.findById(id)
                    .orElseThrow(() -> new IllegalStateException("No processing log entry " + id));
            e.setStatus(result.status().name());
            e.setCufe(result.cufe());
            e.setErrorType(errorType(result));
            e.setErrorMessage(ColumnLimits.truncate(result.errorMessage(), ColumnLimits.ERROR_MESSAGE));
            e.setExecutionTimeMs(result.executionTimeMs());
            e.setScrapedFieldsCount(result.scrapedFieldsCount());
            e.setResponseTimestamp(OffsetDateTime.now());
            entries.saveAndFlush(e);
        });
        log.debug("Processing log entry {} closed as {} after {} ms", id, result.status(), result.executionTimeMs());
    }

    private static String errorType(ProcessingResult result) {
        if (result.failureKind() != null) {
            return result.failureKind().name();
        }
        boolean failed = result.status() == ProcessingStatus.SCRAPING_ERROR
                || result.status() == ProcessingStatus.DATABASE_ERROR;
        return failed ? UNCLASSIFIED : null;
    }
}
