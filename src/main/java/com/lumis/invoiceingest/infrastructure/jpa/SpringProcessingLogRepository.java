package com.lumis.invoiceingest.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpringProcessingLogRepository extends JpaRepository<ProcessingLogEntity, Long> {

    List<ProcessingLogEntity> findByUrlOrderByIdAsc(String url);
}
