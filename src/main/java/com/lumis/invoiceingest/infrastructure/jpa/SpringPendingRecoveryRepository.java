package com.lumis.invoiceingest.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SpringPendingRecoveryRepository extends JpaRepository<PendingRecoveryEntity, Long> {

    List<PendingRecoveryEntity> findByUrlOrderByIdAsc(String url);
}
