package com.sandy.debrisflow.monitor.repository;

import com.sandy.debrisflow.monitor.entity.Alert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {
    List<Alert> findByAcknowledgedFalseOrderByCreatedAtDesc();
    Optional<Alert> findTopBySignatureAndAcknowledgedFalseOrderByCreatedAtDesc(String signature);
    List<Alert> findBySignature(String signature);
    List<Alert> findTop50ByOrderByCreatedAtDesc();
    List<Alert> findByCreatedAtAfterOrderByCreatedAtAsc(LocalDateTime after);
}
