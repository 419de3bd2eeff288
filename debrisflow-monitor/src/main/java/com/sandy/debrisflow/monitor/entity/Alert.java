package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Operator-facing notification. Only acknowledgement mutates it once raised, apart from
 * duplicate refreshes while it is still unacknowledged.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_signature", columnList = "signature,acknowledged"),
        @Index(name = "idx_alert_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private AlertType alertType;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private AlertSeverity severity;

    @Column(length = 200, nullable = false)
    private String title;

    @Column(length = 1000, nullable = false)
    private String message;

    private Long relatedSimulationId;
    private Long relatedEventId;
    private Long relatedLocationId;
    private Long relatedChangeDetectionId;

    /** Type plus related entity, used for duplicate suppression. */
    @Column(length = 120, nullable = false)
    private String signature;

    private int occurrenceCount;
    private LocalDateTime lastSeenAt;

    private LocalDateTime createdAt;

    private boolean acknowledged;
    private LocalDateTime acknowledgedAt;
    @Column(length = 100)
    private String acknowledgedBy;
}
