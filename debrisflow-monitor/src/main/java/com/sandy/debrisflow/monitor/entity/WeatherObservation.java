package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One timestamped point reading. Append-only.
 */
@Entity
@Immutable
@Table(name = "weather_observations",
        uniqueConstraints = @UniqueConstraint(name = "uk_observation_location_ts", columnNames = {"locationId", "timestamp"}),
        indexes = @Index(name = "idx_observation_location_ts", columnList = "locationId,timestamp"))
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherObservation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long locationId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    private double longitude;
    private double latitude;

    private double rainfallMm;
    private double intensityMmHr;
    private Double temperatureC;
    private Double humidityPct;
    private Double windSpeedMs;

    @Column(length = 50, nullable = false)
    private String source;

    private LocalDateTime createdAt;
}
