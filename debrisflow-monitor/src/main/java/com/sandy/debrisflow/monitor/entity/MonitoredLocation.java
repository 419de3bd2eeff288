package com.sandy.debrisflow.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A fixed point with its own weather and rainfall-event state.
 */
@Entity
@Table(name = "monitored_locations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredLocation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64, nullable = false, unique = true)
    private String code;

    @Column(length = 120)
    private String name;

    private double longitude;
    private double latitude;

    private LocalDateTime createdAt;

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        MonitoredLocation that = (MonitoredLocation) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
