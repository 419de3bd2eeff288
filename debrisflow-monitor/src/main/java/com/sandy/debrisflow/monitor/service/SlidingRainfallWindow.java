package com.sandy.debrisflow.monitor.service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Running rainfall sum over {@code (asOf - span, asOf]}. Additions are applied immediately,
 * expired samples are evicted when the sum is queried. Samples must arrive in timestamp order.
 * Not thread-safe; callers serialize per location.
 */
public class SlidingRainfallWindow {

    private record Sample(LocalDateTime timestamp, double rainfallMm) {}

    private final Duration span;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private double sum;

    public SlidingRainfallWindow(Duration span) {
        this.span = span;
    }

    public void add(LocalDateTime timestamp, double rainfallMm) {
        Sample last = samples.peekLast();
        if (last != null && timestamp.isBefore(last.timestamp())) {
            throw new IllegalArgumentException("Sample at " + timestamp + " is older than " + last.timestamp());
        }
        if (rainfallMm <= 0) {
            return;
        }
        samples.addLast(new Sample(timestamp, rainfallMm));
        sum += rainfallMm;
    }

    public double sum(LocalDateTime asOf) {
        LocalDateTime cutoff = asOf.minus(span);
        while (!samples.isEmpty() && !samples.peekFirst().timestamp().isAfter(cutoff)) {
            sum -= samples.pollFirst().rainfallMm();
        }
        if (samples.isEmpty()) {
            sum = 0.0; // drop accumulated rounding error
        }
        return Math.max(0.0, sum);
    }

    public int size() {
        return samples.size();
    }

    public Duration span() {
        return span;
    }
}
