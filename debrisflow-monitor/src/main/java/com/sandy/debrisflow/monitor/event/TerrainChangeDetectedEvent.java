package com.sandy.debrisflow.monitor.event;

import java.util.List;

public record TerrainChangeDetectedEvent(Long changeDetectionId,
                                         double netChangeM3,
                                         double changeAreaM2,
                                         List<Long> affectedSourceAreaIds) {
}
