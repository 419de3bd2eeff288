package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.entity.SourceArea;
import com.sandy.debrisflow.monitor.entity.TerrainSnapshot;
import com.sandy.debrisflow.monitor.service.TerrainService;
import com.sandy.debrisflow.monitor.vo.SourceAreaPayload;
import com.sandy.debrisflow.monitor.vo.TerrainSnapshotPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/terrain")
@RequiredArgsConstructor
public class TerrainController {

    private final TerrainService terrainService;

    @PostMapping("/snapshots")
    public ResponseEntity<TerrainSnapshot> registerSnapshot(@RequestBody TerrainSnapshotPayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(terrainService.registerSnapshot(payload));
    }

    @GetMapping("/snapshots")
    public List<TerrainSnapshot> snapshots() {
        return terrainService.listSnapshots();
    }

    @GetMapping("/snapshots/{id}")
    public TerrainSnapshot snapshot(@PathVariable Long id) {
        return terrainService.getSnapshot(id);
    }

    @PostMapping("/source-areas")
    public ResponseEntity<SourceArea> registerSourceArea(@RequestBody SourceAreaPayload payload) {
        return ResponseEntity.status(HttpStatus.CREATED).body(terrainService.registerSourceArea(payload));
    }

    @GetMapping("/source-areas")
    public List<SourceArea> sourceAreas(@RequestParam(required = false) Long terrainSnapshotId) {
        return terrainService.listSourceAreas(terrainSnapshotId);
    }
}
