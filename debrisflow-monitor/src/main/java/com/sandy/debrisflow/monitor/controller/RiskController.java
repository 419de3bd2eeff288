package com.sandy.debrisflow.monitor.controller;

import com.sandy.debrisflow.monitor.entity.RiskZone;
import com.sandy.debrisflow.monitor.repository.RiskZoneRepository;
import com.sandy.debrisflow.monitor.service.RiskStateService;
import com.sandy.debrisflow.monitor.vo.LocationRiskVO;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
public class RiskController {

    private final RiskStateService riskStateService;
    private final RiskZoneRepository riskZoneRepository;

    @GetMapping("/current")
    public List<LocationRiskVO> current() {
        return riskStateService.currentRisk();
    }

    @GetMapping("/zones")
    public List<RiskZone> zones() {
        return riskZoneRepository.findTop50ByOrderByTimestampDesc();
    }
}
