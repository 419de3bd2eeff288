package com.sandy.debrisflow.monitor.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sandy.debrisflow.monitor.exception.ExecutorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * REST adapter for the model executor service.
 * <pre>
 * POST {base}/runs              {"model":..,"version":..,"parameters":{..}} -> {"id":".."}
 * GET  {base}/runs/{id}         -> {"status":"RUNNING|COMPLETED|FAILED|CANCELLED", "output_path":.., "metrics":{..}, "error":..}
 * POST {base}/runs/{id}/cancel
 * </pre>
 */
@Service
@Profile("!test")
@Slf4j
public class HttpSimulationExecutor implements SimulationExecutor {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${simulation.executor.base-url:http://localhost:8090}")
    private String baseUrl;

    public HttpSimulationExecutor(@Qualifier("executorRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String submit(String parametersJson, String modelName, String modelVersion) {
        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("model", modelName);
            body.put("version", modelVersion);
            body.set("parameters", parametersJson == null || parametersJson.isBlank()
                    ? objectMapper.createObjectNode() : objectMapper.readTree(parametersJson));
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            ResponseEntity<String> resp = restTemplate.postForEntity(baseUrl + "/runs",
                    new HttpEntity<>(objectMapper.writeValueAsString(body), headers), String.class);
            JsonNode json = objectMapper.readTree(resp.getBody());
            String id = json.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new ExecutorException("Executor returned no run id: " + resp.getBody());
            }
            log.info("Submitted model run externalRunId={} model={}:{}", id, modelName, modelVersion);
            return id;
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Invalid JSON exchanged with executor: " + e.getOriginalMessage(), e);
        } catch (RestClientException e) {
            throw new ExecutorException("Executor submit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ExecutorPollResult poll(String externalRunId) {
        try {
            String body = restTemplate.getForObject(baseUrl + "/runs/{id}", String.class, externalRunId);
            JsonNode json = objectMapper.readTree(body);
            ExecutorStatus status = parseStatus(json.path("status").asText(""));
            SimulationMetrics metrics = null;
            JsonNode m = json.path("metrics");
            if (m.isObject()) {
                metrics = SimulationMetrics.builder()
                        .runoutAreaM2(num(m, "runout_area_m2"))
                        .maxRunoutDistanceM(num(m, "max_runout_distance_m"))
                        .affectedVolumeM3(num(m, "affected_volume_m3"))
                        .maxVelocityMs(num(m, "max_velocity_ms"))
                        .computationTimeS(num(m, "computation_time_s"))
                        .runoutProbability(num(m, "runout_probability"))
                        .footprintWkt(m.path("footprint_wkt").asText(null))
                        .build();
            }
            return ExecutorPollResult.builder()
                    .status(status)
                    .outputPath(json.path("output_path").asText(null))
                    .metrics(metrics)
                    .errorMessage(json.path("error").asText(null))
                    .build();
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Unreadable poll response for run " + externalRunId, e);
        } catch (RestClientException e) {
            throw new ExecutorException("Executor poll failed for run " + externalRunId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void cancel(String externalRunId) {
        try {
            restTemplate.postForEntity(baseUrl + "/runs/{id}/cancel", null, Void.class, externalRunId);
            log.info("Cancellation signalled externalRunId={}", externalRunId);
        } catch (RestClientException e) {
            throw new ExecutorException("Executor cancel failed for run " + externalRunId + ": " + e.getMessage(), e);
        }
    }

    private static ExecutorStatus parseStatus(String s) {
        try {
            return ExecutorStatus.valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ExecutorException("Unknown executor status '" + s + "'");
        }
    }

    private static Double num(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isNumber() ? v.asDouble() : null;
    }
}
