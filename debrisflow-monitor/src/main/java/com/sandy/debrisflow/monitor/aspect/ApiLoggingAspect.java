package com.sandy.debrisflow.monitor.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.debrisflow.monitor.exception.HazardMonitorException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every operator / feed API call with its arguments, outcome and duration.
 * Collections are summarised by size so a large observation batch does not flood the log.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private final ObjectMapper objectMapper;

    @Value("${api.logging.max-body-chars:2000}")
    private int maxBodyChars;
    @Value("${api.logging.slow-threshold-ms:2000}")
    private long slowThresholdMs;

    @Around("within(com.sandy.debrisflow.monitor.controller..*) && !within(com.sandy.debrisflow.monitor.controller.GlobalExceptionHandler)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        String query = request != null ? request.getQueryString() : null;

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.toShortString();
        Object[] args = pjp.getArgs();
        String[] paramNames = sig.getParameterNames();

        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object a = args[i];
            if (a instanceof HttpServletRequest || a instanceof HttpServletResponse) continue;
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            argMap.put(name, summarise(a));
        }

        log.info("API Request: method={} uri={} query={} handler={} args={}", method, uri, query, handler, toJson(argMap));

        Object result = null;
        Throwable error = null;
        try {
            result = pjp.proceed();
            return result;
        } catch (Throwable t) {
            error = t;
            throw t;
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (error == null) {
                Object body = result instanceof ResponseEntity<?> re ? re.getBody() : result;
                String status = result instanceof ResponseEntity<?> re ? String.valueOf(re.getStatusCode()) : "200 OK";
                log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}",
                        method, uri, handler, status, cost, toJson(summarise(body)));
            } else if (error instanceof HazardMonitorException) {
                // mapped to a 4xx/5xx body by the exception handler
                log.info("API Rejected: method={} uri={} handler={} durationMs={} errorType={} message={}",
                        method, uri, handler, cost, error.getClass().getSimpleName(), error.getMessage());
            } else {
                log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                        method, uri, handler, cost, error.getClass().getSimpleName(), error.getMessage());
            }
            if (cost >= slowThresholdMs) {
                log.warn("Slow API call: method={} uri={} durationMs={}", method, uri, cost);
            }
        }
    }

    private Object summarise(Object value) {
        if (value instanceof Collection<?> c && c.size() > 20) {
            return Map.of("items", c.size());
        }
        return value;
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > maxBodyChars) {
                return s.substring(0, maxBodyChars) + "...(" + (s.length() - maxBodyChars) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
