package com.edafunc.controller;

import com.edafunc.service.DispatchEngine;
import com.edafunc.service.EngineMeters;
import com.edafunc.service.EngineRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only view of the running engine.
 *
 * GET /api/engine
 * {
 *   "state": "RUNNING",
 *   "handlerShape": "OUTPUT",
 *   "consecutiveTransportErrors": 0,
 *   "metrics": {"eda.events.received": 12, "eda.outputs.published": 11, ...}
 * }
 *
 * Counters are read from the meter registry; /actuator/metrics serves the
 * same meters.
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
public class EngineController {

    private final EngineRunner engineRunner;
    private final MeterRegistry meterRegistry;

    @GetMapping
    public ResponseEntity<Map<String, Object>> status() {
        DispatchEngine engine = engineRunner.getEngine();
        Map<String, Object> body = new LinkedHashMap<>();
        if (engine == null) {
            body.put("state", "NOT_STARTED");
            return ResponseEntity.ok(body);
        }
        body.put("state", engine.getState().name());
        body.put("handlerShape", engine.getHandlerShape() == null ? null : engine.getHandlerShape().name());
        body.put("consecutiveTransportErrors", engine.getConsecutiveTransportErrors());
        body.put("metrics", engineCounters());
        return ResponseEntity.ok(body);
    }

    private Map<String, Long> engineCounters() {
        Map<String, Long> counters = new TreeMap<>();
        for (Counter counter : Search.in(meterRegistry).name(name -> name.startsWith(EngineMeters.PREFIX)).counters()) {
            counters.merge(counter.getId().getName(), (long) counter.count(), Long::sum);
        }
        return counters;
    }
}
