package com.flagship.number_gateway.health;

import com.flagship.number_gateway.dispatch.DispatcherSnapshot;
import com.flagship.number_gateway.dispatch.RateLimitedDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint for load balancers. Unlike the Actuator endpoint it needs no authorization.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final RateLimitedDispatcher dispatcher;
    private final Clock clock;

    public HealthController(DataSource dataSource, RateLimitedDispatcher dispatcher, Clock clock) {
        this.dataSource = dataSource;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        DispatcherSnapshot snapshot = dispatcher.snapshot();
        response.put("provider", snapshot.isCoolingDown() ? "COOLING_DOWN" : "UP");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
