package com.flagship.class_enrollment.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.flagship.class_enrollment.payment.ChargeReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness endpoint. Unlike the Actuator health endpoint, it needs no authorization.
 *
 * The service is DOWN without its database. It stays up but reports DEGRADED while
 * charges whose reversal was given up on are waiting for a manual refund.
 */
@RestController
@Slf4j
public class HealthController {

    static final String UP = "UP";
    static final String DOWN = "DOWN";
    static final String DEGRADED = "DEGRADED";
    static final String UNKNOWN = "UNKNOWN";

    private final DataSource dataSource;
    private final ChargeReconciliationService reconciliationService;

    public HealthController(DataSource dataSource, ChargeReconciliationService reconciliationService) {
        this.dataSource = dataSource;
        this.reconciliationService = reconciliationService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", UP);
        response.put("service", "class-enrollment");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? UP : DOWN);

        if (!dbHealthy) {
            response.put("status", DOWN);
            return ResponseEntity.status(503).body(response);
        }

        response.put("reversals", checkReversals(response));
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> checkReversals(Map<String, Object> response) {
        Map<String, Object> reversals = new LinkedHashMap<>();
        try {
            long pending = reconciliationService.countPending();
            long abandoned = reconciliationService.countAbandoned();
            reversals.put("pending", pending);
            reversals.put("abandoned", abandoned);
            if (abandoned > 0) {
                response.put("status", DEGRADED);
            }
        } catch (RuntimeException e) {
            log.warn("Reversal backlog check failed: {}", e.getMessage());
            reversals.put("status", UNKNOWN);
        }
        return reversals;
    }
}
