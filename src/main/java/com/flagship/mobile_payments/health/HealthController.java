package com.flagship.mobile_payments.health;

import com.flagship.mobile_payments.transaction.TransactionStatus;
import com.flagship.mobile_payments.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint that needs no actuator authorization.
 * Reports database connectivity and the dispatch queue depth.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final TransactionStore transactionStore;

    public HealthController(DataSource dataSource, TransactionStore transactionStore) {
        this.dataSource = dataSource;
        this.transactionStore = transactionStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("queueDepth", transactionStore.countByStatus(TransactionStatus.QUEUED));
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
}
