package com.flagship.class_enrollment.health;

import com.flagship.class_enrollment.payment.ChargeReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.ResponseEntity;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private DataSource dataSource;
    private Connection connection;
    private ChargeReconciliationService reconciliationService;
    private HealthController controller;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        reconciliationService = mock(ChargeReconciliationService.class);
        controller = new HealthController(dataSource, reconciliationService);

        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(2)).thenReturn(true);
    }

    @Test
    @DisplayName("Reports UP with the reversal backlog")
    void up() {
        when(reconciliationService.countPending()).thenReturn(2L);

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(200, response.getStatusCode().value());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals("UP", response.getBody().get("database"));
        assertEquals(Map.of("pending", 2L, "abandoned", 0L), response.getBody().get("reversals"));
    }

    @Test
    @DisplayName("Abandoned reversals degrade the service without taking it down")
    void degraded() {
        when(reconciliationService.countAbandoned()).thenReturn(1L);

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(200, response.getStatusCode().value());
        assertEquals("DEGRADED", response.getBody().get("status"));
    }

    @Test
    @DisplayName("Database outage is reported as 503")
    void databaseDown() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(503, response.getStatusCode().value());
        assertEquals("DOWN", response.getBody().get("status"));
        assertEquals("DOWN", response.getBody().get("database"));
        assertFalse(response.getBody().containsKey("reversals"));
        verifyNoInteractions(reconciliationService);
    }

    @Test
    @DisplayName("Backlog that cannot be counted is reported as unknown")
    void backlogUnknown() {
        when(reconciliationService.countPending()).thenThrow(new DataAccessResourceFailureException("timeout"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(200, response.getStatusCode().value());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals(Map.of("status", "UNKNOWN"), response.getBody().get("reversals"));
    }
}
