package com.flagship.class_enrollment.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.class_enrollment.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxServiceTest {

    private OutboxEventRepository repository;
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        repository = mock(OutboxEventRepository.class);
        when(repository.save(any(OutboxEventEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        outboxService = new OutboxService(repository, objectMapper);
    }

    @Test
    @DisplayName("Staged event carries the aggregate id as key and the payload as JSON")
    void saveEvent() {
        UUID studentId = UUID.randomUUID();

        OutboxEvent event = outboxService.saveEvent("Enrollment", studentId, "EnrollmentCompleted",
            Map.of("studentName", "Kid"));

        assertEquals("Enrollment", event.getAggregateType());
        assertEquals(studentId, event.getAggregateId());
        assertEquals("EnrollmentCompleted", event.getEventType());
        assertTrue(event.getPayload().contains("\"studentName\":\"Kid\""));
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
    }

    @Test
    @DisplayName("Failure increments the retry count and keeps the error")
    void markFailed() {
        OutboxEventEntity entity = OutboxEventEntity.fromDomain(
            OutboxEvent.create("Enrollment", UUID.randomUUID(), "EnrollmentCompleted", "{}"));
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        assertEquals(1, outboxService.markFailed(entity.getId(), "broker down"));
        assertEquals(2, outboxService.markFailed(entity.getId(), "broker down"));

        ArgumentCaptor<OutboxEventEntity> saved = ArgumentCaptor.forClass(OutboxEventEntity.class);
        verify(repository, times(2)).save(saved.capture());
        assertEquals("broker down", saved.getValue().toDomain().getLastError());
    }

    @Test
    @DisplayName("Failure of a vanished event reports -1")
    void markFailedMissing() {
        UUID eventId = UUID.randomUUID();
        when(repository.findById(eventId)).thenReturn(Optional.empty());

        assertEquals(-1, outboxService.markFailed(eventId, "broker down"));
    }

    @Test
    @DisplayName("Published events get a publication time")
    void markPublished() {
        OutboxEventEntity entity = OutboxEventEntity.fromDomain(
            OutboxEvent.create("Enrollment", UUID.randomUUID(), "EnrollmentCompleted", "{}"));
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        outboxService.markPublished(entity.getId());

        assertTrue(entity.toDomain().isPublished());
    }
}
