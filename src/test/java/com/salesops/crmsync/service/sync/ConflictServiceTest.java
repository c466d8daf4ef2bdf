package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.NotFoundException;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.model.domain.ConflictPolicy;
import com.salesops.crmsync.model.domain.ConflictRecord;
import com.salesops.crmsync.model.domain.ConflictStatus;
import com.salesops.crmsync.model.domain.ResolverType;
import com.salesops.crmsync.repository.ConflictRecordRepository;
import com.salesops.crmsync.service.events.LifecycleEventDispatcher;
import com.salesops.crmsync.service.gateway.CrmGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConflictService Tests")
class ConflictServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ConflictRecordRepository repository;

    @Mock
    private LocalRecordStore store;

    @Mock
    private CrmGateway gateway;

    @Mock
    private LifecycleEventDispatcher dispatcher;

    private ConflictService service;

    @BeforeEach
    void setUp() {
        service = new ConflictService(repository, new ConflictResolutionEngine(), store, gateway, dispatcher,
                new CrmSyncProperties(), new SimpleMeterRegistry(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should overlay custom field values on the merged result and push them")
    void shouldApplyCustomFields() {
        // Given
        ConflictRecord pending = pendingConflict();
        when(repository.findById("c-1")).thenReturn(Optional.of(pending));
        when(repository.save(any(ConflictRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        ConflictRecord resolved = service.resolveConflict("c-1", null, Map.of("Stage", "Negotiation"));

        // Then
        assertThat(resolved.getStatus()).isEqualTo(ConflictStatus.RESOLVED);
        assertThat(resolved.getResolver()).isEqualTo(ResolverType.MANUAL);
        assertThat(resolved.getFinalResolution()).isEqualTo("CUSTOM");
        assertThat(resolved.getResolvedFields()).containsEntry("Stage", "Negotiation").containsEntry("Amount", 100);
        verify(store).upsert(eq("Deals"), eq("D1"), eq(resolved.getResolvedFields()), eq(NOW), anyBoolean());
        verify(gateway).updateRecord("Deals", "D1", resolved.getResolvedFields());
    }

    @Test
    @DisplayName("Should not push when the resolution equals the remote state")
    void shouldNotPushRemoteWins() {
        // Given
        ConflictRecord pending = pendingConflict();
        when(repository.findById("c-1")).thenReturn(Optional.of(pending));
        when(repository.save(any(ConflictRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        service.resolveConflict("c-1", ConflictPolicy.REMOTE_WINS, null);

        // Then
        verify(store).upsert(eq("Deals"), eq("D1"), anyMap(), eq(NOW), anyBoolean());
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("Should leave an already resolved conflict untouched")
    void shouldIgnoreResolvedConflict() {
        // Given
        ConflictRecord done = pendingConflict();
        done.setStatus(ConflictStatus.RESOLVED);
        done.setFinalResolution("LOCAL_WINS");
        when(repository.findById("c-1")).thenReturn(Optional.of(done));

        // When
        ConflictRecord result = service.resolveConflict("c-1", ConflictPolicy.REMOTE_WINS, null);

        // Then
        assertThat(result.getFinalResolution()).isEqualTo("LOCAL_WINS");
        verifyNoInteractions(store, gateway, dispatcher);
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("Should require a concrete decision")
    void shouldRejectManualWithoutFields() {
        when(repository.findById("c-1")).thenReturn(Optional.of(pendingConflict()));

        assertThatThrownBy(() -> service.resolveConflict("c-1", ConflictPolicy.MANUAL, null))
                .isInstanceOf(PayloadValidationException.class);
        assertThatThrownBy(() -> service.resolveConflict("c-1", null, Map.of()))
                .isInstanceOf(PayloadValidationException.class);
    }

    @Test
    @DisplayName("Should report unknown conflicts as not found")
    void shouldRejectUnknownConflict() {
        when(repository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolveConflict("missing", ConflictPolicy.MERGE, null))
                .isInstanceOf(NotFoundException.class);
    }

    private static ConflictRecord pendingConflict() {
        ConflictRecord record = new ConflictRecord();
        record.setId("c-1");
        record.setModule("Deals");
        record.setRecordId("D1");
        record.setStatus(ConflictStatus.PENDING);
        record.setRemoteSnapshot(new LinkedHashMap<>(Map.of("Stage", "Lost", "Amount", 100)));
        record.setLocalSnapshot(new LinkedHashMap<>(Map.of("Stage", "Won")));
        record.setRemoteModifiedAt(NOW.minusSeconds(60));
        record.setLocalModifiedAt(NOW.minusSeconds(120));
        return record;
    }
}
