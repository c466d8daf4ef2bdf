package com.salesops.crmsync.service.sync;

import com.salesops.crmsync.model.domain.ConflictPolicy;
import com.salesops.crmsync.model.dto.ConflictResolution;
import com.salesops.crmsync.model.dto.CrmRecord;
import com.salesops.crmsync.model.dto.FieldConflict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConflictResolutionEngine Tests")
class ConflictResolutionEngineTest {

    private static final Instant EARLIER = Instant.parse("2024-03-01T09:00:00Z");
    private static final Instant LATER = Instant.parse("2024-03-01T10:00:00Z");

    private final ConflictResolutionEngine engine = new ConflictResolutionEngine();

    @Test
    @DisplayName("Should only flag fields present on both sides with different values")
    void shouldDetectSharedFieldConflicts() {
        var conflicts = engine.detectConflicts(
                Map.of("Email", "new@x.com", "Phone", "1", "Title", "CEO", "id", "r1"),
                Map.of("Email", "old@x.com", "Phone", "1", "City", "Paris", "id", "other"));

        assertThat(conflicts).containsExactly(new FieldConflict("Email", "new@x.com", "old@x.com"));
    }

    @Test
    @DisplayName("Should compare numbers by value")
    void shouldCompareNumbersByValue() {
        assertThat(ConflictResolutionEngine.valuesEqual(100, 100L)).isTrue();
        assertThat(ConflictResolutionEngine.valuesEqual(1.5, new BigDecimal("1.50"))).isTrue();
        assertThat(ConflictResolutionEngine.valuesEqual(1, "1")).isFalse();
    }

    @Test
    @DisplayName("Should union the fields when nothing conflicts")
    void shouldUnionWithoutConflict() {
        ConflictResolution resolution = engine.resolve(
                record(Map.of("Email", "a@x.com"), LATER),
                record(Map.of("City", "Paris"), EARLIER),
                ConflictPolicy.MANUAL);

        assertThat(resolution.hasConflict()).isFalse();
        assertThat(resolution.resolvedFields()).containsOnly(Map.entry("Email", "a@x.com"), Map.entry("City", "Paris"));
        assertThat(resolution.remoteChanged()).isTrue();
        assertThat(resolution.localChanged()).isTrue();
    }

    @Nested
    @DisplayName("Policies")
    class PolicyTests {

        private final CrmRecord remote = record(Map.of("Email", "remote@x.com", "Phone", "111"), EARLIER);
        private final CrmRecord local = record(Map.of("Email", "local@x.com", "City", "Paris"), LATER);

        @Test
        @DisplayName("REMOTE_WINS keeps remote values and local-only fields")
        void remoteWins() {
            ConflictResolution resolution = engine.resolve(remote, local, ConflictPolicy.REMOTE_WINS);

            assertThat(resolution.resolvedFields())
                    .containsOnly(Map.entry("Email", "remote@x.com"), Map.entry("Phone", "111"), Map.entry("City", "Paris"));
        }

        @Test
        @DisplayName("LOCAL_WINS keeps local values and remote-only fields")
        void localWins() {
            ConflictResolution resolution = engine.resolve(remote, local, ConflictPolicy.LOCAL_WINS);

            assertThat(resolution.resolvedFields())
                    .containsOnly(Map.entry("Email", "local@x.com"), Map.entry("Phone", "111"), Map.entry("City", "Paris"));
            assertThat(resolution.remoteChanged()).isTrue();
        }

        @Test
        @DisplayName("MERGE prefers the more recently modified side")
        void mergePrefersNewer() {
            assertThat(engine.resolve(remote, local, ConflictPolicy.MERGE).resolvedFields())
                    .containsEntry("Email", "local@x.com");

            CrmRecord newerRemote = record(remote.fields(), LATER.plusSeconds(60));
            assertThat(engine.resolve(newerRemote, local, ConflictPolicy.MERGE).resolvedFields())
                    .containsEntry("Email", "remote@x.com");
        }

        @Test
        @DisplayName("MERGE lets the remote win a tie")
        void mergeTieGoesToRemote() {
            CrmRecord sameTime = record(remote.fields(), LATER);

            assertThat(engine.resolve(sameTime, local, ConflictPolicy.MERGE).resolvedFields())
                    .containsEntry("Email", "remote@x.com");
        }

        @Test
        @DisplayName("MANUAL leaves the record unresolved")
        void manualLeavesPending() {
            ConflictResolution resolution = engine.resolve(remote, local, ConflictPolicy.MANUAL);

            assertThat(resolution.isPendingManual()).isTrue();
            assertThat(resolution.localChanged()).isFalse();
            assertThat(resolution.remoteChanged()).isFalse();
            assertThat(resolution.conflictingFields()).extracting(FieldConflict::field).containsExactly("Email");
        }
    }

    private static CrmRecord record(Map<String, Object> fields, Instant modifiedAt) {
        return new CrmRecord("r1", "Contacts", fields, modifiedAt);
    }
}
