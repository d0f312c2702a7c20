package autowarm.engine.scheduler;

import autowarm.engine.model.Task;
import autowarm.engine.model.TaskSettings;
import autowarm.engine.scheduler.AdmissionControl.Decision;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionControlTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private final AdmissionControl admission = new AdmissionControl(2);

    @Test
    void oneTaskPerResource() {
        Task first = Task.pending(1, 42, TaskSettings.empty());
        Task second = Task.pending(2, 42, TaskSettings.empty());

        assertEquals(Decision.ADMITTED, admission.tryAdmit(first, NOW));
        assertEquals(Decision.RESOURCE_BUSY, admission.tryAdmit(second, NOW));

        admission.release(first);
        assertEquals(Decision.ADMITTED, admission.tryAdmit(second, NOW));
    }

    @Test
    void tenantCap() {
        assertEquals(Decision.ADMITTED, admission.tryAdmit(Task.pending(7, 1, TaskSettings.empty()), NOW));
        assertEquals(Decision.ADMITTED, admission.tryAdmit(Task.pending(7, 2, TaskSettings.empty()), NOW));
        assertEquals(Decision.TENANT_LIMIT, admission.tryAdmit(Task.pending(7, 3, TaskSettings.empty()), NOW));
        assertEquals(Decision.ADMITTED, admission.tryAdmit(Task.pending(8, 3, TaskSettings.empty()), NOW));

        assertEquals(2, admission.activeCount(7));
        assertEquals(1, admission.activeCount(8));
    }

    @Test
    void backoffDefersWithoutMarking() {
        Task task = Task.pending(1, 5, TaskSettings.empty());
        Task backingOff = task.toBuilder()
                .progress(task.progress().withNextAttemptAt(NOW.plusSeconds(1)))
                .build();

        assertEquals(Decision.BACKING_OFF, admission.tryAdmit(backingOff, NOW));
        assertFalse(admission.isResourceActive(5));
        assertEquals(0, admission.activeCount(1));

        assertEquals(Decision.ADMITTED, admission.tryAdmit(backingOff, NOW.plusSeconds(1)));
    }

    @Test
    void checksRunInOrder() {
        Task running = Task.pending(1, 5, TaskSettings.empty());
        admission.tryAdmit(running, NOW);

        Task sameResourceBackingOff = Task.pending(1, 5, TaskSettings.empty());
        sameResourceBackingOff = sameResourceBackingOff.toBuilder()
                .progress(sameResourceBackingOff.progress().withNextAttemptAt(NOW.plusSeconds(60)))
                .build();

        assertEquals(Decision.RESOURCE_BUSY, admission.tryAdmit(sameResourceBackingOff, NOW));
    }

    @Test
    void releaseIsBalanced() {
        Task task = Task.pending(3, 9, TaskSettings.empty());
        admission.tryAdmit(task, NOW);

        admission.release(task);
        admission.release(task);

        assertEquals(0, admission.activeCount(3));
        assertEquals(new AdmissionControl.Snapshot(Set.of(), Map.of()), admission.snapshot());
    }

    @Test
    void rejectsInvalidCap() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionControl(0));
    }
}
