package com.archvalidation.application;

import com.archvalidation.application.cycle.CycleRegistry;
import com.archvalidation.application.cycle.CycleStateRecorder;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails cycles left RUNNING by a previous process. Their workers are gone,
 * and a running cycle would block the tenant from starting a new one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CycleRecovery {

    static final String INTERRUPTED_REASON = "Interrupted by service restart";

    private final ValidationCycleRepository cycleRepository;
    private final CycleStateRecorder stateRecorder;
    private final CycleRegistry cycleRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedCycles() {
        List<ValidationCycle> orphaned = cycleRepository.findAllRunning().stream()
            .filter(cycle -> !cycleRegistry.isRegistered(cycle.getId()))
            .toList();
        if (orphaned.isEmpty()) {
            return;
        }
        log.warn("Found {} validation cycle(s) interrupted by a restart", orphaned.size());
        orphaned.forEach(cycle -> stateRecorder.markFailed(cycle.getId(), INTERRUPTED_REASON));
    }
}
