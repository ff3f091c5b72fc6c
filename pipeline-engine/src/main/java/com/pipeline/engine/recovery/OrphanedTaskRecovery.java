package com.pipeline.engine.recovery;

import com.pipeline.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup recovery: a task left PROCESSING by a previous process has no live executor,
 * so it goes back to PENDING with its progress cleared and is dispatched again.
 */
public class OrphanedTaskRecovery {

    private static final Logger log = LoggerFactory.getLogger(OrphanedTaskRecovery.class);

    private final TaskRepository taskRepository;

    public OrphanedTaskRecovery(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    /**
     * @return number of tasks put back to pending
     */
    public int recover() {
        int reset = taskRepository.resetProcessingToPending();
        if (reset > 0) {
            log.warn("Recovered {} orphaned processing task(s) back to pending", reset);
        } else {
            log.info("No orphaned tasks to recover");
        }
        return reset;
    }
}
