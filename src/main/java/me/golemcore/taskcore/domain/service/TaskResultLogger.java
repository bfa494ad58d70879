package me.golemcore.taskcore.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.TaskResultEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs answered lane items. Recovered results have no caller, so this is the
 * place they surface when no transport listens for them.
 */
@Component
@Slf4j
public class TaskResultLogger {

    @EventListener
    public void onResult(TaskResultEvent event) {
        if (event.recovered()) {
            log.info("[Result] recovered item answered: lane={}, record={}, {} chars", event.laneId(),
                    event.recordId(), event.result() != null ? event.result().length() : 0);
        } else {
            log.debug("[Result] lane={}, record={}, {} chars", event.laneId(), event.recordId(),
                    event.result() != null ? event.result().length() : 0);
        }
    }
}
