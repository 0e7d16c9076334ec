package com.uptime.keeper.monitor.notify;

import com.uptime.keeper.monitor.model.RedeployAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingEventListener implements MonitorEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(MonitorEvent event) {
        if (event instanceof StatusChangedEvent changed) {
            if (changed.isRecovery()) {
                log.info("Target {} recovered ({} -> {})", changed.targetId(), changed.oldStatus(), changed.newStatus());
            } else {
                log.info(
                    "Target {} status {} -> {} ({})",
                    changed.targetId(),
                    changed.oldStatus(),
                    changed.newStatus(),
                    changed.reason()
                );
            }
        } else if (event instanceof RedeployAttemptedEvent attempted) {
            RedeployAttempt attempt = attempted.attempt();
            log.info(
                "Redeploy of {} ({}) finished {} reason={}",
                attempted.targetId(),
                attempt.trigger(),
                attempt.outcome(),
                attempt.reason()
            );
        }
    }
}
