package com.jobhost.scheduler;

import com.jobhost.config.JobHostProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SchedulerInitializer {

    private final ScheduleReconciler reconciler;
    private final JobHostProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.scheduler().initializeOnStartup()) {
            log.info("Scheduler initialization on startup is disabled");
            return;
        }
        reconciler.initialize();
    }
}
