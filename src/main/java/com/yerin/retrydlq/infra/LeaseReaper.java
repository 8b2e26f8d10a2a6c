package com.yerin.retrydlq.infra;

import com.yerin.retrydlq.service.JobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseReaper {

    private final JobService jobService;

    @Scheduled(fixedDelayString = "${retrydlq.reaper.fixedDelayMillis:2000}")
    public void reap() {
        int reaped;
        try {
            reaped = jobService.reapExpiredLeases();
        } catch (RuntimeException e) {
            log.warn("[LeaseReaper] reap failed, err={}", e.toString());
            return;
        }
        if (reaped > 0) {
            log.info("[LeaseReaper] reaped={} (active→wait)", reaped);
        }
    }
}
