package com.washdispatch.service;

import com.washdispatch.config.DispatchProperties;
import com.washdispatch.model.CleanerStatus;
import com.washdispatch.repository.CleanerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Takes cleaners off duty once their app stops reporting a location, so they drop out of dispatch.
 * BUSY cleaners are left to their job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleDutySweeper {

    private final CleanerRepository cleanerRepository;
    private final CleanerService cleanerService;
    private final DispatchProperties dispatchProperties;
    private final Clock clock;

    /**
     * @return number of cleaners moved to OFF_DUTY
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(dispatchProperties.getDutyTimeout().getStaleAfter());
        List<Long> candidates;
        try {
            candidates = cleanerRepository.findIdsWithStaleLocation(CleanerStatus.ON_DUTY, cutoff);
        } catch (RuntimeException e) {
            log.error("Stale duty sweep could not load candidates", e);
            return 0;
        }
        if (candidates.isEmpty()) {
            return 0;
        }

        int released = 0;
        for (Long cleanerId : candidates) {
            try {
                if (cleanerService.goOffDutyIfStale(cleanerId, cutoff)) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.error("Stale duty sweep failed for cleaner {}", cleanerId, e);
            }
        }
        log.info("Stale duty sweep: {} of {} cleaner(s) set off duty", released, candidates.size());
        return released;
    }
}
