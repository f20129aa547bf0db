package com.washdispatch.service;

import com.washdispatch.exception.CleanerNotFoundException;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerStatus;
import com.washdispatch.repository.CleanerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class CleanerService {

    private final CleanerRepository cleanerRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Cleaner findByEmail(String email) {
        return cleanerRepository.findByEmailIgnoreCase(email).orElseThrow(() -> new CleanerNotFoundException(email));
    }

    /**
     * Duty toggle. BUSY is owned by job transitions and can be neither set nor left from here.
     */
    @Transactional
    public Cleaner updateStatus(Long cleanerId, CleanerStatus status) {
        if (status == CleanerStatus.BUSY) {
            throw new IllegalArgumentException("Status busy is set by accepting a job");
        }
        Cleaner cleaner = cleanerRepository.findByIdForUpdate(cleanerId)
                .orElseThrow(() -> new CleanerNotFoundException(cleanerId));
        if (cleaner.getStatus() == CleanerStatus.BUSY) {
            throw new IllegalStateException("Finish the current job before changing status");
        }
        cleaner.setStatus(status);
        log.info("Cleaner {} is now {}", cleanerId, status.wireName());
        return cleaner;
    }

    @Transactional
    public Cleaner updateLocation(Long cleanerId, double latitude, double longitude) {
        Cleaner cleaner = cleanerRepository.findById(cleanerId)
                .orElseThrow(() -> new CleanerNotFoundException(cleanerId));
        cleaner.setCurrentLatitude(latitude);
        cleaner.setCurrentLongitude(longitude);
        cleaner.setLastLocationUpdate(clock.instant());
        return cleaner;
    }

    /**
     * Sends an ON_DUTY cleaner off duty when no location arrived since the cutoff.
     * Re-checked under the row lock, so a fresh report or an acceptance in between wins.
     */
    @Transactional
    public boolean goOffDutyIfStale(Long cleanerId, Instant cutoff) {
        Cleaner cleaner = cleanerRepository.findByIdForUpdate(cleanerId).orElse(null);
        if (cleaner == null || cleaner.getStatus() != CleanerStatus.ON_DUTY) {
            return false;
        }
        Instant lastSeen = cleaner.getLastLocationUpdate();
        if (lastSeen != null && !lastSeen.isBefore(cutoff)) {
            return false;
        }
        cleaner.setStatus(CleanerStatus.OFF_DUTY);
        log.info("Cleaner {} went off duty, last location {}", cleanerId, lastSeen == null ? "never" : lastSeen);
        return true;
    }
}
