package com.buffrhost.availability.job;

import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.repository.ReservationRepository;
import com.buffrhost.availability.domain.service.ReservationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Scheduled sweep that cancels HELD reservations whose hold has expired.
 * Each hold is cancelled in its own transaction, so one failure does not stop the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldExpiryJob {

    private final ReservationRepository reservationRepository;
    private final ReservationService reservationService;

    @Value("${availability.reservation.expiry-job-enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${availability.reservation.expiry-job-interval-ms:60000}")
    public void releaseExpiredHolds() {
        if (!enabled) return;
        List<Reservation> expired = reservationRepository.findExpiredHolds(LocalDateTime.now());
        if (expired.isEmpty()) return;
        int released = 0;
        for (Reservation reservation : expired) {
            try {
                if (reservationService.expireHold(reservation.getId())) {
                    released++;
                }
            } catch (Exception e) {
                log.error("Failed to expire hold on reservation {}", reservation.getId(), e);
            }
        }
        log.info("Released {} of {} expired reservation hold(s)", released, expired.size());
    }
}
