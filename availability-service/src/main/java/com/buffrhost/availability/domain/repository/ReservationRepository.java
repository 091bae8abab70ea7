package com.buffrhost.availability.domain.repository;

import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.model.ReservationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    Optional<Reservation> findByIdAndPropertyId(Long id, Long propertyId);

    Optional<Reservation> findByIdempotencyKey(String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") Long id);

    /**
     * Half-open overlap test: existing.start < end AND start < existing.end.
     * Reservations that only touch at an endpoint are not returned.
     */
    @Query("""
           SELECT r FROM Reservation r
           WHERE r.resourceId = :resourceId
             AND r.status IN :statuses
             AND r.startAt < :end
             AND :start < r.endAt
           ORDER BY r.startAt
           """)
    List<Reservation> findOverlapping(@Param("resourceId") Long resourceId,
                                      @Param("statuses") Collection<ReservationStatus> statuses,
                                      @Param("start") LocalDateTime start,
                                      @Param("end") LocalDateTime end);

    @Query("""
           SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END FROM Reservation r
           WHERE r.resourceId = :resourceId
             AND r.status IN :statuses
             AND r.startAt < :end
             AND :start < r.endAt
           """)
    boolean existsOverlapping(@Param("resourceId") Long resourceId,
                              @Param("statuses") Collection<ReservationStatus> statuses,
                              @Param("start") LocalDateTime start,
                              @Param("end") LocalDateTime end);

    @Query("""
           SELECT r FROM Reservation r
           WHERE r.status = com.buffrhost.availability.domain.model.ReservationStatus.HELD
             AND r.holdExpiresAt < :before
           ORDER BY r.holdExpiresAt
           """)
    List<Reservation> findExpiredHolds(@Param("before") LocalDateTime before);
}
