package com.buffrhost.availability.domain.repository;

import com.buffrhost.availability.domain.model.BookableResource;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Repository for {@link BookableResource}.
 * Every lookup is scoped to the caller's property; a resource of another property is simply absent.
 */
public interface BookableResourceRepository extends JpaRepository<BookableResource, Long> {

    Optional<BookableResource> findByIdAndPropertyId(Long id, Long propertyId);

    boolean existsByPropertyIdAndCode(Long propertyId, String code);

    /**
     * SELECT ... FOR UPDATE on the resource row. Concurrent reservations for the same
     * resource queue here until the holder commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM BookableResource r WHERE r.id = :id AND r.propertyId = :propertyId")
    Optional<BookableResource> findByIdAndPropertyIdForUpdate(@Param("id") Long id,
                                                              @Param("propertyId") Long propertyId);

    /**
     * Loads the resource and schedules a version increment at commit, so that two transactions
     * booking the same resource cannot both commit.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT r FROM BookableResource r WHERE r.id = :id AND r.propertyId = :propertyId")
    Optional<BookableResource> findByIdAndPropertyIdWithVersionBump(@Param("id") Long id,
                                                                    @Param("propertyId") Long propertyId);
}
