package com.buffrhost.inventory.domain.repository;

import com.buffrhost.inventory.domain.model.InventoryItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface InventoryItemRepository extends JpaRepository<InventoryItem, Long> {

    Optional<InventoryItem> findByIdAndPropertyId(Long id, Long propertyId);

    boolean existsByPropertyIdAndSku(Long propertyId, String sku);

    List<InventoryItem> findByPropertyIdOrderByCreatedAtDescIdDesc(Long propertyId, Pageable pageable);

    List<InventoryItem> findByPropertyIdAndActiveTrueOrderByCreatedAtDescIdDesc(Long propertyId, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InventoryItem i WHERE i.id = :id AND i.propertyId = :propertyId")
    Optional<InventoryItem> findByIdAndPropertyIdForUpdate(@Param("id") Long id,
                                                           @Param("propertyId") Long propertyId);

    /**
     * Atomically moves the cached stock by {@code delta}, guarded so the result can never be negative:
     *
     *   UPDATE inventory_items
     *   SET current_stock = current_stock + :delta
     *   WHERE id = :id AND current_stock + :delta >= 0;
     *
     * The row lock taken by the UPDATE is held until commit, so concurrent movements on the same
     * item are serialised and each one is checked against the latest committed balance.
     *
     * @return 1 if applied, 0 if the movement would drive stock negative
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           UPDATE InventoryItem i
           SET i.currentStock = i.currentStock + :delta,
               i.version = i.version + 1,
               i.updatedAt = :now
           WHERE i.id = :id
             AND i.currentStock + :delta >= 0
             AND i.currentStock + :delta <= 999999999.999
           """)
    int applyDelta(@Param("id") Long id, @Param("delta") BigDecimal delta, @Param("now") LocalDateTime now);

    @Query("SELECT i.currentStock FROM InventoryItem i WHERE i.id = :id")
    BigDecimal findCurrentStock(@Param("id") Long id);

    @Query("""
           SELECT i FROM InventoryItem i
           WHERE i.propertyId = :propertyId
             AND i.active = true
             AND i.currentStock <= i.minStock
           ORDER BY i.name
           """)
    List<InventoryItem> findLowStock(@Param("propertyId") Long propertyId);

    @Query("""
           SELECT i FROM InventoryItem i
           WHERE i.propertyId = :propertyId
             AND i.active = true
             AND i.expiryDate IS NOT NULL
             AND i.expiryDate <= :cutoff
           ORDER BY i.expiryDate, i.name
           """)
    List<InventoryItem> findExpiringOnOrBefore(@Param("propertyId") Long propertyId,
                                               @Param("cutoff") LocalDate cutoff);
}
