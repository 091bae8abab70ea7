package com.buffrhost.inventory.domain.repository;

import com.buffrhost.inventory.domain.model.StockTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface StockTransactionRepository extends JpaRepository<StockTransaction, Long> {

    /**
     * Most recent first. Transactions with the same timestamp come back in reverse insertion order.
     */
    List<StockTransaction> findByItemIdOrderByCreatedAtDescIdDesc(Long itemId, Pageable pageable);

    /**
     * Sum of all signed deltas of the item, or null when it has no transactions.
     */
    @Query("SELECT SUM(t.delta) FROM StockTransaction t WHERE t.itemId = :itemId")
    BigDecimal sumDeltas(@Param("itemId") Long itemId);

    long countByItemId(Long itemId);
}
