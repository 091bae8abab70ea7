package com.buffrhost.inventory.domain.repository;

import com.buffrhost.common.exception.InsufficientStockException;
import com.buffrhost.inventory.domain.model.InventoryItem;
import com.buffrhost.inventory.domain.model.ItemDetailsUpdate;
import com.buffrhost.inventory.domain.model.StockTransaction;
import com.buffrhost.inventory.domain.model.TransactionKind;
import com.buffrhost.inventory.domain.model.UnitOfMeasure;
import com.buffrhost.inventory.domain.service.LedgerReconciliation;
import com.buffrhost.inventory.domain.service.NewInventoryItem;
import com.buffrhost.inventory.domain.service.StockLedgerService;
import com.buffrhost.inventory.domain.service.StockMovementCommand;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ledger behaviour against a real PostgreSQL: the guarded UPDATE, the CHECK constraint,
 * history ordering and the sum-of-deltas invariant under concurrent sales.
 *
 * Not transactional, so every ledger call commits on its own.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(StockLedgerService.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class StockLedgerIntegrationTest {

    private static final Long PROPERTY_ID = 1L;

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("inventory_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none"); // schema comes from Flyway
    }

    @Autowired
    private StockLedgerService ledgerService;
    @Autowired
    private InventoryItemRepository itemRepository;
    @Autowired
    private StockTransactionRepository transactionRepository;

    @AfterEach
    void tearDown() {
        transactionRepository.deleteAll();
        itemRepository.deleteAll();
    }

    @Test
    @DisplayName("opening balance 10, sale 4 leaves 6, sale 10 is refused and stock stays 6")
    void scenarioA() {
        InventoryItem item = createItem("WINE-RED", "10");

        ledgerService.recordTransaction(PROPERTY_ID, sale(item.getId(), "4"));
        assertThatThrownBy(() -> ledgerService.recordTransaction(PROPERTY_ID, sale(item.getId(), "10")))
                .isInstanceOf(InsufficientStockException.class);

        assertThat(itemRepository.findCurrentStock(item.getId())).isEqualByComparingTo("6");
        assertThat(transactionRepository.countByItemId(item.getId())).isEqualTo(2);
        assertThat(ledgerService.verifyLedger(PROPERTY_ID, item.getId()).isConsistent()).isTrue();
    }

    @Test
    @DisplayName("adjusting 42 to 50 shows a +8 ADJUSTMENT at the top of the history")
    void scenarioD() {
        InventoryItem item = createItem("FLOUR", "42");

        ledgerService.adjustStock(PROPERTY_ID, item.getId(), new BigDecimal("50"), "monthly count", "manager");

        List<StockTransaction> history = ledgerService.getTransactionHistory(PROPERTY_ID, item.getId(), null);
        assertThat(history).hasSize(2);
        assertThat(history.get(0).getKind()).isEqualTo(TransactionKind.ADJUSTMENT);
        assertThat(history.get(0).getDelta()).isEqualByComparingTo("8");
        assertThat(history.get(0).getBalanceAfter()).isEqualByComparingTo("50");
        assertThat(history.get(1).getReason()).isEqualTo("Opening balance");
        assertThat(itemRepository.findCurrentStock(item.getId())).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("guarded update refuses a movement below zero and leaves the row untouched")
    void applyDelta_neverNegative() {
        InventoryItem item = createItem("NAPKIN", "3");

        assertThat(itemRepository.applyDelta(item.getId(), new BigDecimal("-4"), LocalDateTime.now())).isZero();
        assertThat(itemRepository.findCurrentStock(item.getId())).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("guarded update refuses a movement past the column maximum instead of overflowing")
    void applyDelta_neverAboveColumnMaximum() {
        InventoryItem item = createItem("TOWEL", "999999999");

        assertThat(itemRepository.applyDelta(item.getId(), new BigDecimal("1"), LocalDateTime.now())).isZero();
        assertThat(itemRepository.findCurrentStock(item.getId())).isEqualByComparingTo("999999999");
    }

    @Test
    @DisplayName("concurrent sales never oversell and the cached stock equals the ledger sum")
    void concurrentSales_neverOversell() throws Exception {
        InventoryItem item = createItem("CHAMPAGNE", "10");
        int attempts = 20;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<StockTransaction>> futures = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                futures.add(executor.submit(() -> {
                    go.await();
                    return ledgerService.recordTransaction(PROPERTY_ID, sale(item.getId(), "1"));
                }));
            }
            go.countDown();

            int succeeded = 0;
            for (Future<StockTransaction> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InsufficientStockException.class);
                }
            }

            assertThat(succeeded).isEqualTo(10);
            assertThat(itemRepository.findCurrentStock(item.getId())).isEqualByComparingTo("0");
            LedgerReconciliation reconciliation = ledgerService.verifyLedger(PROPERTY_ID, item.getId());
            assertThat(reconciliation.isConsistent()).isTrue();
            assertThat(reconciliation.transactionCount()).isEqualTo(11);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("low-stock and expiring projections are scoped to the property")
    void projections() {
        InventoryItem low = createItem("LIME", "0");
        createItem("SALT", "5");

        assertThat(ledgerService.getLowStockItems(PROPERTY_ID)).extracting(InventoryItem::getId).containsExactly(low.getId());
        assertThat(ledgerService.getLowStockItems(99L)).isEmpty();
    }

    @Test
    @DisplayName("editing an item's details after movements keeps the stock and the ledger in step")
    void updateItem_keepsLedgerConsistent() {
        InventoryItem item = createItem("OLIVE-OIL", "10");
        ledgerService.recordTransaction(PROPERTY_ID, sale(item.getId(), "2.5"));

        InventoryItem updated = ledgerService.updateItem(PROPERTY_ID, item.getId(), new ItemDetailsUpdate(
                "Extra virgin olive oil", null, new BigDecimal("8"), new BigDecimal("40"), null, null, null, null));

        assertThat(updated.getName()).isEqualTo("Extra virgin olive oil");
        assertThat(itemRepository.findCurrentStock(item.getId())).isEqualByComparingTo("7.5");
        assertThat(ledgerService.getLowStockItems(PROPERTY_ID)).extracting(InventoryItem::getId).containsExactly(item.getId());
        assertThat(ledgerService.verifyLedger(PROPERTY_ID, item.getId()).isConsistent()).isTrue();
        assertThat(transactionRepository.countByItemId(item.getId())).isEqualTo(2);
    }

    @Test
    void listItems_scopedToPropertyAndActive() {
        InventoryItem kept = createItem("BASIL", "1");
        InventoryItem retired = createItem("TARRAGON", "1");
        ledgerService.updateItem(PROPERTY_ID, retired.getId(), new ItemDetailsUpdate(
                null, null, null, null, null, null, null, false));

        assertThat(ledgerService.listItems(PROPERTY_ID, false, 0, 50)).extracting(InventoryItem::getId)
                .containsExactly(kept.getId());
        assertThat(ledgerService.listItems(PROPERTY_ID, true, 0, 50)).hasSize(2);
        assertThat(ledgerService.listItems(99L, true, 0, 50)).isEmpty();
    }

    private InventoryItem createItem(String sku, String openingBalance) {
        return ledgerService.createItem(PROPERTY_ID, new NewInventoryItem(
                sku, sku.toLowerCase(), UnitOfMeasure.BOTTLE, new BigDecimal("1"), null, null, null, null,
                new BigDecimal(openingBalance)), "manager");
    }

    private static StockMovementCommand sale(Long itemId, String quantity) {
        return new StockMovementCommand(itemId, TransactionKind.SALE, new BigDecimal(quantity), "bar", "waiter", null);
    }
}
