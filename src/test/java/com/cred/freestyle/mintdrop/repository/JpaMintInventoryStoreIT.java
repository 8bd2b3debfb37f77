package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.DropCollection.CollectionStatus;
import com.cred.freestyle.mintdrop.domain.model.Item;
import com.cred.freestyle.mintdrop.domain.model.Item.ItemState;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.mintdrop.exception.IdempotencyConflictException;
import com.cred.freestyle.mintdrop.exception.InsufficientSupplyException;
import com.cred.freestyle.mintdrop.exception.ItemsNotReservedException;
import com.cred.freestyle.mintdrop.exception.MintLimitExceededException;
import com.cred.freestyle.mintdrop.exception.MintValidationException;
import com.cred.freestyle.mintdrop.exception.ReservationExpiredException;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmCommand;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.InventoryCounts;
import com.cred.freestyle.mintdrop.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for JpaMintInventoryStore using Testcontainers.
 * Each store call commits on its own, so concurrent claims contend on real row locks.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(JpaMintInventoryStore.class)
@DisplayName("JpaMintInventoryStore Integration Tests")
class JpaMintInventoryStoreIT {

    private static final String COLLECTION_ID = "col-it";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("mintdrop_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private JpaMintInventoryStore store;

    @Autowired
    private CollectionRepository collectionRepository;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private MintTransactionRepository mintTransactionRepository;

    @Autowired
    private MintPhaseRepository phaseRepository;

    private Instant now;

    @BeforeEach
    void setUp() {
        mintTransactionRepository.deleteAll();
        reservationRepository.deleteAll();
        itemRepository.deleteAll();
        phaseRepository.deleteAll();
        collectionRepository.deleteAll();

        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        seedCollection(COLLECTION_ID, 10, 240);
    }

    // ========================================
    // atomicReserve Tests
    // ========================================

    @Test
    @DisplayName("atomicReserve - Should claim lowest-index unsold items")
    void atomicReserve_ClaimsLowestIndexItems() {
        // Given
        store.atomicReserve(draft("key-1", TestDataBuilder.wallet(1), 2, now), null);

        // When
        Reservation second = store.atomicReserve(draft("key-2", TestDataBuilder.wallet(2), 3, now), null);

        // Then
        assertThat(second.getItemIds()).containsExactly(
                COLLECTION_ID + "-item-2", COLLECTION_ID + "-item-3", COLLECTION_ID + "-item-4");
        assertThat(second.getStatus()).isEqualTo(ReservationStatus.PENDING);

        InventoryCounts counts = store.countInventory(COLLECTION_ID);
        assertThat(counts.reserved()).isEqualTo(5);
        assertThat(counts.unsold()).isEqualTo(5);
        assertThat(counts.minted()).isZero();
    }

    @Test
    @DisplayName("atomicReserve - Should claim nothing when supply is short")
    void atomicReserve_InsufficientSupply_ClaimsNothing() {
        // Given
        store.atomicReserve(draft("key-1", TestDataBuilder.wallet(1), 8, now), null);

        // When / Then
        assertThatThrownBy(() -> store.atomicReserve(draft("key-2", TestDataBuilder.wallet(2), 3, now), null))
                .isInstanceOf(InsufficientSupplyException.class);

        assertThat(store.findReservation("key-2")).isEmpty();
        assertThat(store.countInventory(COLLECTION_ID).unsold()).isEqualTo(2);
    }

    @Test
    @DisplayName("atomicReserve - Duplicate key should fail before any item moves")
    void atomicReserve_DuplicateKey_ThrowsDataIntegrityViolation() {
        // Given
        store.atomicReserve(draft("key-dup", TestDataBuilder.wallet(1), 1, now), null);

        // When / Then
        assertThatThrownBy(() -> store.atomicReserve(draft("key-dup", TestDataBuilder.wallet(1), 1, now), null))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(store.countInventory(COLLECTION_ID).reserved()).isEqualTo(1);
    }

    @Test
    @DisplayName("atomicReserve - Should enforce the per-wallet phase limit")
    void atomicReserve_MintLimit_Enforced() {
        // Given
        String wallet = TestDataBuilder.wallet(3);
        store.atomicReserve(draft("key-1", wallet, 2, now), 3);

        // When / Then
        assertThatThrownBy(() -> store.atomicReserve(draft("key-2", wallet, 2, now), 3))
                .isInstanceOf(MintLimitExceededException.class);

        Reservation withinLimit = store.atomicReserve(draft("key-3", wallet, 1, now), 3);
        assertThat(withinLimit.getItemIds()).hasSize(1);
    }

    @Test
    @DisplayName("atomicReserve - Concurrent claims should never oversell")
    void atomicReserve_Concurrent_NeverOversells() throws Exception {
        // Given
        int requests = 25;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger soldOut = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < requests; i++) {
            final int n = i;
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    store.atomicReserve(draft("key-c-" + n, TestDataBuilder.wallet(10 + n), 1, now), null);
                    succeeded.incrementAndGet();
                } catch (InsufficientSupplyException e) {
                    soldOut.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(succeeded.get()).isEqualTo(10);
        assertThat(soldOut.get()).isEqualTo(15);

        List<Item> items = itemRepository.findByCollectionIdOrderByItemIndexAsc(COLLECTION_ID);
        assertThat(items).allMatch(item -> item.getState() == ItemState.RESERVED);
        Set<String> holders = new HashSet<>();
        for (Item item : items) {
            holders.add(item.getReservationKey());
        }
        assertThat(holders).hasSize(10);
    }

    // ========================================
    // atomicConfirm Tests
    // ========================================

    @Test
    @DisplayName("atomicConfirm - Should mint items and append the transaction")
    void atomicConfirm_MintsItems() {
        // Given
        String wallet = TestDataBuilder.wallet(4);
        Reservation reservation = store.atomicReserve(draft("key-1", wallet, 2, now), null);

        // When
        ConfirmedMint result = store.atomicConfirm(
                new ConfirmCommand("key-1", "sig-1", wallet, reservation.getItemIds(), now.plusSeconds(30)));

        // Then
        assertThat(result.replay()).isFalse();
        assertThat(result.transaction().getTransactionSignature()).isEqualTo("sig-1");
        assertThat(result.transaction().getQuantity()).isEqualTo(2);
        assertThat(result.items()).extracting(Item::getState).containsOnly(ItemState.MINTED);
        assertThat(result.items()).extracting(Item::getOwnerWallet).containsOnly(wallet);

        Reservation confirmed = store.findReservation("key-1").orElseThrow();
        assertThat(confirmed.getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(confirmed.getTransactionSignature()).isEqualTo("sig-1");
        assertThat(store.countInventory(COLLECTION_ID).minted()).isEqualTo(2);
    }

    @Test
    @DisplayName("atomicConfirm - Same signature should replay the prior result")
    void atomicConfirm_SameSignature_Replays() {
        // Given
        String wallet = TestDataBuilder.wallet(4);
        store.atomicReserve(draft("key-1", wallet, 1, now), null);
        store.atomicConfirm(new ConfirmCommand("key-1", "sig-1", wallet, null, now));

        // When
        ConfirmedMint replay = store.atomicConfirm(new ConfirmCommand("key-1", "sig-1", wallet, null, now));

        // Then
        assertThat(replay.replay()).isTrue();
        assertThat(mintTransactionRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("atomicConfirm - Concurrent confirms with one signature: one mint, the rest replay")
    void atomicConfirm_ConcurrentSameSignature_AllSucceed() throws Exception {
        // Given
        String wallet = TestDataBuilder.wallet(4);
        store.atomicReserve(draft("key-1", wallet, 2, now), null);
        int callers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ConfirmedMint>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < callers; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return store.atomicConfirm(new ConfirmCommand("key-1", "sig-1", wallet, null, now));
            }));
        }
        start.countDown();
        int fresh = 0;
        for (Future<ConfirmedMint> future : futures) {
            ConfirmedMint result = future.get(60, TimeUnit.SECONDS);
            assertThat(result.transaction().getTransactionSignature()).isEqualTo("sig-1");
            assertThat(result.items()).hasSize(2);
            if (!result.replay()) {
                fresh++;
            }
        }
        executor.shutdown();

        // Then
        assertThat(fresh).isEqualTo(1);
        assertThat(mintTransactionRepository.count()).isEqualTo(1);
        assertThat(store.countInventory(COLLECTION_ID).minted()).isEqualTo(2);
    }

    @Test
    @DisplayName("atomicConfirm - Signature recorded for another key should conflict")
    void atomicConfirm_SignatureOfOtherKey_Conflicts() {
        // Given
        String wallet = TestDataBuilder.wallet(4);
        store.atomicReserve(draft("key-1", wallet, 1, now), null);
        store.atomicReserve(draft("key-2", wallet, 1, now), null);
        store.atomicConfirm(new ConfirmCommand("key-1", "sig-1", wallet, null, now));

        // When / Then
        assertThatThrownBy(() -> store.atomicConfirm(new ConfirmCommand("key-2", "sig-1", wallet, null, now)))
                .isInstanceOf(IdempotencyConflictException.class);
        assertThat(store.findReservation("key-2").orElseThrow().getStatus()).isEqualTo(ReservationStatus.PENDING);
    }

    @Test
    @DisplayName("atomicConfirm - Should reject wallet and item mismatches")
    void atomicConfirm_Mismatch_Rejected() {
        // Given
        String wallet = TestDataBuilder.wallet(4);
        store.atomicReserve(draft("key-1", wallet, 1, now), null);

        // When / Then
        assertThatThrownBy(() -> store.atomicConfirm(
                new ConfirmCommand("key-1", "sig-1", TestDataBuilder.wallet(5), null, now)))
                .isInstanceOf(MintValidationException.class);
        assertThatThrownBy(() -> store.atomicConfirm(
                new ConfirmCommand("key-1", "sig-1", wallet, List.of(COLLECTION_ID + "-item-9"), now)))
                .isInstanceOf(ItemsNotReservedException.class);
        assertThat(store.countInventory(COLLECTION_ID).minted()).isZero();
    }

    // ========================================
    // expireReservation Tests
    // ========================================

    @Test
    @DisplayName("expireReservation - Should release items of an expired reservation once")
    void expireReservation_ReleasesItems() {
        // Given
        Instant longAgo = now.minus(30, ChronoUnit.MINUTES);
        store.atomicReserve(draft("key-old", TestDataBuilder.wallet(6), 3, longAgo), null);
        store.atomicReserve(draft("key-new", TestDataBuilder.wallet(7), 1, now), null);

        // When
        List<String> expiredKeys = store.findExpiredReservationKeys(now, 10);
        boolean first = store.expireReservation("key-old", now);
        boolean second = store.expireReservation("key-old", now);

        // Then
        assertThat(expiredKeys).containsExactly("key-old");
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.findReservation("key-old").orElseThrow().getStatus()).isEqualTo(ReservationStatus.EXPIRED);

        InventoryCounts counts = store.countInventory(COLLECTION_ID);
        assertThat(counts.reserved()).isEqualTo(1);
        assertThat(counts.unsold()).isEqualTo(9);
    }

    @Test
    @DisplayName("expireReservation - Should not expire a reservation still inside its window")
    void expireReservation_NotYetDue_ReturnsFalse() {
        // Given
        store.atomicReserve(draft("key-1", TestDataBuilder.wallet(6), 1, now), null);

        // When
        boolean expired = store.expireReservation("key-1", now.plusSeconds(60));

        // Then
        assertThat(expired).isFalse();
        assertThat(store.countInventory(COLLECTION_ID).reserved()).isEqualTo(1);
    }

    @Test
    @DisplayName("atomicConfirm - Should reject confirmation after the sweep")
    void atomicConfirm_AfterExpiry_Rejected() {
        // Given
        String wallet = TestDataBuilder.wallet(6);
        Instant longAgo = now.minus(30, ChronoUnit.MINUTES);
        store.atomicReserve(draft("key-1", wallet, 1, longAgo), null);
        store.expireReservation("key-1", now);

        // When / Then
        assertThatThrownBy(() -> store.atomicConfirm(new ConfirmCommand("key-1", "sig-late", wallet, null, now)))
                .isInstanceOf(ReservationExpiredException.class);
        assertThat(mintTransactionRepository.count()).isZero();
    }

    // ========================================
    // Collection Tests
    // ========================================

    @Test
    @DisplayName("findCollection - Should resolve by id or ledger address")
    void findCollection_ByIdOrAddress() {
        // Given
        DropCollection collection = collectionRepository.findById(COLLECTION_ID).orElseThrow();

        // When / Then
        assertThat(store.findCollection(COLLECTION_ID)).isPresent();
        assertThat(store.findCollection(collection.getCollectionAddress()))
                .get()
                .extracting(DropCollection::getCollectionId)
                .isEqualTo(COLLECTION_ID);
        assertThat(store.findCollection("missing")).isEmpty();
    }

    @Test
    @DisplayName("refreshMintedCount - Sold out collection should become COMPLETED")
    void refreshMintedCount_SoldOut_Completes() {
        // Given
        seedCollection("col-small", 2, 241);
        String wallet = TestDataBuilder.wallet(8);
        Reservation reservation = store.atomicReserve(draftFor("col-small", "key-s", wallet, 2, now), null);
        store.atomicConfirm(new ConfirmCommand("key-s", "sig-s", wallet, reservation.getItemIds(), now));

        // When
        InventoryCounts counts = store.refreshMintedCount("col-small", now);

        // Then
        assertThat(counts.soldOut()).isTrue();
        DropCollection refreshed = collectionRepository.findById("col-small").orElseThrow();
        assertThat(refreshed.getMintedCount()).isEqualTo(2);
        assertThat(refreshed.getStatus()).isEqualTo(CollectionStatus.COMPLETED);
    }

    @Test
    @DisplayName("activateIfStarted - Draft becomes ACTIVE once its earliest phase has started")
    void activateIfStarted_ActivatesDraft() {
        // Given
        seedCollection("col-draft", 2, 242);
        collectionRepository.findById("col-draft").ifPresent(collection -> {
            collection.setStatus(CollectionStatus.DRAFT);
            collectionRepository.save(collection);
        });
        phaseRepository.save(TestDataBuilder.publicPhase("phase-late", "col-draft", BigDecimal.ONE,
                now.plusSeconds(3600), null));
        phaseRepository.save(TestDataBuilder.publicPhase("phase-early", "col-draft", BigDecimal.ONE,
                now.minusSeconds(60), null));

        // When
        boolean beforeStart = store.activateIfStarted("col-draft", now.minusSeconds(120));
        boolean afterStart = store.activateIfStarted("col-draft", now);
        boolean again = store.activateIfStarted("col-draft", now);

        // Then
        assertThat(beforeStart).isFalse();
        assertThat(afterStart).isTrue();
        assertThat(again).isFalse();
        assertThat(collectionRepository.findById("col-draft").orElseThrow().getStatus())
                .isEqualTo(CollectionStatus.ACTIVE);
        assertThat(store.findDraftCollections()).isEmpty();
    }

    private void seedCollection(String collectionId, int supply, int addressSeed) {
        DropCollection collection = TestDataBuilder.activeCollection(collectionId, supply);
        collection.setCollectionAddress(TestDataBuilder.wallet(addressSeed));
        collectionRepository.save(collection);
        itemRepository.saveAll(TestDataBuilder.items(collectionId, supply));
    }

    private Reservation draft(String key, String wallet, int quantity, Instant createdAt) {
        return draftFor(COLLECTION_ID, key, wallet, quantity, createdAt);
    }

    private Reservation draftFor(String collectionId, String key, String wallet, int quantity, Instant createdAt) {
        Reservation draft = TestDataBuilder.pendingReservation(key, collectionId, wallet, createdAt);
        draft.setQuantity(quantity);
        draft.setItemIds(new ArrayList<>());
        draft.setItemsTotalBaseUnits(draft.getUnitPriceBaseUnits() * quantity);
        return draft;
    }
}
