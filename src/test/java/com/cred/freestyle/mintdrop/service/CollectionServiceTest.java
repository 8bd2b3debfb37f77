package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.DropCollection.CollectionStatus;
import com.cred.freestyle.mintdrop.domain.model.Item.ItemState;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.exception.ResourceNotFoundException;
import com.cred.freestyle.mintdrop.infrastructure.cache.MintCacheService;
import com.cred.freestyle.mintdrop.infrastructure.metrics.MintMetricsService;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmCommand;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.InventoryCounts;
import com.cred.freestyle.mintdrop.service.CollectionService.CollectionAvailability;
import com.cred.freestyle.mintdrop.testutil.InMemoryMintInventoryStore;
import com.cred.freestyle.mintdrop.testutil.MutableClock;
import com.cred.freestyle.mintdrop.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CollectionService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CollectionService Unit Tests")
class CollectionServiceTest {

    private static final Instant NOON = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant ONE_PM = Instant.parse("2026-03-01T13:00:00Z");

    @Mock
    private PriceOracleService priceOracleService;

    @Mock
    private MintCacheService cacheService;

    @Mock
    private MintMetricsService metricsService;

    private InMemoryMintInventoryStore store;
    private CollectionService collectionService;

    @BeforeEach
    void setUp() {
        store = new InMemoryMintInventoryStore();
        PhaseResolver phaseResolver = new PhaseResolver(new AllowListVerifier(), priceOracleService);
        collectionService = new CollectionService(store, phaseResolver, cacheService, metricsService,
                new MutableClock(ONE_PM));

        store.addCollection(TestDataBuilder.activeCollection("col-1", 4), TestDataBuilder.items("col-1", 4));
        store.addPhase(TestDataBuilder.publicPhase("phase-public", "col-1", BigDecimal.ONE, NOON, null));
        store.addPhase(TestDataBuilder.publicPhase("phase-later", "col-1", BigDecimal.TEN,
                ONE_PM.plusSeconds(3600), null));
    }

    // ========================================
    // getAvailability() Tests
    // ========================================

    @Test
    @DisplayName("getAvailability - Cache miss: Counts derived from item state and cached")
    void getAvailability_CacheMiss() {
        // Given
        when(cacheService.getAvailability("col-1")).thenReturn(Optional.empty());
        reserveOne("key-0001", TestDataBuilder.wallet(1));

        // When
        CollectionAvailability availability = collectionService.getAvailability("col-1");

        // Then
        assertThat(availability.fromCache()).isFalse();
        assertThat(availability.counts()).isEqualTo(new InventoryCounts(4, 0, 1, 3));
        assertThat(availability.activePhase()).map(phase -> phase.getPhaseId()).contains("phase-public");
        assertThat(availability.openPhases()).hasSize(1);
        assertThat(availability.asOf()).isEqualTo(ONE_PM);
        verify(cacheService).setAvailability("col-1", new InventoryCounts(4, 0, 1, 3));
        verify(metricsService).recordInventoryLevel("col-1", 3);
    }

    @Test
    @DisplayName("getAvailability - Cache hit: Cached counts returned, store counts skipped")
    void getAvailability_CacheHit() {
        // Given
        InventoryCounts cached = new InventoryCounts(4, 1, 0, 3);
        when(cacheService.getAvailability("col-1")).thenReturn(Optional.of(cached));

        // When
        CollectionAvailability availability = collectionService.getAvailability("col-1");

        // Then
        assertThat(availability.fromCache()).isTrue();
        assertThat(availability.counts()).isEqualTo(cached);
        verify(cacheService, never()).setAvailability(anyString(), any());
    }

    @Test
    @DisplayName("getAvailability - Unknown collection: NotFound")
    void getAvailability_UnknownCollection() {
        assertThatThrownBy(() -> collectionService.getAvailability("col-missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ========================================
    // refreshMintedCounts() Tests
    // ========================================

    @Test
    @DisplayName("refreshMintedCounts - Updates the cached minted count from item state")
    void refreshMintedCounts_UpdatesCount() {
        // Given
        reserveOne("key-0001", TestDataBuilder.wallet(1));
        store.atomicConfirm(new ConfirmCommand("key-0001", "sig-0001", TestDataBuilder.wallet(1), null, ONE_PM));

        // When
        int refreshed = collectionService.refreshMintedCounts();

        // Then
        assertThat(refreshed).isEqualTo(1);
        assertThat(store.findCollection("col-1").orElseThrow().getMintedCount()).isEqualTo(1);
        assertThat(store.findCollection("col-1").orElseThrow().getStatus()).isEqualTo(CollectionStatus.ACTIVE);
        verify(cacheService, never()).invalidateAvailability(anyString());
    }

    @Test
    @DisplayName("refreshMintedCounts - Sold-out collection is completed and its cache dropped")
    void refreshMintedCounts_SoldOut() {
        // Given
        Reservation draft = TestDataBuilder.pendingReservation("key-all", "col-1", TestDataBuilder.wallet(1), ONE_PM);
        draft.setQuantity(4);
        draft.getItemIds().clear();
        store.atomicReserve(draft, null);
        store.atomicConfirm(new ConfirmCommand("key-all", "sig-all", TestDataBuilder.wallet(1), null, ONE_PM));

        // When
        collectionService.refreshMintedCounts();

        // Then
        assertThat(store.countItems("col-1", ItemState.MINTED)).isEqualTo(4);
        assertThat(store.findCollection("col-1").orElseThrow().getStatus()).isEqualTo(CollectionStatus.COMPLETED);
        verify(cacheService).invalidateAvailability("col-1");
        assertThat(store.findActiveCollections()).isEmpty();
    }

    // ========================================
    // activateStartedCollections() Tests
    // ========================================

    @Test
    @DisplayName("activateStartedCollections - Draft whose first phase has started becomes ACTIVE")
    void activateStartedCollections_FirstPhaseStarted() {
        // Given
        addDraft("col-draft");
        store.addPhase(TestDataBuilder.publicPhase("phase-d1", "col-draft", BigDecimal.ONE, NOON, null));
        store.addPhase(TestDataBuilder.publicPhase("phase-d2", "col-draft", BigDecimal.ONE,
                ONE_PM.plusSeconds(3600), null));

        // When
        int activated = collectionService.activateStartedCollections();

        // Then
        assertThat(activated).isEqualTo(1);
        assertThat(store.findCollection("col-draft").orElseThrow().getStatus()).isEqualTo(CollectionStatus.ACTIVE);
        verify(cacheService).invalidateAvailability("col-draft");
    }

    @Test
    @DisplayName("activateStartedCollections - Draft whose first phase starts later stays DRAFT")
    void activateStartedCollections_FirstPhaseInFuture() {
        // Given
        addDraft("col-draft");
        store.addPhase(TestDataBuilder.publicPhase("phase-d1", "col-draft", BigDecimal.ONE,
                ONE_PM.plusSeconds(60), null));

        // When
        int activated = collectionService.activateStartedCollections();

        // Then
        assertThat(activated).isZero();
        assertThat(store.findCollection("col-draft").orElseThrow().getStatus()).isEqualTo(CollectionStatus.DRAFT);
        verify(cacheService, never()).invalidateAvailability(anyString());
    }

    @Test
    @DisplayName("activateStartedCollections - Draft without phases stays DRAFT; active collections untouched")
    void activateStartedCollections_NoPhases() {
        // Given
        addDraft("col-empty");

        // When
        int activated = collectionService.activateStartedCollections();

        // Then
        assertThat(activated).isZero();
        assertThat(store.findCollection("col-empty").orElseThrow().getStatus()).isEqualTo(CollectionStatus.DRAFT);
        assertThat(store.findCollection("col-1").orElseThrow().getStatus()).isEqualTo(CollectionStatus.ACTIVE);
    }

    @Test
    @DisplayName("activateStartedCollections - Activated collection can be reserved from")
    void activateStartedCollections_ThenReservable() {
        // Given
        addDraft("col-draft");
        store.addPhase(TestDataBuilder.publicPhase("phase-d1", "col-draft", BigDecimal.ONE, NOON, null));

        // When
        collectionService.activateStartedCollections();
        Reservation draft = TestDataBuilder.pendingReservation("key-d", "col-draft", TestDataBuilder.wallet(5), ONE_PM);
        draft.getItemIds().clear();
        Reservation reserved = store.atomicReserve(draft, null);

        // Then
        assertThat(reserved.getItemIds()).containsExactly("col-draft-item-0");
        assertThat(store.findActiveCollections()).extracting(c -> c.getCollectionId())
                .containsExactlyInAnyOrder("col-1", "col-draft");
    }

    private void addDraft(String collectionId) {
        DropCollection draft = TestDataBuilder.activeCollection(collectionId, 2);
        draft.setStatus(CollectionStatus.DRAFT);
        store.addCollection(draft, TestDataBuilder.items(collectionId, 2));
    }

    private void reserveOne(String key, String wallet) {
        Reservation draft = TestDataBuilder.pendingReservation(key, "col-1", wallet, ONE_PM);
        draft.getItemIds().clear();
        store.atomicReserve(draft, null);
    }
}
