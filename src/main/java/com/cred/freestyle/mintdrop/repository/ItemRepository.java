package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.Item;
import com.cred.freestyle.mintdrop.domain.model.Item.ItemState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for Item entity operations.
 * State transitions are single UPDATE statements guarded by the expected current state,
 * so a row that changed underneath the caller is never overwritten.
 *
 * @author Mint Drop Team
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, String> {

    /**
     * Lowest-index unsold items of a collection, row-locked for the current transaction.
     *
     * @param collectionId Collection ID
     * @param quantity Max number of rows
     * @return Item IDs ordered by item index
     */
    @Query(value = "SELECT item_id FROM items " +
                   "WHERE collection_id = :collectionId AND state = 'UNSOLD' " +
                   "ORDER BY item_index LIMIT :quantity FOR UPDATE",
           nativeQuery = true)
    List<String> lockUnsoldItemIds(@Param("collectionId") String collectionId,
                                   @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.state = :reserved, i.reservationKey = :reservationKey, i.reservedAt = :reservedAt " +
           "WHERE i.itemId IN :itemIds AND i.state = :unsold")
    int reserveItems(@Param("itemIds") List<String> itemIds,
                     @Param("reservationKey") String reservationKey,
                     @Param("reservedAt") Instant reservedAt,
                     @Param("unsold") ItemState unsold,
                     @Param("reserved") ItemState reserved);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.state = :minted, i.ownerWallet = :ownerWallet, " +
           "i.mintSignature = :mintSignature, i.mintedAt = :mintedAt " +
           "WHERE i.reservationKey = :reservationKey AND i.state = :reserved")
    int mintReservedItems(@Param("reservationKey") String reservationKey,
                          @Param("ownerWallet") String ownerWallet,
                          @Param("mintSignature") String mintSignature,
                          @Param("mintedAt") Instant mintedAt,
                          @Param("reserved") ItemState reserved,
                          @Param("minted") ItemState minted);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.state = :unsold, i.reservationKey = NULL, i.reservedAt = NULL " +
           "WHERE i.reservationKey = :reservationKey AND i.state = :reserved")
    int releaseReservedItems(@Param("reservationKey") String reservationKey,
                             @Param("reserved") ItemState reserved,
                             @Param("unsold") ItemState unsold);

    List<Item> findByMintSignatureOrderByItemIndexAsc(String mintSignature);

    List<Item> findByCollectionIdOrderByItemIndexAsc(String collectionId);

    long countByCollectionIdAndState(String collectionId, ItemState state);

    /**
     * Item counts per state for one collection.
     *
     * @return rows of [ItemState, Long]
     */
    @Query("SELECT i.state, COUNT(i) FROM Item i WHERE i.collectionId = :collectionId GROUP BY i.state")
    List<Object[]> countByStateForCollection(@Param("collectionId") String collectionId);
}
