package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.exception.MintValidationException;
import com.cred.freestyle.mintdrop.infrastructure.ledger.LedgerAddress;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Composes the unsigned payment transaction a buyer signs for a reservation.
 *
 * Instructions, in order:
 * 1. PLATFORM_FEE: buyer -> platform wallet, the priced platform fee
 * 2. CREATOR_PAYMENT: buyer -> creator wallet, unit price x quantity, only when above zero
 *
 * The buyer pays the network fee. The recent checkpoint makes the network reject the
 * transaction once it goes stale. The memo ties the payment to the reservation key.
 * No asset issuance instruction is included; issuance happens after confirmation.
 *
 * Building is pure: no I/O, no clock.
 *
 * @author Mint Drop Team
 */
@Component
public class TransactionBuilder {

    public static final int FORMAT_VERSION = 1;
    public static final String MEMO_PREFIX = "mint:";

    private final ObjectMapper objectMapper;
    private final String platformWallet;

    public TransactionBuilder(
            ObjectMapper objectMapper,
            @Value("${mintdrop.platform.wallet}") String platformWallet
    ) {
        this.objectMapper = objectMapper;
        this.platformWallet = platformWallet;
    }

    /**
     * @param reservation reservation the payment is for
     * @param collection collection, for the creator wallet
     * @param buyerWallet signer and fee payer
     * @param unitPriceBaseUnits item price in base units
     * @param feeInBaseUnits platform fee in base units
     * @param recentCheckpoint recent network block hash
     * @return base64 encoded unsigned transaction
     */
    public String build(
            Reservation reservation,
            DropCollection collection,
            String buyerWallet,
            long unitPriceBaseUnits,
            long feeInBaseUnits,
            String recentCheckpoint
    ) {
        requireAddress("wallet", buyerWallet);
        requireAddress("creatorWallet", collection.getCreatorWallet());
        if (!LedgerAddress.isValid(platformWallet)) {
            throw new IllegalStateException("mintdrop.platform.wallet is not a valid ledger address");
        }
        if (recentCheckpoint == null || recentCheckpoint.isBlank()) {
            throw new IllegalArgumentException("A recent checkpoint is required");
        }
        if (unitPriceBaseUnits < 0 || feeInBaseUnits < 0) {
            throw new IllegalArgumentException("Amounts must not be negative");
        }

        List<TransferInstruction> instructions = new ArrayList<>();
        instructions.add(new TransferInstruction(
                InstructionKind.PLATFORM_FEE, buyerWallet, platformWallet, feeInBaseUnits));

        long creatorAmount = Math.multiplyExact(unitPriceBaseUnits, (long) reservation.getQuantity());
        if (creatorAmount > 0) {
            instructions.add(new TransferInstruction(
                    InstructionKind.CREATOR_PAYMENT, buyerWallet, collection.getCreatorWallet(), creatorAmount));
        }

        UnsignedTransaction transaction = new UnsignedTransaction(
                FORMAT_VERSION,
                buyerWallet,
                recentCheckpoint,
                MEMO_PREFIX + reservation.getIdempotencyKey(),
                instructions
        );

        try {
            byte[] json = objectMapper.writeValueAsString(transaction).getBytes(StandardCharsets.UTF_8);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode transaction for " + reservation.getIdempotencyKey(), e);
        }
    }

    /**
     * Decode a blob produced by {@link #build}.
     */
    public UnsignedTransaction decode(String blob) {
        try {
            return objectMapper.readValue(Base64.getDecoder().decode(blob), UnsignedTransaction.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new MintValidationException("transaction", "Not a transaction blob: " + e.getMessage());
        }
    }

    private static void requireAddress(String field, String address) {
        if (!LedgerAddress.isValid(address)) {
            throw new MintValidationException(field, String.format("'%s' is not a valid ledger address", address));
        }
    }

    public enum InstructionKind {
        PLATFORM_FEE,
        CREATOR_PAYMENT
    }

    public record TransferInstruction(InstructionKind kind, String from, String to, long amountBaseUnits) {}

    public record UnsignedTransaction(
            int version,
            String feePayer,
            String recentCheckpoint,
            String memo,
            List<TransferInstruction> instructions
    ) {}
}
