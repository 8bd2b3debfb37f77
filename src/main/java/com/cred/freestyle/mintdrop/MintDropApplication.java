package com.cred.freestyle.mintdrop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Mint Drop Service - sells numbered items of a digital collection in timed phases.
 *
 * Flow:
 * 1. Reserve: buyer claims the next N unsold items under an idempotency key and receives an
 *    unsigned payment transaction (platform fee + creator payment)
 * 2. Buyer signs and submits the transaction to the ledger themselves
 * 3. Complete: the confirmed signature is recorded and the items are minted to the buyer
 * 4. Reservations not completed within the expiry window are swept and their items released
 *
 * Guarantees:
 * - No item is ever sold twice; minted count never exceeds total supply
 * - Every reserve and complete is idempotent (per key and per signature)
 * - Allocation is sequential by item index
 *
 * Technology Stack:
 * - Spring Boot 3.x
 * - PostgreSQL (row locks for atomic claims)
 * - Redis (display cache, shared last price)
 * - Kafka (lifecycle events, asset issuance requests)
 * - AWS CloudWatch (metrics)
 *
 * @author Mint Drop Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class MintDropApplication {

    public static void main(String[] args) {
        SpringApplication.run(MintDropApplication.class, args);
    }
}
