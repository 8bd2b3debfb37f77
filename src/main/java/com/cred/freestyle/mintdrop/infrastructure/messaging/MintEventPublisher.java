package com.cred.freestyle.mintdrop.infrastructure.messaging;

import com.cred.freestyle.mintdrop.infrastructure.messaging.events.AssetIssuanceRequest;
import com.cred.freestyle.mintdrop.infrastructure.messaging.events.ReservationLifecycleEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for mint lifecycle events and asset issuance requests.
 *
 * Publishing is best-effort: the store is the source of truth, so a failed send
 * is logged and never fails the request that triggered it.
 *
 * Topic partitioning:
 * - Key: collection_id (all events of one collection land on the same partition, in order)
 *
 * @author Mint Drop Team
 */
@Service
public class MintEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(MintEventPublisher.class);

    public static final String RESERVATION_TOPIC = "mint-drop-reservations";
    public static final String ASSET_ISSUANCE_TOPIC = "mint-drop-asset-issuance";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public MintEventPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    public void publishLifecycleEvent(ReservationLifecycleEvent event) {
        publish(RESERVATION_TOPIC, event.getCollectionId(), event,
                event.getEventType() + " event for reservation " + event.getIdempotencyKey());
    }

    public void publishAssetIssuance(AssetIssuanceRequest request) {
        publish(ASSET_ISSUANCE_TOPIC, request.getCollectionId(), request,
                "asset issuance for signature " + request.getPaymentSignature());
    }

    private void publish(String topic, String key, Object payloadObject, String description) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payloadObject);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {}", description, e);
            return;
        }

        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} to {}, partition: {}",
                            description, topic, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} to {}", description, topic, ex);
                }
            });
        } catch (Exception e) {
            // send() itself throws when the producer cannot fetch metadata in time
            logger.error("Failed to publish {} to {}", description, topic, e);
        }
    }
}
