package com.cred.freestyle.mintdrop.infrastructure.ledger;

import com.cred.freestyle.mintdrop.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Ledger client speaking the network's JSON-RPC dialect over HTTP.
 *
 * Methods used:
 * - getLatestBlockhash: freshness checkpoint for unsigned transactions
 * - getSignatureStatuses: confirmation state of a buyer-submitted signature
 *
 * @author Mint Drop Team
 */
@Component
@ConditionalOnProperty(prefix = "mintdrop.ledger", name = "mode", havingValue = "rpc")
public class JsonRpcLedgerClient implements LedgerClient {

    private static final Logger logger = LoggerFactory.getLogger(JsonRpcLedgerClient.class);
    private static final String UPSTREAM = "ledger";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String rpcUrl;
    private final String commitment;

    public JsonRpcLedgerClient(
            RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper,
            @Value("${mintdrop.ledger.rpc-url}") String rpcUrl,
            @Value("${mintdrop.ledger.commitment:confirmed}") String commitment,
            @Value("${mintdrop.ledger.timeout-ms:5000}") int timeoutMs
    ) {
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("mintdrop.ledger.rpc-url must be configured when mintdrop.ledger.mode=rpc");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
        this.objectMapper = objectMapper;
        this.rpcUrl = rpcUrl.trim();
        this.commitment = commitment;
    }

    @Override
    public String getRecentCheckpoint() {
        JsonNode result = rpcCall("getLatestBlockhash", List.of(Map.of("commitment", commitment)));
        String blockhash = result.path("value").path("blockhash").asText("");
        if (blockhash.isBlank()) {
            throw new UpstreamUnavailableException(UPSTREAM, "getLatestBlockhash returned no blockhash");
        }
        return blockhash;
    }

    @Override
    public SignatureStatus getSignatureStatus(String signature) {
        JsonNode result = rpcCall("getSignatureStatuses",
                List.of(List.of(signature), Map.of("searchTransactionHistory", true)));
        JsonNode status = result.path("value").path(0);
        if (status.isMissingNode() || status.isNull()) {
            return SignatureStatus.UNKNOWN;
        }
        if (!status.path("err").isNull() && !status.path("err").isMissingNode()) {
            return SignatureStatus.FAILED;
        }
        String confirmation = status.path("confirmationStatus").asText("");
        if ("confirmed".equals(confirmation) || "finalized".equals(confirmation)) {
            return SignatureStatus.CONFIRMED;
        }
        return SignatureStatus.PENDING;
    }

    private JsonNode rpcCall(String method, List<?> params) {
        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri(rpcUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of(
                            "jsonrpc", "2.0",
                            "id", 1,
                            "method", method,
                            "params", params
                    ))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            logger.warn("Ledger RPC {} failed: {}", method, e.getMessage());
            throw new UpstreamUnavailableException(UPSTREAM, "Ledger RPC " + method + " failed", e);
        }

        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            JsonNode errorNode = root.get("error");
            if (errorNode != null && !errorNode.isNull()) {
                throw new UpstreamUnavailableException(UPSTREAM, "Ledger RPC error for " + method + ": " + errorNode);
            }
            JsonNode resultNode = root.get("result");
            if (resultNode == null || resultNode.isNull()) {
                throw new UpstreamUnavailableException(UPSTREAM, "Ledger RPC " + method + " returned no result");
            }
            return resultNode;
        } catch (IOException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "Unreadable ledger RPC response for " + method, e);
        }
    }
}
