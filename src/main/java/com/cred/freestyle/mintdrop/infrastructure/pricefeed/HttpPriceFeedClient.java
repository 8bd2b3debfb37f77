package com.cred.freestyle.mintdrop.infrastructure.pricefeed;

import com.cred.freestyle.mintdrop.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;

/**
 * Price feed over HTTP. Expects a payload shaped like {"data": {"SOL": {"price": 142.17}}}.
 *
 * @author Mint Drop Team
 */
@Component
public class HttpPriceFeedClient implements PriceFeedClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpPriceFeedClient.class);
    private static final String UPSTREAM = "price-feed";

    private final RestClient restClient;
    private final String priceUrl;
    private final String symbol;

    public HttpPriceFeedClient(
            RestClient.Builder restClientBuilder,
            @Value("${mintdrop.price-oracle.url:https://quote-api.jup.ag/v6/price?ids=SOL,USDT}") String priceUrl,
            @Value("${mintdrop.price-oracle.symbol:SOL}") String symbol,
            @Value("${mintdrop.price-oracle.timeout-ms:5000}") int timeoutMs
    ) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
        this.priceUrl = priceUrl;
        this.symbol = symbol;
    }

    @Override
    public BigDecimal fetchFiatPerCoin() {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(priceUrl)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "Price feed request failed: " + e.getMessage(), e);
        }

        JsonNode price = body == null ? null : body.path("data").path(symbol).path("price");
        if (price == null || !price.isNumber()) {
            throw new UpstreamUnavailableException(UPSTREAM, "Price feed returned no numeric price for " + symbol);
        }

        BigDecimal value = price.decimalValue();
        if (value.signum() <= 0) {
            throw new UpstreamUnavailableException(UPSTREAM, "Price feed returned non-positive price " + value);
        }
        logger.debug("Fetched {} price: {}", symbol, value);
        return value;
    }
}
