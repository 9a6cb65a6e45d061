package com.ledgersync.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.config.MarketDataProperties;
import com.ledgersync.exception.MarketDataException;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Reads daily closes from a Yahoo-style chart endpoint:
 * {@code GET {base}/v8/finance/chart/{symbol}?range=1y&interval=1d}.
 *
 * <p>Null closes (halted days) are skipped.
 */
public class RestPriceHistorySource implements PriceHistorySource {

    private static final Logger log = LoggerFactory.getLogger(RestPriceHistorySource.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String range;

    public RestPriceHistorySource(MarketDataProperties properties, ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());
        this.restClient = RestClient.builder()
                .baseUrl(properties.getHistoryBaseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
        this.range = properties.getHistoryRange();
        log.info("Price history source initialised: {} (range {})", properties.getHistoryBaseUrl(), range);
    }

    RestPriceHistorySource(RestClient restClient, ObjectMapper objectMapper, String range) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.range = range;
    }

    @Override
    public List<BigDecimal> dailyCloses(String symbol) {
        String body;
        try {
            body = restClient
                    .get()
                    .uri("/v8/finance/chart/{symbol}?range={range}&interval=1d", symbol, range)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new MarketDataException(symbol, "Price history request failed for " + symbol + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new MarketDataException(symbol, "Empty price history response for " + symbol);
        }
        try {
            List<BigDecimal> closes = parseCloses(objectMapper.readTree(body));
            log.debug("Fetched {} daily closes for {}", closes.size(), symbol);
            return closes;
        } catch (IOException e) {
            throw new MarketDataException(symbol, "Unreadable price history for " + symbol, e);
        }
    }

    /** Extracts {@code chart.result[0].indicators.quote[0].close}, skipping nulls. */
    public static List<BigDecimal> parseCloses(JsonNode root) {
        JsonNode result = root.path("chart").path("result");
        if (!result.isArray() || result.isEmpty()) {
            String error = root.path("chart").path("error").path("description").asText("no result");
            throw new MarketDataException("unknown", "Chart API returned no data: " + error);
        }
        JsonNode closes = result.get(0).path("indicators").path("quote").path(0).path("close");
        List<BigDecimal> values = new ArrayList<>();
        for (JsonNode close : closes) {
            if (close.isNumber()) {
                values.add(close.decimalValue());
            }
        }
        return values;
    }
}
