package com.pricefresh.tokenlist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricefresh.domain.TokenListEntry;
import com.pricefresh.freshness.FetchException;
import com.pricefresh.tokenlist.config.TokenListProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Token lists from the DEX aggregator's all-tokens endpoint, reached through the proxy function
 * ({@code action = "tokens"}). Errors fail the returned future; callers decide what to do.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OkxDexTokenListClient implements TokenListSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TokenListProperties tokenListProperties;
    private final WebClient.Builder webClientBuilder;

    @Override
    public CompletableFuture<List<TokenListEntry>> getTokens(String chainId) {
        Map<String, Object> body = Map.of("action", "tokens", "params", Map.of("chainIndex", chainId));
        return webClientBuilder.build()
                .post()
                .uri(tokenListProperties.getProxyUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(tokenListProperties.getReadTimeoutSeconds()))
                .toFuture()
                .thenApply(json -> {
                    List<TokenListEntry> tokens = parseTokens(json);
                    log.debug("Fetched {} tokens for chain {}", tokens.size(), chainId);
                    return tokens;
                });
    }

    /**
     * Parses the proxy response: a token array, or an object carrying "data" (array) or "error".
     */
    static List<TokenListEntry> parseTokens(String json) {
        if (json == null || json.isBlank()) {
            throw new FetchException("Empty token list response");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new FetchException("Failed to parse token list", e);
        }
        if (root.hasNonNull("error")) {
            throw new FetchException("Token list error: " + root.path("error").asText());
        }
        JsonNode tokens = root.isArray() ? root : root.path("data");
        if (!tokens.isArray()) {
            throw new FetchException("Token list response is not an array");
        }
        List<TokenListEntry> result = new ArrayList<>();
        for (JsonNode token : tokens) {
            String address = token.path("tokenContractAddress").asText("");
            if (address.isBlank()) {
                continue;
            }
            result.add(new TokenListEntry(
                    address,
                    token.path("tokenSymbol").asText(""),
                    token.path("tokenName").asText(""),
                    token.path("decimals").asInt(0),
                    token.path("tokenLogoUrl").asText(null)));
        }
        return List.copyOf(result);
    }
}
