package com.pricefresh.tokenlist;

import com.pricefresh.domain.TokenListEntry;
import com.pricefresh.freshness.FetchException;
import com.pricefresh.tokenlist.config.TokenListProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkxDexTokenListClientTest {

    private static final String TOKENS = """
            {"data": [
              {"tokenContractAddress": "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee", "tokenSymbol": "OKB",
               "tokenName": "OKB", "decimals": "18", "tokenLogoUrl": "https://static.test/okb.png"},
              {"tokenContractAddress": "0x74b7f16337b8972027f6196a17a631ac6de26d22", "tokenSymbol": "USDC",
               "tokenName": "USD Coin", "decimals": 6},
              {"tokenSymbol": "NOADDR"}
            ]}
            """;

    private final List<ClientRequest> requests = new ArrayList<>();

    private OkxDexTokenListClient client(HttpStatus status, String body) {
        TokenListProperties props = new TokenListProperties();
        props.setProxyUrl("https://proxy.test/functions/v1/okx-dex");
        WebClient.Builder webClientBuilder = WebClient.builder()
                .exchangeFunction(req -> {
                    requests.add(req);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        return new OkxDexTokenListClient(props, webClientBuilder);
    }

    @Test
    @DisplayName("getTokens posts to the proxy and maps the token list")
    void getTokens() {
        List<TokenListEntry> tokens = client(HttpStatus.OK, TOKENS).getTokens("196").join();

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0)).isEqualTo(new TokenListEntry(
                "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee", "OKB", "OKB", 18, "https://static.test/okb.png"));
        assertThat(tokens.get(1).decimals()).isEqualTo(6);
        assertThat(tokens.get(1).logoUrl()).isNull();
        assertThat(requests).singleElement().satisfies(req -> {
            assertThat(req.method()).isEqualTo(HttpMethod.POST);
            assertThat(req.url().toString()).isEqualTo("https://proxy.test/functions/v1/okx-dex");
        });
    }

    @Test
    @DisplayName("HTTP error fails the future")
    void httpError() {
        CompletableFuture<List<TokenListEntry>> result = client(HttpStatus.BAD_GATEWAY, "{}").getTokens("1");

        assertThatThrownBy(result::join).hasCauseInstanceOf(WebClientResponseException.class);
    }

    @Test
    @DisplayName("parseTokens accepts a bare array")
    void bareArray() {
        List<TokenListEntry> tokens = OkxDexTokenListClient.parseTokens(
                "[{\"tokenContractAddress\": \"0xabc\", \"tokenSymbol\": \"ABC\", \"decimals\": 8}]");

        assertThat(tokens).extracting(TokenListEntry::symbol).containsExactly("ABC");
    }

    @Test
    @DisplayName("parseTokens rejects error payloads, empty bodies and non-arrays")
    void parseErrors() {
        assertThatThrownBy(() -> OkxDexTokenListClient.parseTokens("{\"error\": \"chain not supported\"}"))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("chain not supported");
        assertThatThrownBy(() -> OkxDexTokenListClient.parseTokens(""))
                .isInstanceOf(FetchException.class);
        assertThatThrownBy(() -> OkxDexTokenListClient.parseTokens("{\"data\": {}}"))
                .isInstanceOf(FetchException.class);
        assertThatThrownBy(() -> OkxDexTokenListClient.parseTokens("<html>"))
                .isInstanceOf(FetchException.class);
    }
}
