package com.sandkev.poolfees.chain;

import com.sandkev.poolfees.config.EtherscanClientConfig.EtherscanClientProperties;
import com.sandkev.poolfees.shared.http.QueryParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

@Slf4j
@RequiredArgsConstructor
public class EtherscanBlockchainClient implements BlockchainClient {

    private static final ParameterizedTypeReference<EtherscanResponse<String>> BLOCK_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<EtherscanResponse<List<ChainTransaction>>> TX_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient client;
    private final EtherscanClientProperties props;
    private final Clock clock;

    @Override
    public OptionalLong latestBlock() {
        var p = new LinkedHashMap<String, Object>();
        p.put("module", "block");
        p.put("action", "getblocknobytime");
        p.put("timestamp", clock.instant().getEpochSecond());
        p.put("closest", "before");

        EtherscanResponse<String> res = get(p, BLOCK_TYPE);
        if (res == null || res.result() == null) {
            log.warn("No latest block in etherscan response: {}", res);
            return OptionalLong.empty();
        }
        try {
            long block = Long.parseLong(res.result().trim());
            log.info("Latest block: {}", block);
            return OptionalLong.of(block);
        } catch (NumberFormatException e) {
            log.warn("Unparseable latest block '{}' (message={})", res.result(), res.message());
            return OptionalLong.empty();
        }
    }

    @Override
    public Optional<List<ChainTransaction>> historicalTransactions(long fromBlock, @Nullable Long toBlock) {
        var p = new LinkedHashMap<String, Object>();
        p.put("module", "account");
        p.put("action", "tokentx");
        p.put("contractaddress", props.tokenContract());
        p.put("address", props.poolAddress());
        p.put("page", 1);
        p.put("offset", props.pageSize());
        p.put("sort", "asc");
        p.put("startblock", fromBlock);
        if (toBlock != null) p.put("endblock", toBlock);
        p.put("apikey", props.apiKey());

        EtherscanResponse<List<ChainTransaction>> res = get(p, TX_TYPE);
        if (res == null || res.result() == null) {
            log.warn("No transaction list in etherscan response for blocks [{}, {}]", fromBlock, toBlock);
            return Optional.empty();
        }
        log.info("Fetched {} transactions for blocks [{}, {}]", res.result().size(), fromBlock, toBlock);
        return Optional.of(res.result());
    }

    @Override
    public int pageSize() {
        return props.pageSize();
    }

    /* -------------------- helpers -------------------- */

    @Nullable
    private <T> T get(Map<String, Object> params, ParameterizedTypeReference<T> type) {
        log.info("query etherscan: {}", masked(params));
        try {
            return client.get()
                    .uri(uri -> uri.queryParams(QueryParams.of(params)).build())
                    .retrieve()
                    .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class)
                            .map(body -> new IllegalStateException("Etherscan error " + r.statusCode().value() + ": " + body)))
                    .bodyToMono(type)
                    .block();
        } catch (RuntimeException e) {
            log.warn("Etherscan call failed params={} error={}", masked(params), e.toString());
            return null;
        }
    }

    private static Map<String, Object> masked(Map<String, Object> params) {
        if (!params.containsKey("apikey")) return params;
        var copy = new LinkedHashMap<>(params);
        copy.put("apikey", "***");
        return copy;
    }
}
