package com.sandkev.poolfees.config;

import com.sandkev.poolfees.chain.BlockchainClient;
import com.sandkev.poolfees.chain.EtherscanBlockchainClient;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(EtherscanClientConfig.EtherscanClientProperties.class)
@RequiredArgsConstructor
public class EtherscanClientConfig {

    private final EtherscanClientProperties props;

    @Bean("etherscanWebClient")
    @Qualifier("etherscanWebClient")
    public WebClient etherscanWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024)) // a full tokentx page is several MB
                .build();
    }

    @Bean
    public BlockchainClient blockchainClient(
            @Qualifier("etherscanWebClient") WebClient etherscanWebClient,
            Clock clock
    ) {
        return new EtherscanBlockchainClient(etherscanWebClient, props, clock);
    }

    @ConfigurationProperties("etherscan.client")
    public record EtherscanClientProperties(
            String baseUrl,         // e.g. https://api.etherscan.io/api
            String apiKey,
            String poolAddress,     // address whose token transfers are tracked
            String tokenContract,   // token contract filtering those transfers
            int    pageSize,        // provider maximum is 10000
            int    timeoutMs
    ) {}
}
