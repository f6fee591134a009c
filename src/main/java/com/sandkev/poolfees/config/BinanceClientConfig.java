package com.sandkev.poolfees.config;

import com.sandkev.poolfees.price.BinanceKlinePriceClient;
import com.sandkev.poolfees.price.PriceClient;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(BinanceClientConfig.BinanceClientProperties.class)
@RequiredArgsConstructor
public class BinanceClientConfig {

    private final BinanceClientProperties props;

    @Bean("binanceClient")
    @Qualifier("binanceClient")
    public WebClient binanceClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public PriceClient priceClient(@Qualifier("binanceClient") WebClient binanceClient) {
        return new BinanceKlinePriceClient(binanceClient, props);
    }

    @ConfigurationProperties("binance.client")
    public record BinanceClientProperties(
            String baseUrl,        // e.g. https://api.binance.com
            String symbol,         // e.g. ETHUSDT
            String interval,       // 1d
            int    limit,          // max candles per request, 1000
            int    maxWindowDays,  // 990 keeps a 1d window under the limit
            int    timeoutMs
    ) {}
}
