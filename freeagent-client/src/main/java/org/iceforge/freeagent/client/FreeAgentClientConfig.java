package org.iceforge.freeagent.client;

import org.iceforge.freeagent.cache.CacheMetricsRegistry;
import org.iceforge.freeagent.cache.CacheStore;
import org.iceforge.freeagent.cache.InMemoryCacheStore;
import org.iceforge.freeagent.cache.NoOpCacheStore;
import org.iceforge.freeagent.client.auth.AccessTokenProvider;
import org.iceforge.freeagent.client.auth.StaticAccessTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(FreeAgentProperties.class)
public class FreeAgentClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(FreeAgentClientConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "freeagent.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CacheStore freeAgentCacheStore(FreeAgentProperties props) {
        logger.info("FreeAgent cache enabled (ttl={})", props.getCache().getTtl());
        return new InMemoryCacheStore(Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(prefix = "freeagent.cache", name = "enabled", havingValue = "false")
    public CacheStore freeAgentNoOpCacheStore() {
        logger.info("FreeAgent cache disabled; every read goes to the API");
        return new NoOpCacheStore();
    }

    @Bean
    public CacheMetricsRegistry freeAgentCacheMetrics() {
        return new CacheMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessTokenProvider freeAgentAccessTokenProvider(FreeAgentProperties props) {
        String token = props.getAccessToken();
        return new StaticAccessTokenProvider(token == null ? "" : token);
    }

    @Bean
    public FreeAgentHttp freeAgentHttp(ObjectProvider<WebClient.Builder> builders,
                                       FreeAgentProperties props,
                                       AccessTokenProvider tokens) {
        props.validate();
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .responseTimeout(props.getRequestTimeout());
        WebClient.Builder builder = builders.getIfAvailable(WebClient::builder)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
        logger.info("FreeAgent client targeting {}", props.resolvedApiBaseUrl());
        return new FreeAgentHttp(builder, props, tokens);
    }

    @Bean
    public FreeAgentClient freeAgentClient(FreeAgentHttp http, CacheStore store, CacheMetricsRegistry metrics,
                                           FreeAgentProperties props) {
        return new FreeAgentClient(http, store, metrics, props.getCache().getTtl());
    }
}
