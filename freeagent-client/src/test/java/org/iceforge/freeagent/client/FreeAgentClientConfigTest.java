package org.iceforge.freeagent.client;

import org.iceforge.freeagent.cache.CacheMetricsRegistry;
import org.iceforge.freeagent.cache.CacheStore;
import org.iceforge.freeagent.cache.InMemoryCacheStore;
import org.iceforge.freeagent.cache.NoOpCacheStore;
import org.iceforge.freeagent.client.auth.AccessTokenProvider;
import org.iceforge.freeagent.client.auth.StaticAccessTokenProvider;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FreeAgentClientConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(FreeAgentClientConfig.class);

    @Test
    void wiresClientWithInMemoryCacheByDefault() {
        runner.withPropertyValues("freeagent.access-token=abc", "freeagent.cache.ttl=PT2M")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(ctx).hasSingleBean(FreeAgentClient.class);
                    assertThat(ctx).hasSingleBean(CacheMetricsRegistry.class);
                    assertThat(ctx.getBean(CacheStore.class)).isInstanceOf(InMemoryCacheStore.class);
                    assertThat(ctx.getBean(FreeAgentProperties.class).getCache().getTtl()).isEqualTo(Duration.ofMinutes(2));
                    assertThat(ctx.getBean(FreeAgentClient.class).contacts().cache().defaultTtl())
                            .isEqualTo(Duration.ofMinutes(2));
                });
    }

    @Test
    void disabledCacheUsesNoOpStore() {
        runner.withPropertyValues("freeagent.access-token=abc", "freeagent.cache.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(CacheStore.class);
                    assertThat(ctx.getBean(CacheStore.class)).isInstanceOf(NoOpCacheStore.class);
                });
    }

    @Test
    void missingTokenFailsStartup() {
        runner.run(ctx -> {
            assertThat(ctx).hasFailed();
            assertThat(ctx.getStartupFailure())
                    .rootCause()
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Invalid FreeAgent configuration")
                    .hasMessageContaining("access-token");
        });
    }

    @Test
    void customTokenProviderReplacesStaticToken() {
        runner.withBean(AccessTokenProvider.class, () -> () -> "from-vault")
                .withPropertyValues("freeagent.access-token=abc")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(AccessTokenProvider.class);
                    assertThat(ctx.getBean(AccessTokenProvider.class)).isNotInstanceOf(StaticAccessTokenProvider.class);
                    assertThat(ctx.getBean(AccessTokenProvider.class).accessToken()).isEqualTo("from-vault");
                });
    }
}
