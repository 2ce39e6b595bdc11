package com.bridgerelay.relay.config;

import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.adapter.RpcEndpointRotator;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RelayAdapterConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class, WebClientAutoConfiguration.class))
            .withUserConfiguration(RelayAdapterConfig.class)
            .withPropertyValues(
                    "bridgerelay.source.name=Ethereum",
                    "bridgerelay.source.chain-id=1",
                    "bridgerelay.source.urls[0]=https://eth-a.rpc",
                    "bridgerelay.source.urls[1]=https://eth-b.rpc",
                    "bridgerelay.source.bridge-contract=0x2222222222222222222222222222222222222222",
                    "bridgerelay.destination.chain-id=137",
                    "bridgerelay.destination.urls[0]=https://polygon.rpc",
                    "bridgerelay.destination.bridge-contract=0x5555555555555555555555555555555555555555",
                    "bridgerelay.relayer.signing-account=0x3333333333333333333333333333333333333333",
                    "bridgerelay.relayer.polling-interval=15s",
                    "bridgerelay.rpc.max-requests-per-second=7");

    @Test
    void bindsPropertiesAndWiresOneClientPerSide() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            ChainClient source = context.getBean("sourceChainClient", ChainClient.class);
            ChainClient destination = context.getBean("destinationChainClient", ChainClient.class);
            assertThat(source.chainId()).isEqualTo(1L);
            assertThat(destination.chainId()).isEqualTo(137L);

            RpcEndpointRotator sourceRotator = context.getBean("sourceRpcEndpointRotator", RpcEndpointRotator.class);
            assertThat(sourceRotator.getEndpoints()).containsExactly("https://eth-a.rpc", "https://eth-b.rpc");
            assertThat(sourceRotator.getMaxAttempts()).isEqualTo(3);

            RelayerProperties relayer = context.getBean(RelayerProperties.class);
            assertThat(relayer.getPollingInterval()).isEqualTo(Duration.ofSeconds(15));
            assertThat(relayer.getMaxWindowSize()).isEqualTo(100);
            assertThat(relayer.getConfirmationLag()).isEqualTo(12L);
            assertThat(relayer.getStartBlock()).isEqualTo(RelayerProperties.LATEST);

            RateLimiter limiter = context.getBean("evmRpcRateLimiter", RateLimiter.class);
            assertThat(limiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(7);
        });
    }

    @Test
    void missingSigningAccount_failsStartup() {
        contextRunner
                .withPropertyValues("bridgerelay.relayer.signing-account=")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void invalidStartBlock_failsStartup() {
        contextRunner
                .withPropertyValues("bridgerelay.relayer.start-block=yesterday")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void sideWithoutEndpoints_failsStartup() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class, WebClientAutoConfiguration.class))
                .withUserConfiguration(RelayAdapterConfig.class)
                .withPropertyValues(
                        "bridgerelay.source.chain-id=1",
                        "bridgerelay.source.urls[0]=https://eth-a.rpc",
                        "bridgerelay.destination.chain-id=137",
                        "bridgerelay.relayer.signing-account=0x3333333333333333333333333333333333333333")
                .run(context -> assertThat(context).hasFailed());
    }
}
