package com.bridgerelay.relay.config;

import com.bridgerelay.domain.LogFilter;
import com.bridgerelay.relay.action.ActionBuilder;
import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.checkpoint.CheckpointStore;
import com.bridgerelay.relay.checkpoint.FileCheckpointStore;
import com.bridgerelay.relay.job.RelayLoopRunner;
import com.bridgerelay.relay.job.RelayOrchestrator;
import com.bridgerelay.relay.scan.RangeScanner;
import com.bridgerelay.relay.scan.TokensLockedLogDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.util.List;

/**
 * Relay pipeline: checkpoint store, scanner, action builder, orchestrator and the loop that drives them.
 */
@Configuration
public class RelayPipelineConfig {

    public static final String RELAY_LOOP_EXECUTOR = "relay-loop-executor";

    @Bean
    public CheckpointStore checkpointStore(RelayerProperties relayer, ChainProperties chains, ObjectMapper objectMapper) {
        return new FileCheckpointStore(Path.of(relayer.getCheckpointFile()), chains.getSource().getChainId(),
                relayer.getDedupCapacity(), objectMapper);
    }

    @Bean
    public RangeScanner rangeScanner(@Qualifier("sourceChainClient") ChainClient sourceChainClient, ChainProperties chains) {
        ChainProperties.ChainEntry source = chains.getSource();
        LogFilter filter = new LogFilter(source.getBridgeContract(), List.of(TokensLockedLogDecoder.TOKENS_LOCKED_TOPIC));
        TokensLockedLogDecoder decoder = new TokensLockedLogDecoder(source.getBridgeContract(), source.getChainId(),
                chains.getDestination().getChainId());
        return new RangeScanner(sourceChainClient, filter, decoder);
    }

    @Bean
    public ActionBuilder actionBuilder(ChainProperties chains) {
        return new ActionBuilder(chains.getDestination().getChainId());
    }

    @Bean
    public RelayOrchestrator relayOrchestrator(
            @Qualifier("sourceChainClient") ChainClient sourceChainClient,
            @Qualifier("destinationChainClient") ChainClient destinationChainClient,
            CheckpointStore checkpointStore,
            RangeScanner rangeScanner,
            ActionBuilder actionBuilder,
            RelayerProperties relayer) {
        return new RelayOrchestrator(sourceChainClient, destinationChainClient, checkpointStore, rangeScanner,
                actionBuilder, relayer);
    }

    /** Single-thread executor for the relay loop; shutdown waits for the in-flight cycle to commit. */
    @Bean(name = RELAY_LOOP_EXECUTOR)
    public ThreadPoolTaskExecutor relayLoopExecutor(RelayerProperties relayer) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("relay-loop-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationMillis(relayer.getShutdownTimeout().toMillis());
        e.initialize();
        return e;
    }

    @Bean
    public RelayLoopRunner relayLoopRunner(RelayOrchestrator relayOrchestrator,
                                           @Qualifier(RELAY_LOOP_EXECUTOR) ThreadPoolTaskExecutor relayLoopExecutor) {
        return new RelayLoopRunner(relayOrchestrator, relayLoopExecutor);
    }
}
