package com.bridgerelay.relay.adapter.evm;

import com.bridgerelay.common.Hex;
import com.bridgerelay.domain.LogFilter;
import com.bridgerelay.domain.RawLog;
import com.bridgerelay.domain.RelayAction;
import com.bridgerelay.domain.SignedAction;
import com.bridgerelay.domain.SubmissionHandle;
import com.bridgerelay.relay.adapter.ChainClient;
import com.bridgerelay.relay.adapter.RpcEndpointRotator;
import com.bridgerelay.relay.adapter.RpcException;
import com.bridgerelay.relay.adapter.SubmissionException;
import com.bridgerelay.relay.adapter.SubmissionRejectedException;
import com.bridgerelay.relay.config.EvmRpcProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ChainClient} over EVM JSON-RPC: eth_blockNumber, eth_getLogs, eth_signTransaction, eth_sendRawTransaction.
 * <p>
 * Reads retry across the rotator's endpoints with backoff, skip endpoints that are cooling down after rate limits
 * or upstream errors, and split an eth_getLogs range in half when the node refuses it as too wide.
 * Signing and submission are single attempts: the relay loop decides when to retry them.
 * <p>
 * eth_sendRawTransaction only admits a transaction to the mempool. A mint that reverts once mined is still
 * reported as submitted; a revert is only seen as a permanent rejection when the node or signer simulates the
 * call before admission. Admission errors such as "nonce too low" or "insufficient funds" stay retryable, since
 * the next cycle signs again with a fresh nonce.
 */
@Slf4j
public class EvmChainClient implements ChainClient {

    private final long chainId;
    private final String chainName;
    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final EvmRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;
    private final String bridgeContract;
    private final long gasLimit;

    public EvmChainClient(
            long chainId,
            String chainName,
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            RateLimiter rateLimiter,
            EvmRpcProperties rpcProperties,
            ObjectMapper objectMapper,
            String bridgeContract,
            long gasLimit
    ) {
        this.chainId = chainId;
        this.chainName = chainName;
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
        this.bridgeContract = Hex.lower(bridgeContract);
        this.gasLimit = gasLimit;
    }

    @Override
    public long chainId() {
        return chainId;
    }

    @Override
    public long getTipHeight() {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            pauseBeforeRetry(attempt);
            String endpoint = nextEndpoint();
            try {
                JsonNode result = resultOf(callRpc(endpoint, "eth_blockNumber", Collections.emptyList()), "eth_blockNumber");
                String hex = result.asText(null);
                try {
                    return Hex.parseQuantity(hex);
                } catch (NumberFormatException e) {
                    throw new RpcException("eth_blockNumber invalid result: " + hex, e);
                }
            } catch (RpcException e) {
                lastException = e;
                markCooldownIfNeeded(endpoint, e);
                log.debug("{}: eth_blockNumber attempt {} on {} failed: {}", chainName, attempt + 1, endpoint, messageOf(e));
            }
        }
        throw exhausted("eth_blockNumber", lastException);
    }

    @Override
    public List<RawLog> getLogs(long fromBlock, long toBlock, LogFilter filter) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        return fetchLogsWithRetry(fromBlock, toBlock, filter);
    }

    private List<RawLog> fetchLogsWithRetry(long fromBlock, long toBlock, LogFilter filter) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            pauseBeforeRetry(attempt);
            String endpoint = nextEndpoint();
            try {
                return ethGetLogs(endpoint, fromBlock, toBlock, filter);
            } catch (RpcException e) {
                lastException = e;
                markCooldownIfNeeded(endpoint, e);
                if (isRangeTooWideError(e) && toBlock > fromBlock) {
                    log.warn("{}: reducing block range [{}-{}] due to RPC limitation on {}: {}",
                            chainName, fromBlock, toBlock, endpoint, e.getMessage());
                    long mid = fromBlock + (toBlock - fromBlock) / 2;
                    List<RawLog> combined = new ArrayList<>(fetchLogsWithRetry(fromBlock, mid, filter));
                    combined.addAll(fetchLogsWithRetry(mid + 1, toBlock, filter));
                    return combined;
                }
            }
        }
        throw exhausted("eth_getLogs [" + fromBlock + "-" + toBlock + "]", lastException);
    }

    private List<RawLog> ethGetLogs(String endpoint, long fromBlock, long toBlock, LogFilter filter) {
        Map<String, Object> params = new HashMap<>();
        params.put("fromBlock", Hex.toQuantity(fromBlock));
        params.put("toBlock", Hex.toQuantity(toBlock));
        if (filter.address() != null) {
            params.put("address", filter.address());
        }
        if (!filter.topics().isEmpty()) {
            params.put("topics", List.of(filter.topics()));
        }
        JsonNode result = resultOf(callRpc(endpoint, "eth_getLogs", Collections.singletonList(params)), "eth_getLogs");
        if (!result.isArray()) {
            return List.of();
        }
        List<RawLog> logs = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            logs.add(toRawLog(node));
        }
        return logs;
    }

    private static RawLog toRawLog(JsonNode node) {
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(t.asText()));
        return new RawLog(
                node.path("address").asText(null),
                topics,
                node.path("data").asText(null),
                node.path("blockNumber").asText(null),
                node.path("transactionHash").asText(null),
                node.path("logIndex").asText(null),
                node.path("removed").asBoolean(false)
        );
    }

    @Override
    public SignedAction sign(RelayAction action, String key) {
        if (!Hex.isAddress(key)) {
            throw new IllegalArgumentException("Signing account must be a 20-byte hex address");
        }
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", Hex.lower(key));
        tx.put("to", bridgeContract);
        tx.put("gas", Hex.toQuantity(gasLimit));
        tx.put("value", "0x0");
        tx.put("data", MintCallEncoder.encode(action));
        tx.put("chainId", Hex.toQuantity(chainId));
        String endpoint = nextEndpoint();
        JsonNode result;
        try {
            result = resultOf(callRpc(endpoint, "eth_signTransaction", Collections.singletonList(tx)), "eth_signTransaction");
        } catch (RpcException e) {
            markCooldownIfNeeded(endpoint, e);
            throw new SubmissionException("eth_signTransaction failed on " + endpoint + ": " + messageOf(e), e);
        }
        String raw;
        String txHash = null;
        if (result.isTextual()) {
            raw = result.asText();
        } else {
            raw = result.path("raw").asText(null);
            txHash = result.path("tx").path("hash").asText(null);
        }
        if (raw == null || !raw.startsWith("0x") || raw.length() <= 2) {
            throw new SubmissionException("eth_signTransaction returned no raw transaction: " + result);
        }
        return new SignedAction(action, raw, txHash);
    }

    @Override
    public SubmissionHandle submit(SignedAction signedAction) {
        String endpoint = nextEndpoint();
        try {
            JsonNode result = resultOf(
                    callRpc(endpoint, "eth_sendRawTransaction", Collections.singletonList(signedAction.rawTransaction())),
                    "eth_sendRawTransaction");
            return new SubmissionHandle(result.asText(signedAction.transactionHash()), false);
        } catch (RpcException e) {
            if (isAlreadyKnown(e)) {
                log.info("{}: transaction for {} already known to {}", chainName,
                        signedAction.action().idempotencyKey(), endpoint);
                return new SubmissionHandle(signedAction.transactionHash(), true);
            }
            markCooldownIfNeeded(endpoint, e);
            if (isPermanentRejection(e)) {
                throw new SubmissionRejectedException("eth_sendRawTransaction rejected by " + endpoint + ": " + messageOf(e), e);
            }
            throw new SubmissionException("eth_sendRawTransaction failed on " + endpoint + ": " + messageOf(e), e);
        }
    }

    public static boolean isRangeTooWideError(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("log response size exceeded");
    }

    static boolean isRateLimited(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("request limit") || msg.contains("-32005");
    }

    static boolean isEndpointTransientUnavailable(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("temporary internal error") || msg.contains("please retry")
                || msg.contains("timed out") || msg.contains("timeout")
                || msg.contains("connection refused")
                || msg.contains("503") || msg.contains("502") || msg.contains("504");
    }

    static boolean isAlreadyKnown(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("already known") || msg.contains("known transaction")
                || msg.contains("already imported");
    }

    static boolean isPermanentRejection(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("execution reverted") || msg.contains("invalid opcode");
    }

    private JsonNode resultOf(String json, String method) {
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            throw new RpcException(method + " response has no result");
        }
        return result;
    }

    private String callRpc(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, rpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        try {
            return rpcClient.call(endpoint, method, params)
                    .block(Duration.ofMillis(Math.max(1L, rpcProperties.getRequestTimeoutMs())));
        } catch (RpcException e) {
            throw e;
        } catch (IllegalStateException e) {
            throw new RpcException(method + " timed out on " + endpoint, e);
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed on " + endpoint + ": " + messageOf(e), e);
        }
    }

    private void pauseBeforeRetry(int attempt) {
        if (attempt == 0) {
            return;
        }
        try {
            Thread.sleep(rotator.retryDelayMs(attempt - 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    private RpcException exhausted(String operation, RpcException lastException) {
        String msg = chainName + ": " + operation + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        return new RpcException(msg, lastException);
    }

    private String nextEndpoint() {
        return rotator.nextEndpoint();
    }

    private void markCooldownIfNeeded(String endpoint, Exception cause) {
        if (isRateLimited(cause)) {
            rotator.coolDown(endpoint, rpcProperties.getEndpointCooldownMs(), "suspected RPC rate-limit: " + messageOf(cause));
        } else if (isEndpointTransientUnavailable(cause)) {
            rotator.coolDown(endpoint, rpcProperties.getTransientErrorCooldownMs(), "transient upstream error: " + messageOf(cause));
        }
    }

    private static String messageOf(Exception e) {
        if (e == null || e.getMessage() == null || e.getMessage().isBlank()) {
            return "unknown";
        }
        return e.getMessage();
    }
}
