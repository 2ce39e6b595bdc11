package com.bridgerelay.relay.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries and endpoint rotation live in {@link EvmChainClient}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params (positional list)
     * @return response body as string (JSON); errors with RpcException on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
