package com.bridgerelay.relay.adapter;

import com.bridgerelay.domain.LogFilter;
import com.bridgerelay.domain.RawLog;
import com.bridgerelay.domain.RelayAction;
import com.bridgerelay.domain.SignedAction;
import com.bridgerelay.domain.SubmissionHandle;

import java.util.List;

/**
 * Capability the relay core needs from one chain. One instance per side (source, destination).
 * All calls block until the node answers or the client gives up.
 */
public interface ChainClient {

    /** Numeric chain id this client is configured for. */
    long chainId();

    /**
     * Current head block number.
     *
     * @throws RpcException on transport or JSON-RPC failure
     */
    long getTipHeight();

    /**
     * Raw logs in the inclusive block range matching the filter, in node order.
     *
     * @throws RpcException on transport or JSON-RPC failure
     */
    List<RawLog> getLogs(long fromBlock, long toBlock, LogFilter filter);

    /**
     * Sign the action with the given relayer key.
     *
     * @throws SubmissionException if the signer is unreachable or refuses
     */
    SignedAction sign(RelayAction action, String key);

    /**
     * Broadcast a signed action.
     *
     * @throws SubmissionRejectedException if the node rejects the transaction permanently
     * @throws SubmissionException         on any retryable failure
     */
    SubmissionHandle submit(SignedAction signedAction);
}
