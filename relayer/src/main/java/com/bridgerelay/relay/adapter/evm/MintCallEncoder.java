package com.bridgerelay.relay.adapter.evm;

import com.bridgerelay.common.Hex;
import com.bridgerelay.domain.RelayAction;

/**
 * ABI calldata for {@code mintTokens(address token, address recipient, uint256 amount, bytes32 sourceTransactionHash)}.
 * All four arguments are static, so the payload is the selector followed by four 32-byte words.
 * The bytes32 slot carries the SHA-256 digest of the action's idempotency key; the destination contract rejects replays of it.
 */
public final class MintCallEncoder {

    /** First 4 bytes of keccak256("mintTokens(address,address,uint256,bytes32)"). */
    public static final String MINT_TOKENS_SELECTOR = "7b6b2329";

    private MintCallEncoder() {
    }

    public static String encode(RelayAction action) {
        return "0x" + MINT_TOKENS_SELECTOR
                + Hex.padWord(Hex.strip0x(action.assetId()))
                + Hex.padWord(Hex.strip0x(action.recipient()))
                + Hex.padWord(action.amount())
                + Hex.encode(action.idempotencyKey().digest());
    }
}
