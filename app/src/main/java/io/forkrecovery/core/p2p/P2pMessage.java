package io.forkrecovery.core.p2p;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.BlockCodec;
import io.forkrecovery.core.protocol.Hash;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public record P2pMessage(String type, Map<String, Object> payload) {
    public static final String HANDSHAKE = "handshake";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String GET_BLOCK = "get_block";
    public static final String BLOCK = "block";
    public static final String NEW_BLOCK = "new_block";

    public P2pMessage {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(payload);
    }

    public static P2pMessage handshake(String nodeId) {
        return new P2pMessage(HANDSHAKE, Map.of("nodeId", nodeId));
    }

    public static P2pMessage ping() {
        return new P2pMessage(PING, Map.of("ts", System.currentTimeMillis()));
    }

    public static P2pMessage pong() {
        return new P2pMessage(PONG, Map.of("ts", System.currentTimeMillis()));
    }

    public static P2pMessage getBlock(String requestId, Hash hash) {
        return new P2pMessage(GET_BLOCK, Map.of("requestId", requestId, "hash", hash.hex()));
    }

    /** Reply to get_block; a null block means "not found". */
    public static P2pMessage blockResponse(String requestId, Block block) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("requestId", requestId);
        payload.put("block", block == null ? null : BlockCodec.toMap(block));
        return new P2pMessage(BLOCK, payload);
    }

    public static P2pMessage newBlock(Block block) {
        return new P2pMessage(NEW_BLOCK, Map.of("block", BlockCodec.toMap(block)));
    }
}
