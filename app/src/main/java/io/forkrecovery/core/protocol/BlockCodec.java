package io.forkrecovery.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.forkrecovery.core.state.WalletState;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a block, shared by the RocksDB store and the P2P wire.
 * The encoded indep_hash is checked against the recomputed one on decode.
 */
public final class BlockCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private BlockCodec(){}

    public static ObjectNode toJson(Block block) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("indep_hash", block.indepHash().hex());
        node.put("height", block.height());
        node.put("previous_block", block.previousBlock().hex());
        ArrayNode hashList = node.putArray("hash_list");
        for (Hash h : block.hashList()) hashList.add(h.hex());
        ObjectNode wallets = node.putObject("wallet_list");
        for (Map.Entry<String, WalletState.Account> e : block.walletState().accounts().entrySet()) {
            ObjectNode acct = wallets.putObject(e.getKey());
            acct.put("balance", e.getValue().balance());
            acct.put("nonce", e.getValue().nonce());
        }
        ArrayNode txs = node.putArray("txs");
        for (Transaction tx : block.transactions()) {
            ObjectNode t = txs.addObject();
            t.put("from", tx.from());
            t.put("to", tx.to());
            t.put("amount", tx.amountMinor());
            t.put("fee", tx.feeMinor());
            t.put("nonce", tx.nonce());
            t.put("timestamp", tx.timestamp());
        }
        node.put("timestamp", block.timestamp());
        node.put("difficulty", block.difficulty());
        node.put("nonce", block.nonce());
        return node;
    }

    public static Block fromJson(JsonNode node) {
        try {
            if (node == null || !node.isObject()) throw new IllegalArgumentException("block must be an object");

            List<Hash> hashList = new ArrayList<>();
            for (JsonNode h : required(node, "hash_list")) hashList.add(Hash.fromHex(h.asText()));

            Map<String, WalletState.Account> accounts = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = required(node, "wallet_list").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                accounts.put(e.getKey(), new WalletState.Account(
                        required(e.getValue(), "balance").asLong(),
                        required(e.getValue(), "nonce").asLong()));
            }

            List<Transaction> txs = new ArrayList<>();
            for (JsonNode t : required(node, "txs")) {
                txs.add(Transaction.builder()
                        .from(required(t, "from").asText())
                        .to(required(t, "to").asText())
                        .amountMinor(required(t, "amount").asLong())
                        .feeMinor(required(t, "fee").asLong())
                        .nonce(required(t, "nonce").asLong())
                        .timestamp(required(t, "timestamp").asLong())
                        .build());
            }

            Block block = Block.builder()
                    .height(required(node, "height").asLong())
                    .previousBlock(Hash.fromHex(required(node, "previous_block").asText()))
                    .hashList(HashChain.ofNewestFirst(hashList))
                    .walletState(WalletState.of(accounts))
                    .transactions(txs)
                    .timestamp(required(node, "timestamp").asLong())
                    .difficulty(required(node, "difficulty").asLong())
                    .nonce(required(node, "nonce").asLong())
                    .build();

            JsonNode claimed = node.get("indep_hash");
            if (claimed != null && !block.indepHash().equals(Hash.fromHex(claimed.asText()))) {
                throw new IllegalArgumentException("indep_hash does not match block contents");
            }
            return block;
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed block JSON", ex);
        }
    }

    public static byte[] toBytes(Block block) {
        try {
            return MAPPER.writeValueAsBytes(toJson(block));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode block", e);
        }
    }

    public static Block fromBytes(byte[] bytes) {
        try {
            return fromJson(MAPPER.readTree(bytes));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed block bytes", e);
        }
    }

    /** Plain map form, for embedding in P2P message payloads. */
    public static Map<String, Object> toMap(Block block) {
        return MAPPER.convertValue(toJson(block), MAP_TYPE);
    }

    public static Block fromObject(Object value) {
        return fromJson(MAPPER.valueToTree(value));
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("missing field: " + field);
        return v;
    }
}
