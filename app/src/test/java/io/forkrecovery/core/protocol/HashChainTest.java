package io.forkrecovery.core.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HashChainTest {

    private final Hash a = Hash.sha256("a".getBytes(StandardCharsets.UTF_8));
    private final Hash b = Hash.sha256("b".getBytes(StandardCharsets.UTF_8));
    private final Hash c = Hash.sha256("c".getBytes(StandardCharsets.UTF_8));

    @Test
    void prependMakesNewTip() {
        HashChain chain = HashChain.ofOldestFirst(List.of(a, b)).prepend(c);

        assertEquals(Optional.of(c), chain.tip());
        assertEquals(List.of(c, b, a), chain.newestFirst());
        assertEquals(List.of(a, b, c), chain.oldestFirst());
        assertEquals(3, chain.size());
    }

    @Test
    void bothOrdersDescribeTheSameChain() {
        assertEquals(HashChain.ofOldestFirst(List.of(a, b)), HashChain.ofNewestFirst(List.of(b, a)));
        assertTrue(HashChain.ofNewestFirst(List.of()).isEmpty());
        assertEquals(Optional.empty(), HashChain.empty().tip());
    }

    @Test
    void hexRoundTripsThroughHash() {
        assertEquals(a, Hash.fromHex(a.hex()));
        assertThrows(IllegalArgumentException.class, () -> Hash.fromHex("zz"));
    }
}
