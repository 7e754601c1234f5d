package io.forkrecovery.core.recovery;

import io.forkrecovery.core.protocol.HashChain;

import java.util.Objects;

/** Success message: the target's hash prepended to the target's own recorded chain. */
public record ForkRecovered(HashChain newChain) {
    public ForkRecovered {
        Objects.requireNonNull(newChain, "newChain");
    }
}
