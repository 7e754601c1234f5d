package io.forkrecovery.core.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered block hashes describing one candidate history.
 * Kept newest-first, the way a block records its own ancestry: element 0 is the tip.
 */
public final class HashChain implements Iterable<Hash> {
    private static final HashChain EMPTY = new HashChain(List.of());

    private final List<Hash> newestFirst;

    private HashChain(List<Hash> newestFirst) {
        this.newestFirst = newestFirst;
    }

    public static HashChain empty() {
        return EMPTY;
    }

    public static HashChain ofNewestFirst(List<Hash> hashes) {
        if (hashes == null || hashes.isEmpty()) return EMPTY;
        for (Hash h : hashes) Objects.requireNonNull(h, "hash");
        return new HashChain(List.copyOf(hashes));
    }

    public static HashChain ofOldestFirst(List<Hash> hashes) {
        if (hashes == null || hashes.isEmpty()) return EMPTY;
        List<Hash> reversed = new ArrayList<>(hashes);
        Collections.reverse(reversed);
        return ofNewestFirst(reversed);
    }

    /** New chain with {@code hash} as its tip. */
    public HashChain prepend(Hash hash) {
        Objects.requireNonNull(hash, "hash");
        List<Hash> out = new ArrayList<>(newestFirst.size() + 1);
        out.add(hash);
        out.addAll(newestFirst);
        return new HashChain(Collections.unmodifiableList(out));
    }

    public Optional<Hash> tip() {
        return newestFirst.isEmpty() ? Optional.empty() : Optional.of(newestFirst.get(0));
    }

    public boolean contains(Hash hash) {
        return newestFirst.contains(hash);
    }

    public List<Hash> newestFirst() {
        return newestFirst;
    }

    public List<Hash> oldestFirst() {
        List<Hash> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return Collections.unmodifiableList(out);
    }

    public int size() { return newestFirst.size(); }

    public boolean isEmpty() { return newestFirst.isEmpty(); }

    @Override
    public Iterator<Hash> iterator() {
        return newestFirst.iterator();
    }

    @Override public boolean equals(Object o) {
        return o instanceof HashChain && newestFirst.equals(((HashChain) o).newestFirst);
    }

    @Override public int hashCode() { return newestFirst.hashCode(); }

    @Override public String toString() {
        return "HashChain{size=" + newestFirst.size() + ", tip=" + tip().map(Hash::toString).orElse("-") + "}";
    }
}
