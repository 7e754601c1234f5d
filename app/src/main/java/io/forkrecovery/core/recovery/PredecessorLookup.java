package io.forkrecovery.core.recovery;

/**
 * Where a recovery step finds the block its candidate extends.
 * The first step bridges from persisted state; later steps extend what the session verified.
 */
enum PredecessorLookup {
    FROM_STORAGE,
    FROM_ACCUMULATED;

    static PredecessorLookup forAccumulated(boolean accumulatedEmpty) {
        return accumulatedEmpty ? FROM_STORAGE : FROM_ACCUMULATED;
    }
}
