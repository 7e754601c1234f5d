package io.forkrecovery.core.storage;

import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.BlockCodec;
import io.forkrecovery.core.protocol.Hash;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent LocalBlockStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks" : key = indepHash(32), val = block JSON (BlockCodec)
 *  - "meta"   : key = "head",        val = indepHash(32)
 *
 * writeBlocks goes through one synced WriteBatch, so a recovered chain lands all at once.
 */
public final class RocksDBBlockStore implements LocalBlockStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBBlockStore.class.getName());
    private static final byte[] HEAD_KEY = "head".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;

    private RocksDBBlockStore(RocksDB db,
                              ColumnFamilyHandle cfDefault,
                              ColumnFamilyHandle cfBlocks,
                              ColumnFamilyHandle cfMeta,
                              DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfBlocks = cfBlocks;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBBlockStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info(() -> "Opened block store at " + dataDir);
            return new RocksDBBlockStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new StorageException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized Optional<Block> readBlock(Hash hash) {
        if (hash == null) return Optional.empty();
        try {
            byte[] body = db.get(cfBlocks, hash.bytes());
            if (body == null) return Optional.empty();
            return Optional.of(BlockCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new StorageException("readBlock failed", e);
        }
    }

    @Override
    public synchronized void writeBlocks(List<Block> blocks) {
        if (blocks == null || blocks.isEmpty()) return;
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            for (Block block : blocks) {
                if (block == null) throw new StorageException("null block in batch");
                batch.put(cfBlocks, block.indepHash().bytes(), BlockCodec.toBytes(block));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new StorageException("writeBlocks failed", e);
        }
    }

    @Override
    public synchronized Optional<Hash> getHead() {
        try {
            byte[] head = db.get(cfMeta, HEAD_KEY);
            return head == null ? Optional.empty() : Optional.of(Hash.of(head));
        } catch (RocksDBException e) {
            throw new StorageException("getHead failed", e);
        }
    }

    @Override
    public synchronized void setHead(Hash hash) {
        try {
            if (hash == null) {
                db.delete(cfMeta, HEAD_KEY);
                return;
            }
            if (db.get(cfBlocks, hash.bytes()) == null) {
                throw new IllegalArgumentException("Unknown head hash");
            }
            db.put(cfMeta, HEAD_KEY, hash.bytes());
        } catch (RocksDBException e) {
            throw new StorageException("setHead failed", e);
        }
    }

    @Override
    public synchronized long size() {
        try (RocksIterator it = db.newIterator(cfBlocks)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        // Column family handles first, then the DB and its options
        for (AutoCloseable c : new AutoCloseable[] {cfBlocks, cfMeta, cfDefault, db, dbOptions}) {
            try {
                if (c != null) c.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close RocksDB resource", e);
            }
        }
    }
}
