package io.staking.core.storage;

import io.staking.core.events.EventCodec;
import io.staking.core.events.LedgerEvent;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Persistent EventJournal using RocksDB.
 *
 * Layout (column families):
 *  - "events" : key = sequence(8, big-endian), val = event JSON
 *  - "meta"   : key = "last-seq",             val = sequence(8, big-endian)
 */
public final class RocksDBEventJournal implements EventJournal, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] LAST_SEQ_KEY = "last-seq".getBytes(StandardCharsets.US_ASCII);

    private final RocksDB db;
    private final ColumnFamilyHandle cfEvents;
    private final ColumnFamilyHandle cfMeta;
    private final ColumnFamilyHandle cfDefault;
    private final DBOptions dbOptions;
    private long lastSequence;

    private RocksDBEventJournal(RocksDB db,
                                ColumnFamilyHandle cfDefault,
                                ColumnFamilyHandle cfEvents,
                                ColumnFamilyHandle cfMeta,
                                DBOptions dbOptions) throws RocksDBException {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfEvents = cfEvents;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
        byte[] last = db.get(cfMeta, LAST_SEQ_KEY);
        this.lastSequence = last == null ? 0L : bytesToLong(last);
    }

    /** Factory: open/create a journal in the given directory path. */
    public static RocksDBEventJournal open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("events".getBytes(StandardCharsets.US_ASCII)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.US_ASCII))
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        RocksDB db = null;
        try {
            db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBEventJournal(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            // same order as close(): handles, then the DB, options last
            for (ColumnFamilyHandle handle : cfHandles) {
                handle.close();
            }
            if (db != null) {
                db.close();
            }
            dbOpts.close();
            throw new IllegalStateException("Failed to open event journal at " + dataDir, e);
        }
    }

    @Override
    public synchronized long append(List<LedgerEvent> events) {
        if (events == null || events.isEmpty()) {
            return lastSequence;
        }
        long seq = lastSequence;
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (LedgerEvent event : events) {
                seq++;
                batch.put(cfEvents, longToBytes(seq), EventCodec.toBytes(event));
            }
            batch.put(cfMeta, LAST_SEQ_KEY, longToBytes(seq));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Event journal append failed at sequence " + (lastSequence + 1), e);
        }
        lastSequence = seq;
        return seq;
    }

    @Override
    public synchronized List<JournalEntry> readFrom(long fromSequence, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<JournalEntry> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfEvents)) {
            for (it.seek(longToBytes(Math.max(1L, fromSequence))); it.isValid() && out.size() < limit; it.next()) {
                out.add(new JournalEntry(bytesToLong(it.key()), EventCodec.fromBytes(it.value())));
            }
        }
        return out;
    }

    @Override
    public synchronized long lastSequence() {
        return lastSequence;
    }

    @Override
    public synchronized void close() {
        // handles before the DB, options last
        cfEvents.close();
        cfMeta.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }

    private static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    private static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }
}
