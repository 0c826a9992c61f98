// file: src/main/java/io/objledger/storage/CommitLog.java
package io.objledger.storage;

/**
 * Append-only log of committed records, replayed on startup.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated
 *    as absent during recovery (the reader stops at the first corrupt or
 *    truncated record),
 *  - append() fsyncs before returning, so a record whose append returned is
 *    seen by recovery after a crash.
 */
public interface CommitLog extends AutoCloseable {

    /**
     * Append one framed record and fsync it.
     *
     * @param framedRecord header+payload bytes from {@link CommitRecordCodec#frame}
     */
    void append(byte[] framedRecord);

    /** Start a new segment once the current one reaches the size threshold. */
    void rotateIfNeeded();

    /**
     * Sequential reader over every segment, oldest first. It stops at the
     * first corrupt header, truncated payload or bad checksum.
     */
    LogReader openReader();

    interface LogReader extends AutoCloseable {

        /** @return next valid payload (without header), or null at the end of valid data */
        byte[] next();

        @Override
        void close();
    }
}
