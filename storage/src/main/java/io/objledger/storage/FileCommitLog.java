// file: src/main/java/io/objledger/storage/FileCommitLog.java
package io.objledger.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed commit log that appends framed records to numbered segment
 * files ("00000001.log", "00000002.log", ...).
 * <p>
 * Properties:
 *  - On construction it creates the directory if needed, opens the newest
 *    segment for append and cuts off any torn record at its tail, so new
 *    appends land right after the last valid record.
 * <p>
 *  - append() writes the bytes and calls force(true) to fsync data and
 *    metadata.
 * <p>
 *  - rotateIfNeeded() closes the current segment once it holds at least
 *    {@code rotateBytes} and opens the next one.
 * <p>
 *  - The reader walks all segments in name order, validates each header
 *    (magic, version, length) and payload CRC, and stops at the first
 *    invalid record.
 */
public class FileCommitLog implements CommitLog {
    private static final Logger log = Logger.getLogger(FileCommitLog.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileCommitLog(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create commit log directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true);
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new RuntimeException("Commit log append failed", e);
        }
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.fine(() -> "rotated commit log to " + current.getFileName());
        } catch (IOException e) {
            throw new RuntimeException("Commit log rotation failed", e);
        }
    }

    @Override
    public LogReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public void close() throws IOException {
        if (ch != null) ch.close();
    }

    static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    /**
     * Open the newest segment (or create "00000001.log") and position at the
     * end of its last valid record.
     */
    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long size = ch.size();
            long valid = validPrefix(ch);
            if (valid < size) {
                log.warning("truncating torn tail of " + current.getFileName() + ": " + (size - valid) + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open commit log segment " + current, e);
        }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log")).sorted().toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list commit log segments in " + dir, e);
        }
    }

    /** Length of the longest prefix of {@code ch} made of valid records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += CommitRecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record at {@code pos}, or null if there is no valid record there. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(CommitRecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (hdr.hasRemaining()) {
            int n = ch.read(hdr, pos + hdr.position());
            if (n <= 0) return null; // EOF or truncated header
        }
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != CommitRecordCodec.MAGIC || ver != CommitRecordCodec.VERSION || len < 0) return null;
        if (pos + CommitRecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int n = ch.read(payload, pos + CommitRecordCodec.HEADER_BYTES + payload.position());
            if (n <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (CommitRecordCodec.crc32(bytes) != crc) return null;
        return bytes;
    }

    /** Sequential reader over all segments, used during recovery. */
    private static final class Reader implements LogReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segment >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segment), READ);
                        pos = 0;
                    }
                    byte[] payload = readRecord(ch, pos);
                    if (payload != null) {
                        pos += CommitRecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        // invalid bytes before the end of a segment: nothing after them is trusted
                        stopped = true;
                        return null;
                    }
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to read commit log", e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new RuntimeException("Failed to close commit log reader", e);
            }
        }
    }
}
