package io.objledger.storage;

import io.objledger.core.Owner;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.object.LedgerObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Arrays;

import static io.objledger.storage.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CommitRecordCodecTest {

    @TempDir Path logDir;

    @Test
    void header_carries_magic_version_length_and_checksum() {
        byte[] payload = {1, 2, 3};
        ByteBuffer b = ByteBuffer.wrap(CommitRecordCodec.frame(payload)).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals((short) 0xD17E, b.getShort());
        assertEquals(1, b.get());
        assertEquals(3, b.getInt());
        assertEquals(CommitRecordCodec.crc32(payload), b.getInt());
        assertEquals(CommitRecordCodec.HEADER_BYTES + 3, b.limit());
    }

    @Test
    void transaction_record_decodes_to_the_same_outputs() {
        LedgerObject gas = gas(id(0), ALICE, 1_000);
        LedgerObject obj = object(id(1), 3, Owner.address(ALICE));
        var c = new TxBuilder(gas).input(obj).wrap(obj.id(), id(9)).write(id(9), Owner.address(ALICE)).build();

        byte[] framed = CommitRecordCodec.encodeTransaction(c.tx(), c.outputs());
        var rec = (CommitRecordCodec.TransactionRecord) CommitRecordCodec.decode(
                Arrays.copyOfRange(framed, CommitRecordCodec.HEADER_BYTES, framed.length));

        assertEquals(c.tx(), rec.transaction());
        assertEquals(c.outputs(), rec.outputs());
    }

    @Test
    void unknown_kind_is_rejected() {
        assertThrows(BcsException.class, () -> CommitRecordCodec.decode(new byte[]{7}));
    }

    @Test
    void reader_stops_at_a_corrupt_checksum() throws Exception {
        LedgerObject a = object(id(1), 1, Owner.address(ALICE));
        LedgerObject b = object(id(2), 1, Owner.address(ALICE));
        byte[] bad = CommitRecordCodec.encodeGenesis(b);
        bad[bad.length - 1] ^= 0x01;

        try (var log = new FileCommitLog(logDir, 1L << 60)) {
            log.append(CommitRecordCodec.encodeGenesis(a));
            log.append(bad);
        }
        try (var log = new FileCommitLog(logDir, 1L << 60); var r = log.openReader()) {
            var first = (CommitRecordCodec.GenesisRecord) CommitRecordCodec.decode(r.next());
            assertEquals(a, first.object());
            assertNull(r.next());
        }
    }
}
