// file: src/main/java/io/objledger/storage/CommitRecordCodec.java
package io.objledger.storage;

import io.objledger.core.ObjectID;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.effects.TransactionEffects;
import io.objledger.core.effects.TransactionOutputs;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;
import io.objledger.core.tx.TransactionData;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for commit log records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD17E
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (canonical binary encoding)]
 *     - kind: u8, 0 = genesis object, 1 = transaction
 *     - genesis:     the object
 *     - transaction: tx bytes, effects bytes, written objects, tombstones
 */
final class CommitRecordCodec {
    static final short MAGIC = (short) 0xD17E;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final int KIND_GENESIS = 0;
    private static final int KIND_TRANSACTION = 1;

    private CommitRecordCodec() {}

    /** A decoded payload. */
    sealed interface CommitRecord permits GenesisRecord, TransactionRecord {}

    record GenesisRecord(LedgerObject object) implements CommitRecord {}

    record TransactionRecord(TransactionData transaction, TransactionOutputs outputs) implements CommitRecord {}

    static byte[] encodeGenesis(LedgerObject object) {
        BcsWriter w = new BcsWriter().writeU8(KIND_GENESIS);
        object.encode(w);
        return frame(w.toByteArray());
    }

    static byte[] encodeTransaction(TransactionData tx, TransactionOutputs outputs) {
        BcsWriter w = new BcsWriter().writeU8(KIND_TRANSACTION);
        w.writeBytes(tx.toBytes());
        w.writeBytes(outputs.effects().encode());
        w.writeVector(outputs.written(), (ww, o) -> o.encode(ww));
        w.writeVector(outputs.tombstones().values(), ObjectEntry::encode);
        return frame(w.toByteArray());
    }

    /** Prefix {@code payload} with the record header. */
    static byte[] frame(byte[] payload) {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        byte[] out = new byte[HEADER_BYTES + payload.length];
        System.arraycopy(header.array(), 0, out, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    /**
     * Decode a payload (without header).
     *
     * @throws BcsException if the payload is not a well-formed record
     */
    static CommitRecord decode(byte[] payload) {
        return BcsReader.decode(payload, r -> {
            int kind = r.readU8();
            if (kind == KIND_GENESIS) {
                return new GenesisRecord(LedgerObject.decode(r));
            }
            if (kind != KIND_TRANSACTION) throw new BcsException("unknown commit record kind: " + kind);
            TransactionData tx = TransactionData.fromBytes(r.readBytes());
            TransactionEffects effects = BcsReader.decode(r.readBytes(), TransactionEffects::decode);
            List<LedgerObject> written = r.readVector(LedgerObject::decode);
            Map<ObjectID, ObjectEntry> tombstones = new HashMap<>();
            for (ObjectEntry e : r.readVector(ObjectEntry::decode)) tombstones.put(e.id(), e);
            return new TransactionRecord(tx, new TransactionOutputs(effects, written, tombstones));
        });
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
