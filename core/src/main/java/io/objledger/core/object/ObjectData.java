// file: src/main/java/io/objledger/core/object/ObjectData.java
package io.objledger.core.object;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

/** Payload of a ledger object: a typed contract value or a package of modules. */
public sealed interface ObjectData permits MoveObjectData, PackageData {

    /** Size used for storage gas. */
    int sizeInBytes();

    static void encode(BcsWriter w, ObjectData data) {
        if (data instanceof MoveObjectData m) {
            w.writeUleb128(0);
            m.encodeBody(w);
        } else {
            w.writeUleb128(1);
            ((PackageData) data).encodeBody(w);
        }
    }

    static ObjectData decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == 0) return MoveObjectData.decodeBody(r);
        if (tag == 1) return PackageData.decodeBody(r);
        throw new BcsException("unknown object data tag: " + tag);
    }
}
