// file: src/main/java/io/objledger/server/dto/EffectsResponse.java
package io.objledger.server.dto;

import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.effects.ExecutionStatus;
import io.objledger.core.effects.OwnedObjectRef;
import io.objledger.core.effects.TransactionEffects;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a transaction's effects, returned by POST /transactions and
 * GET /effects/{digest}. {@code effectsBcsBase64} is the canonical encoding
 * the effects digest is computed over.
 */
public class EffectsResponse {
    public String status;          // "success" or "failure"
    public String error;           // failure status, absent on success
    public Integer failedCommand;  // command index of the failure, if any
    public String transactionDigest;
    public long lamportVersion;
    public List<ObjectRefView> created;
    public List<ObjectRefView> mutated;
    public List<ObjectRefView> unwrapped;
    public List<ObjectRefView> deleted;
    public List<ObjectRefView> wrapped;
    public List<ObjectRefView> unwrappedThenDeleted;
    public ObjectRefView gasObject;
    public Map<String, Long> modifiedAtVersions;
    public List<ObjectRefView> sharedObjects;
    public List<String> dependencies;
    public long computationCost;
    public long storageCost;
    public String effectsDigest;
    public String effectsBcsBase64;

    public static EffectsResponse from(TransactionEffects e) {
        EffectsResponse r = new EffectsResponse();
        if (e.status() instanceof ExecutionStatus.Failure f) {
            r.status = "failure";
            r.error = f.error().toString();
            r.failedCommand = f.command();
        } else {
            r.status = "success";
        }
        r.transactionDigest = e.transactionDigest().toString();
        r.lamportVersion = e.lamportVersion().value();
        r.created = owned(e.created());
        r.mutated = owned(e.mutated());
        r.unwrapped = owned(e.unwrapped());
        r.deleted = refs(e.deleted());
        r.wrapped = refs(e.wrapped());
        r.unwrappedThenDeleted = refs(e.unwrappedThenDeleted());
        r.gasObject = ObjectRefView.from(e.gasObject());
        r.modifiedAtVersions = new LinkedHashMap<>();
        for (Map.Entry<ObjectID, SequenceNumber> m : e.modifiedAtVersions().entrySet()) {
            r.modifiedAtVersions.put(m.getKey().toString(), m.getValue().value());
        }
        r.sharedObjects = refs(e.sharedObjects());
        r.dependencies = new ArrayList<>();
        for (TransactionDigest d : e.dependencies()) r.dependencies.add(d.toString());
        r.computationCost = e.gasUsed().computationCost();
        r.storageCost = e.gasUsed().storageCost();
        r.effectsDigest = "0x" + HexFormat.of().formatHex(e.digest());
        r.effectsBcsBase64 = Base64.getEncoder().encodeToString(e.encode());
        return r;
    }

    private static List<ObjectRefView> owned(List<OwnedObjectRef> refs) {
        List<ObjectRefView> out = new ArrayList<>(refs.size());
        for (OwnedObjectRef ref : refs) out.add(ObjectRefView.from(ref));
        return out;
    }

    private static List<ObjectRefView> refs(List<ObjectRef> refs) {
        List<ObjectRefView> out = new ArrayList<>(refs.size());
        for (ObjectRef ref : refs) out.add(ObjectRefView.from(ref));
        return out;
    }
}
