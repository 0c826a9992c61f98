// file: src/main/java/io/objledger/server/dto/ObjectResponse.java
package io.objledger.server.dto;

import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.object.PackageData;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * JSON response for GET /objects/{id}.
 * Example:
 *   {
 *     "reference": { "objectId": "0x..", "version": 4, "digest": "0x..", "owner": { "kind": "address", "value": "0x.." } },
 *     "type": "0x2::coin::Coin<0x2::gas::GAS>",
 *     "contentsBase64": "...",
 *     "previousTransaction": "0x.."
 *   }
 * Packages carry {@code modules} instead of {@code type} and {@code contentsBase64}.
 */
public class ObjectResponse {
    public ObjectRefView reference;
    public String type;
    public String contentsBase64;
    public List<String> modules;
    public String previousTransaction;

    public static ObjectResponse from(LedgerObject o) {
        ObjectResponse r = new ObjectResponse();
        r.reference = ObjectRefView.from(o.reference());
        r.reference.owner = OwnerView.from(o.owner());
        if (o.data() instanceof MoveObjectData m) {
            r.type = m.type().toCanonicalString();
            r.contentsBase64 = Base64.getEncoder().encodeToString(m.contents());
        } else {
            r.modules = new ArrayList<>(((PackageData) o.data()).modules().keySet());
        }
        r.previousTransaction = o.previousTransaction().toString();
        return r;
    }
}
