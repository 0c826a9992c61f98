// file: src/main/java/io/objledger/server/dto/OwnerView.java
package io.objledger.server.dto;

import io.objledger.core.Owner;

/**
 * Owner as JSON: {"kind": "address", "value": "0x..."}. {@code value} is the
 * address, the parent id or the initial shared version, and absent for
 * immutable objects.
 */
public class OwnerView {
    public String kind;
    public String value;

    public static OwnerView from(Owner owner) {
        OwnerView v = new OwnerView();
        if (owner instanceof Owner.AddressOwner a) {
            v.kind = "address";
            v.value = a.address().toString();
        } else if (owner instanceof Owner.ObjectOwner o) {
            v.kind = "object";
            v.value = o.parent().toString();
        } else if (owner instanceof Owner.Shared s) {
            v.kind = "shared";
            v.value = Long.toString(s.initialSharedVersion().value());
        } else {
            v.kind = "immutable";
        }
        return v;
    }
}
