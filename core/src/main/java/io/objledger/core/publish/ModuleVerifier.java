// file: src/main/java/io/objledger/core/publish/ModuleVerifier.java
package io.objledger.core.publish;

import io.objledger.core.AccountAddress;
import io.objledger.core.types.SignatureToken;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural checks on a deserialized module before it may be published.
 * Returns a description of the first violation, or null when the module is valid.
 */
public final class ModuleVerifier {
    private ModuleVerifier() {}

    public static String verify(ModuleDescriptor module) {
        if (!isIdentifier(module.name())) {
            return "invalid module name '" + module.name() + "'";
        }
        Set<String> names = new HashSet<>();
        for (StructDef s : module.structs()) {
            if (!names.add(s.name())) return "duplicate struct " + s.name();
            if (s.hasKey()) {
                String err = verifyObjectLayout(s);
                if (err != null) return err;
            }
        }
        names.clear();
        for (FunctionDef f : module.functions()) {
            if (!names.add(f.name())) return "duplicate function " + f.name();
            for (SignatureToken r : f.returns()) {
                if (r instanceof SignatureToken.Reference || r instanceof SignatureToken.MutableReference) {
                    if (f.callable()) return "callable function " + f.name() + " returns a reference";
                }
            }
        }
        return null;
    }

    /** A struct with key must have {@code id: 0x2::object::UID} as its first field. */
    private static String verifyObjectLayout(StructDef s) {
        if (s.fields().isEmpty() || !s.fields().get(0).name().equals("id")) {
            return "First field of struct " + s.name() + " must be 'id'";
        }
        SignatureToken t = s.fields().get(0).type();
        boolean isUid = t instanceof SignatureToken.Struct st
                && st.address().equals(AccountAddress.FRAMEWORK)
                && st.module().equals("object")
                && st.name().equals("UID")
                && st.typeArgs().isEmpty();
        if (!isUid) {
            return "First field of struct " + s.name() + " must be of type 0x2::object::UID";
        }
        return null;
    }

    private static boolean isIdentifier(String s) {
        if (s.isEmpty() || Character.isDigit(s.charAt(0))) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) return false;
        }
        return true;
    }
}
