package io.objledger.core;

import io.objledger.core.args.PackageResolver;
import io.objledger.core.publish.Ability;
import io.objledger.core.publish.FieldDef;
import io.objledger.core.publish.FunctionDef;
import io.objledger.core.publish.ModuleDescriptor;
import io.objledger.core.publish.StructDef;
import io.objledger.core.types.KnownTypes;
import io.objledger.core.types.PrimitiveType;
import io.objledger.core.types.SignatureToken;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Module "m" of {@link TestObjects#PACKAGE}, with one function per argument shape. */
public final class TestPackages {
    public static final SignatureToken OBJ = new SignatureToken.Struct(AccountAddress.ZERO, "m", "Obj");
    public static final SignatureToken UID = SignatureToken.of(KnownTypes.UID);

    public static final ModuleDescriptor MODULE = new ModuleDescriptor("m",
            List.of(new StructDef("Obj", EnumSet.of(Ability.KEY, Ability.STORE), 0,
                    List.of(new FieldDef("id", UID), new FieldDef("value", new SignatureToken.Primitive(PrimitiveType.U64))))),
            List.of(
                    fn("take", List.of(OBJ), List.of()),
                    fn("borrow", List.of(new SignatureToken.Reference(OBJ)), List.of()),
                    fn("borrow_mut", List.of(new SignatureToken.MutableReference(OBJ)), List.of()),
                    fn("make", List.of(), List.of(OBJ)),
                    fn("make_two", List.of(), List.of(OBJ, OBJ)),
                    fn("take_vec", List.of(new SignatureToken.Vector(OBJ)), List.of()),
                    fn("take_vec_and_obj", List.of(new SignatureToken.Vector(OBJ), OBJ), List.of()),
                    fn("take_string", List.of(SignatureToken.of(KnownTypes.UTF8_STRING)), List.of()),
                    fn("take_u64", List.of(new SignatureToken.Primitive(PrimitiveType.U64)), List.of()),
                    fn("abort", List.of(), List.of()),
                    fn("use_gas", List.of(new SignatureToken.MutableReference(SignatureToken.of(KnownTypes.GAS_COIN))), List.of()),
                    new FunctionDef("generic", true, 1, List.of(new SignatureToken.TypeParameter(0)), List.of()),
                    new FunctionDef("hidden", false, 0, List.of(), List.of())));

    public static final PackageResolver RESOLVER = id -> id.equals(TestObjects.PACKAGE)
            ? Optional.of(new PackageResolver.ResolvedPackage(id, Map.of("m", MODULE)))
            : Optional.empty();

    private TestPackages() {}

    private static FunctionDef fn(String name, List<SignatureToken> params, List<SignatureToken> returns) {
        return new FunctionDef(name, true, 0, params, returns);
    }
}
