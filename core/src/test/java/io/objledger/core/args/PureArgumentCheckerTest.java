package io.objledger.core.args;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.types.KnownTypes;
import io.objledger.core.types.PrimitiveType;
import io.objledger.core.types.TypeTag;
import io.objledger.core.types.VectorType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PureArgumentCheckerTest {

    @Test
    void pure_types() {
        assertTrue(PureArgumentChecker.isPureType(PrimitiveType.ADDRESS));
        assertTrue(PureArgumentChecker.isPureType(TypeTag.parse("vector<0x1::option::Option<0x1::string::String>>")));
        assertTrue(PureArgumentChecker.isPureType(KnownTypes.ID));
        assertFalse(PureArgumentChecker.isPureType(PrimitiveType.SIGNER));
        assertFalse(PureArgumentChecker.isPureType(KnownTypes.GAS_COIN));
        assertFalse(PureArgumentChecker.isPureType(KnownTypes.option(KnownTypes.UID)));
    }

    @Test
    void strings_are_validated_by_encoding() {
        byte[] utf8 = new BcsWriter().writeString("ünïcode").toByteArray();
        assertDoesNotThrow(() -> PureArgumentChecker.check(utf8, KnownTypes.UTF8_STRING));
        // ascii rejects bytes >= 0x80
        assertThrows(BcsException.class, () -> PureArgumentChecker.check(utf8, KnownTypes.ASCII_STRING));

        byte[] truncated = new BcsWriter().writeBytes(new byte[]{(byte) 0xE2, (byte) 0x82}).toByteArray();
        assertThrows(BcsException.class, () -> PureArgumentChecker.check(truncated, KnownTypes.UTF8_STRING));
    }

    @Test
    void options_hold_at_most_one_value() {
        TypeTag opt = KnownTypes.option(PrimitiveType.U8);
        assertDoesNotThrow(() -> PureArgumentChecker.check(new byte[]{0}, opt));
        assertDoesNotThrow(() -> PureArgumentChecker.check(new byte[]{1, 42}, opt));
        assertThrows(BcsException.class, () -> PureArgumentChecker.check(new byte[]{2, 1, 2}, opt));
    }

    @Test
    void vectors_and_trailing_bytes() {
        byte[] two = new BcsWriter().writeVector(List.of(1L, 2L), BcsWriter::writeU64).toByteArray();
        assertDoesNotThrow(() -> PureArgumentChecker.check(two, new VectorType(PrimitiveType.U64)));
        byte[] extra = new BcsWriter().writeU64(1).writeU8(0).toByteArray();
        assertThrows(BcsException.class, () -> PureArgumentChecker.check(extra, PrimitiveType.U64));
        assertThrows(BcsException.class, () -> PureArgumentChecker.check(new byte[]{2}, PrimitiveType.BOOL));
        assertThrows(IllegalArgumentException.class, () -> PureArgumentChecker.check(new byte[0], PrimitiveType.SIGNER));
    }
}
