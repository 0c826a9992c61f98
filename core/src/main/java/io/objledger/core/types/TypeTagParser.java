// file: src/main/java/io/objledger/core/types/TypeTagParser.java
package io.objledger.core.types;

import io.objledger.core.AccountAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for canonical type strings.
 * Whitespace between tokens is ignored.
 */
final class TypeTagParser {
    private final String text;
    private int pos;

    TypeTagParser(String text) {
        if (text == null) throw new IllegalArgumentException("type string is null");
        this.text = text;
    }

    TypeTag parseComplete() {
        TypeTag t = parseType();
        skipSpaces();
        if (pos != text.length()) {
            throw error("unexpected trailing input");
        }
        return t;
    }

    private TypeTag parseType() {
        skipSpaces();
        if (text.startsWith("0x", pos) || text.startsWith("0X", pos)) {
            return parseStruct();
        }
        String word = identifier();
        if (word.equals("vector")) {
            expect('<');
            TypeTag element = parseType();
            expect('>');
            return new VectorType(element);
        }
        PrimitiveType p = PrimitiveType.fromName(word);
        if (p == null) throw error("unknown type '" + word + "'");
        return p;
    }

    private StructTag parseStruct() {
        int start = pos;
        pos += 2;
        while (pos < text.length() && Character.digit(text.charAt(pos), 16) >= 0) pos++;
        AccountAddress address;
        try {
            address = AccountAddress.fromHex(text.substring(start, pos));
        } catch (IllegalArgumentException e) {
            throw error("invalid address");
        }
        expect(':');
        expect(':');
        String module = identifier();
        expect(':');
        expect(':');
        String name = identifier();
        List<TypeTag> params = new ArrayList<>();
        skipSpaces();
        if (pos < text.length() && text.charAt(pos) == '<') {
            pos++;
            params.add(parseType());
            skipSpaces();
            while (pos < text.length() && text.charAt(pos) == ',') {
                pos++;
                params.add(parseType());
                skipSpaces();
            }
            expect('>');
        }
        return new StructTag(address, module, name, params);
    }

    private String identifier() {
        skipSpaces();
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') pos++;
            else break;
        }
        if (start == pos) throw error("expected identifier");
        if (Character.isDigit(text.charAt(start))) throw error("identifier starts with a digit");
        return text.substring(start, pos);
    }

    private void expect(char c) {
        skipSpaces();
        if (pos >= text.length() || text.charAt(pos) != c) {
            throw error("expected '" + c + "'");
        }
        pos++;
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    private IllegalArgumentException error(String what) {
        return new IllegalArgumentException("invalid type '" + text + "' at " + pos + ": " + what);
    }
}
