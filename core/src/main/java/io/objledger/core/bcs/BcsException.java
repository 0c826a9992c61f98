// file: src/main/java/io/objledger/core/bcs/BcsException.java
package io.objledger.core.bcs;

/**
 * Raised when bytes do not form a canonical encoding of the requested shape:
 * truncated input, trailing bytes, non-minimal ULEB128 lengths, bad booleans
 * or invalid UTF-8.
 */
public class BcsException extends RuntimeException {
    public BcsException(String message) {
        super(message);
    }

    public BcsException(String message, Throwable cause) {
        super(message, cause);
    }
}
