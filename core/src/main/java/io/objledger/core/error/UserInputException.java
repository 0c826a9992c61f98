// file: src/main/java/io/objledger/core/error/UserInputException.java
package io.objledger.core.error;

/** Thrown for requests that are invalid as submitted. */
public class UserInputException extends RuntimeException {
    private final UserInputError error;

    public UserInputException(UserInputError error) {
        super(error.toString());
        this.error = error;
    }

    public UserInputException(UserInputError.Kind kind, String detail) {
        this(UserInputError.of(kind, detail));
    }

    public UserInputError error() {
        return error;
    }

    public UserInputError.Kind kind() {
        return error.kind();
    }
}
