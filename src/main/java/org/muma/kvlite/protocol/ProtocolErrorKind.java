package org.muma.kvlite.protocol;

public enum ProtocolErrorKind {
    UNSUPPORTED_TYPE,
    MALFORMED_ARRAY_LENGTH,
    INCOMPLETE_INPUT,
    MISSING_TERMINATOR,
    MALFORMED_INTEGER,
    INVALID_ENCODING,
    NESTING_TOO_DEEP
}
