package org.dxworks.sieveframe.sieve;

public enum ErrorKind {
    UNTERMINATED_STRING,
    UNTERMINATED_COMMENT,
    UNTERMINATED_MULTILINE,
    UNEXPECTED_CHARACTER,
    UNEXPECTED_TOKEN,
    UNEXPECTED_END,
    UNKNOWN_COMMAND,
    UNKNOWN_TEST,
    MISSING_BLOCK
}
