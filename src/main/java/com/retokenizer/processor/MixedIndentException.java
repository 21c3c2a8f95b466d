package com.retokenizer.processor;

import com.retokenizer.text.TokenizationException;

public class MixedIndentException extends TokenizationException {
    private final IndentUnit expected;
    private final IndentUnit found;

    public MixedIndentException(int offset, IndentUnit expected, IndentUnit found) {
        super("Mixed indent: expected " + expected.displayName() + " but found " + found.displayName(), offset);
        this.expected = expected;
        this.found = found;
    }

    public IndentUnit getExpected() {
        return expected;
    }

    public IndentUnit getFound() {
        return found;
    }
}
