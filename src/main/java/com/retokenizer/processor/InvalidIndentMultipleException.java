package com.retokenizer.processor;

import com.retokenizer.text.TokenizationException;

public class InvalidIndentMultipleException extends TokenizationException {
    private final int requiredWidth;
    private final int difference;

    public InvalidIndentMultipleException(int offset, int requiredWidth, int difference) {
        super("Invalid indent multiple, should be " + requiredWidth + " (got a change of " + difference + ")", offset);
        this.requiredWidth = requiredWidth;
        this.difference = difference;
    }

    public int getRequiredWidth() {
        return requiredWidth;
    }

    public int getDifference() {
        return difference;
    }
}
