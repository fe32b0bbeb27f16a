package com.github.musiKk.haumea.exception;

import com.github.musiKk.haumea.Tokenizer.Token;

import lombok.Getter;
import lombok.experimental.Accessors;

public class SyntaxException extends CompileException {

    /** The token that did not fit; an EOF token when the input ran out. */
    @Accessors(fluent = true)
    @Getter
    private final Token token;

    public SyntaxException(String expected, Token token) {
        super(token.position(), "expected " + expected + ", but found " + token.describe());
        this.token = token;
    }

}
