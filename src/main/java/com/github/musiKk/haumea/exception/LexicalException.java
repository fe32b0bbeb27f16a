package com.github.musiKk.haumea.exception;

import com.github.musiKk.haumea.Tokenizer.Position;

public class LexicalException extends CompileException {

    public LexicalException(Position position, String message) {
        super(position, message);
    }

}
