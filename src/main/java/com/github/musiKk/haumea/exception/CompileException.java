package com.github.musiKk.haumea.exception;

import java.util.Optional;

import com.github.musiKk.haumea.Tokenizer.Position;

/**
 * Aborts a translation. Every stage throws a subclass of this on the first defect it finds;
 * nothing in the pipeline catches it.
 */
public class CompileException extends RuntimeException {

    private final Position position;

    public CompileException(String message) {
        this(null, message);
    }

    public CompileException(Position position, String message) {
        super(position == null ? message : "line " + position + ": " + message);
        this.position = position;
    }

    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

}
