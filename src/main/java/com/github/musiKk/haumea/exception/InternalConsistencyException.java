package com.github.musiKk.haumea.exception;

/**
 * Thrown by the code generator when it meets a tree the parser can never produce.
 */
public class InternalConsistencyException extends CompileException {

    public InternalConsistencyException(String message) {
        super(message);
    }

}
