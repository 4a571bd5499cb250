package com.openforge.mcpchat.conversation;

/** Thrown inside a run once the user has cancelled it. */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message) {
        super(message);
    }
}
