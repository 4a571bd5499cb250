package com.openforge.mcpchat.conversation;

/**
 * States of one run. Every run starts and ends in IDLE; ABORTED is passed
 * through on an unrecoverable error before returning to IDLE.
 */
public enum OrchestratorState {
    IDLE,
    SELECTING,
    STREAMING,
    DISPATCHING,
    FINALIZING,
    ABORTED
}
