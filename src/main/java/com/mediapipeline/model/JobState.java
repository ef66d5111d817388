package com.mediapipeline.model;

/**
 * Lifecycle of one upload message.
 * RECEIVED -> PROCESSING -> SUCCEEDED (ack)
 *                        -> RETRYING (requeued with backoff)
 *                        -> DEAD_LETTERED (permanent failure or attempts exhausted)
 */
public enum JobState {
    RECEIVED,
    PROCESSING,
    SUCCEEDED,
    RETRYING,
    DEAD_LETTERED
}
