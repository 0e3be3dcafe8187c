package com.cipherchat.client.consent;

/**
 * Lifecycle of a secret conversation, as observed from member records.
 */
public enum ConsentState {
    /** The creator has published a key, the invitee has not yet. */
    PROPOSED,
    /** Both members have published a key; messages can be exchanged. */
    ACCEPTED,
    /** One side rejected or left; its member record is gone. */
    LEFT
}
