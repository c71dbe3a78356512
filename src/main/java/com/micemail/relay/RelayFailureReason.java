package com.micemail.relay;

/**
 * Coarse classification of a failed send-once call. Reporting only: the
 * dispatch retry policy treats every reason the same.
 */
public enum RelayFailureReason {
    UNREACHABLE,  // connect refused, unknown host, socket timeout
    REJECTED,     // authentication or envelope refused by the relay
    OTHER
}
