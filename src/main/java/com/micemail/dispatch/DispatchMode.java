package com.micemail.dispatch;

/**
 * Completion policy for POST /send-email
 */
public enum DispatchMode {
    SYNC,   // block until delivered or exhausted
    ASYNC   // accept immediately, deliver in background
}
