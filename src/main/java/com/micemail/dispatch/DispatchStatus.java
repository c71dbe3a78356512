package com.micemail.dispatch;

/**
 * Terminal dispatch states
 */
public enum DispatchStatus {
    DELIVERED,
    EXHAUSTED
}
