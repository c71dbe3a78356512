package com.micemail.service;

import com.micemail.domain.SeenRecipient;

import java.util.List;

/**
 * Persistent record of recipient addresses that have been accepted.
 * Implementations throw {@link com.micemail.exception.StoreException} on failure.
 */
public interface RecipientStore {

    boolean exists(String email);

    /**
     * Record the address. Inserting an address that is already present is a no-op.
     */
    void insert(String email);

    /**
     * Atomic insert-if-absent.
     *
     * @return true if the address was not present before this call
     */
    boolean recordIfAbsent(String email);

    List<SeenRecipient> findAll();
}
