package com.micemail.service;

import com.micemail.domain.SeenRecipient;
import com.micemail.exception.StoreException;
import com.micemail.mapper.SeenRecipientMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Recipient store on the seen_recipient table.
 * The UNIQUE email column makes concurrent first-time inserts collapse to one row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SqliteRecipientStore implements RecipientStore {

    private final SeenRecipientMapper recipientMapper;

    @Override
    public boolean exists(String email) {
        try {
            return recipientMapper.countByEmail(email) > 0;
        } catch (RuntimeException e) {
            throw new StoreException("Could not look up recipient " + email, e);
        }
    }

    @Override
    public void insert(String email) {
        recordIfAbsent(email);
    }

    @Override
    public boolean recordIfAbsent(String email) {
        try {
            boolean inserted = recipientMapper.insertIfAbsent(email) > 0;
            if (inserted) {
                log.debug("New recipient recorded: {}", email);
            }
            return inserted;
        } catch (RuntimeException e) {
            throw new StoreException("Could not insert recipient " + email, e);
        }
    }

    @Override
    public List<SeenRecipient> findAll() {
        try {
            return recipientMapper.findAll();
        } catch (RuntimeException e) {
            throw new StoreException("Could not list recipients", e);
        }
    }
}
