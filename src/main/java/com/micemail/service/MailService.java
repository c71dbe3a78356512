package com.micemail.service;

import com.micemail.domain.OutboundMail;
import com.micemail.domain.SeenRecipient;
import com.micemail.domain.SendRequest;
import com.micemail.exception.StoreException;
import com.micemail.exception.ValidationException;
import com.micemail.util.EmailValidator;
import com.micemail.util.MessageFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns a send request into a dispatchable mail
 * - Validate every recipient before anything else happens
 * - Record recipients in the store (best-effort)
 * - Format the wire message
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailService {

    private final RecipientStore recipientStore;

    public OutboundMail prepare(SendRequest request) {
        List<String> recipients = validateRecipients(request.getRecipients());
        recordRecipients(recipients);

        OutboundMail mail = OutboundMail.builder()
                .id(OutboundMail.newId())
                .recipients(recipients)
                .content(MessageFormatter.format(recipients, request.getSubject(), request.getMessage()))
                .build();
        log.info("[{}] Mail accepted: subject='{}', recipients={}", mail.getId(), request.getSubject(), recipients);
        return mail;
    }

    public List<SeenRecipient> listRecipients() {
        return recipientStore.findAll();
    }

    /**
     * Whole request is rejected on the first invalid address
     */
    List<String> validateRecipients(List<String> recipients) {
        if (recipients == null || recipients.isEmpty()) {
            throw new ValidationException("At least one recipient is required");
        }
        for (String recipient : recipients) {
            if (!EmailValidator.isValid(recipient)) {
                throw new ValidationException(
                        String.format("Recipient email address '%s' is not valid", recipient));
            }
        }
        return List.copyOf(recipients);
    }

    /**
     * Store failures never block delivery
     */
    private void recordRecipients(List<String> recipients) {
        for (String recipient : recipients) {
            try {
                if (!recipientStore.recordIfAbsent(recipient)) {
                    log.debug("Recipient already known: {}", recipient);
                }
            } catch (StoreException e) {
                log.warn("Could not record recipient {}: {}", recipient, e.getMessage());
            }
        }
    }
}
