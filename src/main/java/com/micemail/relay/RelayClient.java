package com.micemail.relay;

import com.micemail.domain.RelayCredentials;

import java.util.List;

/**
 * Send-once operation against an SMTP relay.
 * <p>
 * All-or-nothing: a call either returns normally (the relay accepted the
 * message for every recipient) or throws a single {@link RelayException}.
 * Per-recipient partial failure is not reported.
 */
public interface RelayClient {

    void sendOnce(RelayCredentials credentials, List<String> recipients, byte[] content) throws RelayException;
}
