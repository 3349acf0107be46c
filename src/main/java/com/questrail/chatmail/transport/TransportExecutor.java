package com.questrail.chatmail.transport;

import com.questrail.chatmail.api.Transport;

import java.util.List;

/**
 * TransportExecutor
 * =============================================================================
 * Boundary between the protocol core and the IMAP/SMTP implementation.
 *
 * <p>The core decides <em>what</em> to fetch and send; implementations decide
 * <em>how</em>. Every method is called only from the thread that drives the
 * corresponding transport, so implementations need no internal locking per
 * transport.</p>
 *
 * <p>Job operations report their outcome as a {@link TransportResult} rather
 * than throwing, so retry classification stays with the implementation that
 * knows the server's answer. {@link #fetch(Transport, String)} throws because a failed
 * fetch has no job to reschedule.</p>
 */
public interface TransportExecutor {

    /**
     * Returns new mail in the given mailbox since the last fetch.
     *
     * @param folder the server folder the mailbox currently maps to
     */
    List<FetchedMail> fetch(Transport mailbox, String folder) throws TransportException;

    TransportResult send(OutboundMessage message);

    TransportResult sendReadReceipt(ReadReceipt receipt);

    TransportResult markSeenOnServer(ServerRef ref);

    /**
     * Moves a message; a successful result carries the uid in {@code targetFolder}.
     */
    TransportResult move(ServerRef ref, String targetFolder);

    TransportResult deleteOnServer(ServerRef ref);

    /**
     * Connects to the configured servers and verifies credentials.
     */
    TransportResult configure();
}
