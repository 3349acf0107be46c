package com.questrail.chatmail.api;

import com.questrail.chatmail.events.EventChannel;
import com.questrail.chatmail.protocol.chat.ChatRecord;
import com.questrail.chatmail.protocol.idle.WakeReason;
import com.questrail.chatmail.protocol.message.MessageRecord;

import java.util.List;
import java.util.Optional;

/**
 * ChatCore
 * =============================================================================
 * The embedder-facing surface of the chat protocol core.
 *
 * <h2>Threading</h2>
 * The core creates no threads. The embedder runs one loop per
 * {@link Transport}:
 * <pre>
 * while (running) {
 *     core.drainJobs(t);
 *     core.fetch(t);
 *     core.idle(t);
 * }
 * </pre>
 * All other operations may be called from any thread. Results and progress
 * are reported through {@link #events()}.
 *
 * <h2>Errors</h2>
 * Precondition failures are thrown synchronously as {@link ChatCoreException}
 * subclasses and leave no state behind. Network failures never surface as
 * exceptions; they are retried and reported as events.
 */
public interface ChatCore {

    /**
     * Queue of events for the embedder.
     */
    EventChannel events();

    // ---------------------------------------------------------------------
    // Transport loop
    // ---------------------------------------------------------------------

    /**
     * Schedules an account configuration run. Progress is reported as
     * {@code CONFIGURE_PROGRESS}.
     */
    void configure();

    /**
     * Runs the due jobs of {@code transport}. Call only from that transport's thread.
     *
     * @return the number of jobs run
     */
    int drainJobs(Transport transport);

    /**
     * Fetches and processes new mail from a watched mailbox.
     *
     * @return the number of messages stored
     */
    int fetch(Transport transport);

    /**
     * Blocks until {@code transport} is interrupted, its next deferred job is
     * due, the idle timeout elapses, or the core shuts down.
     */
    WakeReason idle(Transport transport);

    /**
     * Wakes the thread of {@code transport}.
     */
    void interrupt(Transport transport);

    /**
     * Schedules local maintenance on the primary mailbox's thread. A run that
     * is already scheduled is not doubled.
     */
    void housekeeping();

    /**
     * Hints that the network may be back: every transport retries its failed
     * jobs at once.
     */
    void maybeNetwork();

    /**
     * Wakes every transport thread for good; their {@link #idle(Transport)}
     * calls return {@link WakeReason#SHUTDOWN}.
     */
    void shutdown();

    // ---------------------------------------------------------------------
    // Long-running processes
    // ---------------------------------------------------------------------

    /**
     * Cancels the running long-running process, if any.
     *
     * @return true if a process was running
     */
    boolean stopOngoingProcess();

    /**
     * Returns a QR payload for contact verification, or for joining
     * {@code group} when present.
     *
     * @throws NoSuchChatException if {@code group} does not exist
     */
    String initiateSecureJoin(Optional<ChatId> group);

    /**
     * Runs the joiner side of a secure-join handshake, blocking until it ends.
     *
     * @throws InvalidQrCodeException  if the code is not a secure-join invite
     * @throws OngoingProcessException if another long-running process is active
     */
    SecureJoinResult joinSecureJoin(String qr);

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    MessageId sendMessage(ChatId chat, String text);

    /**
     * Creates a message whose content is still being prepared. It is sent
     * once {@link #finishPreparing(MessageId)} is called.
     */
    MessageId prepareMessage(ChatId chat, String text);

    void finishPreparing(MessageId message);

    /**
     * Parks a message that is being prepared as a draft.
     */
    void parkAsDraft(MessageId message);

    MessageId setDraft(ChatId chat, String text);

    void sendDraft(MessageId message);

    /**
     * Sends a failed message again.
     */
    void resendMessage(MessageId message);

    /**
     * Marks received messages seen.
     *
     * @throws NoSuchMessageException if any id is unknown; no message is changed then
     */
    void markSeen(List<MessageId> messages);

    /**
     * @throws NoSuchChatException if the chat does not exist
     */
    void markNoticedChat(ChatId chat);

    /**
     * @throws NoSuchContactException if the contact is unknown
     */
    void markNoticedContact(ContactId contact);

    Optional<MessageRecord> getMessage(MessageId message);

    // ---------------------------------------------------------------------
    // Chats
    // ---------------------------------------------------------------------

    /**
     * Returns the 1:1 chat with {@code contact}, creating it if needed. A
     * chat that only existed as a contact request is unblocked.
     */
    ChatId createChatByContact(ContactId contact);

    ChatId createGroupChat(String name, boolean verified);

    /**
     * Adds a contact to a group. Members of a promoted group are told with a
     * system message.
     *
     * @return false if the contact already was a member
     * @throws VerificationRequiredException if the group is verified and the contact is not
     */
    boolean addContactToChat(ChatId chat, ContactId contact);

    void archiveChat(ChatId chat, boolean archive);

    Optional<ChatRecord> getChat(ChatId chat);
}
