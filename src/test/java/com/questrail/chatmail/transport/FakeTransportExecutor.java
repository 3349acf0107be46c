package com.questrail.chatmail.transport;

import com.questrail.chatmail.api.Transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Scriptable {@link TransportExecutor} for tests.
 *
 * <p>Every operation is recorded. Results are taken from per-operation
 * scripts and default to success once a script runs out. Mail is handed
 * out by {@link #fetch(Transport)} in delivery order.</p>
 */
public final class FakeTransportExecutor implements TransportExecutor {

    public enum Op { SEND, SEND_MDN, MARK_SEEN, MOVE, DELETE, CONFIGURE }

    private final Map<Op, Deque<TransportResult>> scripts = new EnumMap<>(Op.class);
    private final Map<Transport, List<FetchedMail>> inboxes = new EnumMap<>(Transport.class);
    private final Map<Transport, String> fetchedFolders = new EnumMap<>(Transport.class);
    private final Deque<TransportException> fetchFailures = new ArrayDeque<>();

    private final List<OutboundMessage> sent = new ArrayList<>();
    private final List<ReadReceipt> receipts = new ArrayList<>();
    private final List<ServerRef> markedSeen = new ArrayList<>();
    private final List<ServerRef> moved = new ArrayList<>();
    private final List<ServerRef> deleted = new ArrayList<>();
    private int configureCalls;
    private long nextUid = 1000;

    private volatile Consumer<OutboundMessage> onSend = m -> {};
    private volatile Runnable onConfigure = () -> {};

    public synchronized FakeTransportExecutor script(Op op, TransportResult... results) {
        Deque<TransportResult> queue = scripts.computeIfAbsent(op, k -> new ArrayDeque<>());
        for (TransportResult r : results) {
            queue.add(r);
        }
        return this;
    }

    public synchronized void failNextFetch(TransportException e) {
        fetchFailures.add(e);
    }

    public synchronized void deliver(Transport mailbox, FetchedMail mail) {
        inboxes.computeIfAbsent(mailbox, k -> new ArrayList<>()).add(mail);
    }

    public void onSend(Consumer<OutboundMessage> hook) {
        this.onSend = hook;
    }

    public void onConfigure(Runnable hook) {
        this.onConfigure = hook;
    }

    private synchronized TransportResult next(Op op) {
        Deque<TransportResult> queue = scripts.get(op);
        TransportResult r = queue == null ? null : queue.poll();
        return r == null ? TransportResult.ok() : r;
    }

    @Override
    public List<FetchedMail> fetch(Transport mailbox, String folder) throws TransportException {
        synchronized (this) {
            fetchedFolders.put(mailbox, folder);
            TransportException failure = fetchFailures.poll();
            if (failure != null) {
                throw failure;
            }
            List<FetchedMail> mails = inboxes.remove(mailbox);
            return mails == null ? List.of() : mails;
        }
    }

    @Override
    public TransportResult send(OutboundMessage message) {
        TransportResult result = next(Op.SEND);
        synchronized (this) {
            sent.add(message);
        }
        if (result instanceof TransportResult.Ok) {
            onSend.accept(message);
        }
        return result;
    }

    @Override
    public TransportResult sendReadReceipt(ReadReceipt receipt) {
        TransportResult result = next(Op.SEND_MDN);
        synchronized (this) {
            receipts.add(receipt);
        }
        return result;
    }

    @Override
    public TransportResult markSeenOnServer(ServerRef ref) {
        TransportResult result = next(Op.MARK_SEEN);
        synchronized (this) {
            markedSeen.add(ref);
        }
        return result;
    }

    @Override
    public TransportResult move(ServerRef ref, String targetFolder) {
        TransportResult result = next(Op.MOVE);
        synchronized (this) {
            moved.add(ref);
            if (result instanceof TransportResult.Ok) {
                return TransportResult.movedTo(nextUid++);
            }
        }
        return result;
    }

    @Override
    public TransportResult deleteOnServer(ServerRef ref) {
        TransportResult result = next(Op.DELETE);
        synchronized (this) {
            deleted.add(ref);
        }
        return result;
    }

    @Override
    public TransportResult configure() {
        onConfigure.run();
        TransportResult result = next(Op.CONFIGURE);
        synchronized (this) {
            configureCalls++;
        }
        return result;
    }

    public synchronized List<OutboundMessage> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized List<ReadReceipt> receipts() {
        return new ArrayList<>(receipts);
    }

    public synchronized List<ServerRef> markedSeen() {
        return new ArrayList<>(markedSeen);
    }

    public synchronized List<ServerRef> moved() {
        return new ArrayList<>(moved);
    }

    public synchronized List<ServerRef> deleted() {
        return new ArrayList<>(deleted);
    }

    /** The folder the last fetch of {@code mailbox} asked for. */
    public synchronized String fetchedFolder(Transport mailbox) {
        return fetchedFolders.get(mailbox);
    }

    public synchronized int configureCalls() {
        return configureCalls;
    }
}
