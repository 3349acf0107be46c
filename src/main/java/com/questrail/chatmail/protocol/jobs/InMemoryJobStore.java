package com.questrail.chatmail.protocol.jobs;

import com.questrail.chatmail.api.MessageId;
import com.questrail.chatmail.api.Transport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * Non-durable {@link JobStore}, for embedders without a database and for tests.
 *
 * <p>All operations hold the store's monitor, which makes claiming atomic.</p>
 */
public final class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> FIFO =
            Comparator.comparingLong(Job::addedAt).thenComparingLong(Job::id);
    private static final Comparator<Job> BY_NOT_BEFORE =
            Comparator.comparingLong(Job::notBefore).thenComparingLong(Job::id);

    private final Map<Long, Job> rows = new TreeMap<>();
    private final Set<Long> claimed = new HashSet<>();
    private long nextId = 1;

    @Override
    public synchronized Job enqueue(NewJob job, long nowMillis) {
        Objects.requireNonNull(job, "job");
        Job row = new Job(nextId++, job.action(), job.params(), 0,
                nowMillis, nowMillis + job.delay().toMillis());
        rows.put(row.id(), row);
        return row;
    }

    @Override
    public synchronized List<Job> claimDue(Transport transport, long nowMillis) {
        return claimWhere(transport, j -> j.isDue(nowMillis), FIFO);
    }

    @Override
    public synchronized List<Job> claimRetrying(Transport transport) {
        return claimWhere(transport, j -> j.tries() > 0, BY_NOT_BEFORE);
    }

    private List<Job> claimWhere(Transport transport,
                                 java.util.function.Predicate<Job> filter,
                                 Comparator<Job> order) {
        List<Job> result = new ArrayList<>();
        for (Job j : rows.values()) {
            if (j.transport() == transport && !claimed.contains(j.id()) && filter.test(j)) {
                result.add(j);
            }
        }
        result.sort(order);
        for (Job j : result) {
            claimed.add(j.id());
        }
        return result;
    }

    @Override
    public synchronized Job reschedule(Job job, int tries, long notBefore) {
        rows.remove(job.id());
        claimed.remove(job.id());
        Job row = new Job(nextId++, job.action(), job.params(), tries, job.addedAt(), notBefore);
        rows.put(row.id(), row);
        return row;
    }

    @Override
    public synchronized int makeDue(JobAction action, MessageId messageId, long nowMillis) {
        int changed = 0;
        for (Map.Entry<Long, Job> e : rows.entrySet()) {
            Job j = e.getValue();
            if (j.action() == action && messageId.equals(j.params().messageId())
                    && !claimed.contains(j.id()) && j.notBefore() > nowMillis) {
                e.setValue(new Job(j.id(), j.action(), j.params(), j.tries(), j.addedAt(), nowMillis));
                changed++;
            }
        }
        return changed;
    }

    @Override
    public synchronized void release(Job job) {
        claimed.remove(job.id());
    }

    @Override
    public synchronized boolean delete(Job job) {
        claimed.remove(job.id());
        return rows.remove(job.id()) != null;
    }

    @Override
    public synchronized int deleteByAction(JobAction action) {
        int deleted = 0;
        for (Iterator<Job> it = rows.values().iterator(); it.hasNext(); ) {
            Job j = it.next();
            if (j.action() == action) {
                it.remove();
                claimed.remove(j.id());
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized boolean exists(JobAction action) {
        return rows.values().stream().anyMatch(j -> j.action() == action);
    }

    @Override
    public synchronized OptionalLong nextNotBefore(Transport transport) {
        return rows.values().stream()
                .filter(j -> j.transport() == transport && !claimed.contains(j.id()))
                .mapToLong(Job::notBefore)
                .min();
    }

    @Override
    public synchronized Optional<Job> find(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized int count(Transport transport) {
        return (int) rows.values().stream().filter(j -> j.transport() == transport).count();
    }
}
