package com.amqpcore.confirms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Publisher confirm state of one channel: publish sequence numbers handed out since
 * {@code confirm.select}, the ones not yet settled, and whether any was nacked since the last wait.
 */
public class PublisherConfirms {
    private static final Logger logger = LoggerFactory.getLogger(PublisherConfirms.class);

    private final Lock lock = new ReentrantLock();
    private final Condition settled = lock.newCondition();
    private final NavigableSet<Long> outstanding = new TreeSet<>();
    private volatile boolean confirmMode = false;
    private long lastSeqNo = 0;
    private boolean nackedSinceWait = false;
    private ConfirmListener confirmListener;

    public interface ConfirmListener {
        void onAck(long seqNo, boolean multiple);

        void onNack(long seqNo, boolean multiple);
    }

    public void enableConfirmMode() {
        this.confirmMode = true;
        logger.debug("Publisher confirms enabled");
    }

    public boolean isConfirmMode() {
        return confirmMode;
    }

    public void setConfirmListener(ConfirmListener listener) {
        this.confirmListener = listener;
    }

    /**
     * Allocates the sequence number of the next publish and marks it outstanding.
     */
    public long nextPublishSeqNo() {
        lock.lock();
        try {
            long seqNo = ++lastSeqNo;
            outstanding.add(seqNo);
            return seqNo;
        } finally {
            lock.unlock();
        }
    }

    public long getNextPublishSeqNo() {
        lock.lock();
        try {
            return lastSeqNo + 1;
        } finally {
            lock.unlock();
        }
    }

    public void ack(long seqNo) {
        settle(seqNo, true);
    }

    public void nack(long seqNo) {
        settle(seqNo, false);
    }

    private void settle(long seqNo, boolean success) {
        lock.lock();
        try {
            if (!outstanding.remove(seqNo)) {
                return;
            }
            if (!success) {
                nackedSinceWait = true;
            }
            settled.signalAll();
        } finally {
            lock.unlock();
        }

        ConfirmListener listener = confirmListener;
        if (listener != null) {
            if (success) {
                listener.onAck(seqNo, false);
            } else {
                listener.onNack(seqNo, false);
            }
        }
        logger.debug("{} publish {}", success ? "Acked" : "Nacked", seqNo);
    }

    /**
     * Blocks until nothing is outstanding or the timeout elapses. The nacked flag is reset
     * when everything has settled.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public ConfirmOutcome waitForConfirms(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!outstanding.isEmpty()) {
                if (remaining <= 0) {
                    return ConfirmOutcome.TIMED_OUT;
                }
                remaining = settled.awaitNanos(remaining);
            }
            boolean nacked = nackedSinceWait;
            nackedSinceWait = false;
            return nacked ? ConfirmOutcome.NACKED : ConfirmOutcome.ALL_ACKED;
        } finally {
            lock.unlock();
        }
    }

    public int getPendingConfirmCount() {
        lock.lock();
        try {
            return outstanding.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nacks everything still outstanding, used when the channel closes under waiting publishers.
     */
    public void nackOutstanding() {
        Long[] seqNos;
        lock.lock();
        try {
            seqNos = outstanding.toArray(new Long[0]);
        } finally {
            lock.unlock();
        }
        for (Long seqNo : seqNos) {
            nack(seqNo);
        }
    }
}
