package io.reactormesh.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous front of a {@link TraceSink}. {@link #record(TraceRecord)} never blocks:
 * records go to a bounded buffer drained by one background thread, and a record that
 * does not fit is counted in {@link #dropped()}. While the sink is down the drain
 * thread holds the failed batch and retries it with exponential backoff.
 */
public final class TraceRecorder implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TraceRecorder.class);
    private static final int MAX_BATCH = 256;
    private static final long INITIAL_BACKOFF_MS = 50L;
    private static final long MAX_BACKOFF_MS = 5_000L;

    private final TraceSink sink;
    private final BlockingQueue<TraceRecord> buffer;
    private final int capacity;
    private final AtomicLong accepted;
    private final AtomicLong written;
    private final AtomicLong dropped;
    private final AtomicLong sampledOut;
    private final AtomicLong failedWrites;
    private final List<TraceRecord> inFlight;
    private final Object idleLock;
    private final Thread drainThread;
    private volatile boolean running;
    private volatile boolean sinkAvailable;
    private volatile double samplingRate;

    public TraceRecorder(TraceSink sink, int capacity, double samplingRate) {
        this.sink = sink;
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayBlockingQueue<>(this.capacity);
        this.accepted = new AtomicLong(0L);
        this.written = new AtomicLong(0L);
        this.dropped = new AtomicLong(0L);
        this.sampledOut = new AtomicLong(0L);
        this.failedWrites = new AtomicLong(0L);
        this.inFlight = new ArrayList<>();
        this.idleLock = new Object();
        this.sinkAvailable = true;
        this.samplingRate = clampRate(samplingRate);
        this.drainThread = new Thread(this::drainLoop, "reactormesh-trace-" + sink.name());
        this.drainThread.setDaemon(true);
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        drainThread.start();
    }

    /**
     * Queues a record. Evaluation records are subject to the sampling rate; every
     * other kind is always kept.
     */
    public void record(TraceRecord record) {
        if (record instanceof EvaluationRecord && !sampled()) {
            sampledOut.incrementAndGet();
            return;
        }
        if (buffer.offer(record)) {
            accepted.incrementAndGet();
        } else {
            long total = dropped.incrementAndGet();
            if (total == 1L || total % 1_000L == 0L) {
                logger.warn("Trace buffer full (capacity={}), {} records dropped so far", capacity, total);
            }
        }
    }

    /**
     * Waits until everything accepted so far reached the sink.
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleLock) {
            while (written.get() < accepted.get()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0L) {
                    return false;
                }
                try {
                    idleLock.wait(Math.min(remainingMs, 50L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    public void setSamplingRate(double samplingRate) {
        this.samplingRate = clampRate(samplingRate);
    }

    public long dropped() {
        return dropped.get();
    }

    public long written() {
        return written.get();
    }

    public long sampledOut() {
        return sampledOut.get();
    }

    public long failedWrites() {
        return failedWrites.get();
    }

    public int buffered() {
        return buffer.size() + pendingInFlight();
    }

    public int capacity() {
        return capacity;
    }

    public boolean sinkAvailable() {
        return sinkAvailable;
    }

    public String sinkName() {
        return sink.name();
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(2));
    }

    public void close(Duration flushTimeout) {
        if (running && !flush(flushTimeout)) {
            logger.warn("Trace recorder closed with {} unwritten records", buffered());
        }
        running = false;
        drainThread.interrupt();
        try {
            drainThread.join(flushTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sink.close();
    }

    private void drainLoop() {
        long backoffMs = INITIAL_BACKOFF_MS;
        while (running) {
            try {
                if (pendingInFlight() == 0) {
                    TraceRecord first = buffer.poll(100L, TimeUnit.MILLISECONDS);
                    if (first == null) {
                        signalIdle();
                        continue;
                    }
                    synchronized (inFlight) {
                        inFlight.add(first);
                        buffer.drainTo(inFlight, MAX_BATCH - 1);
                    }
                }
                List<TraceRecord> batch;
                synchronized (inFlight) {
                    batch = List.copyOf(inFlight);
                }
                try {
                    sink.write(batch);
                } catch (TraceSinkUnavailableException e) {
                    failedWrites.incrementAndGet();
                    if (sinkAvailable) {
                        logger.warn("Trace sink {} unavailable, holding {} records: {}", sink.name(), batch.size(), e.getMessage());
                    }
                    sinkAvailable = false;
                    Thread.sleep(backoffMs);
                    backoffMs = Math.min(MAX_BACKOFF_MS, backoffMs * 2L);
                    continue;
                }
                synchronized (inFlight) {
                    inFlight.clear();
                }
                written.addAndGet(batch.size());
                if (!sinkAvailable) {
                    logger.info("Trace sink {} recovered", sink.name());
                }
                sinkAvailable = true;
                backoffMs = INITIAL_BACKOFF_MS;
                signalIdle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                logger.error("Trace drain loop failed; dropping {} in-flight records", pendingInFlight(), e);
                synchronized (inFlight) {
                    dropped.addAndGet(inFlight.size());
                    accepted.addAndGet(-inFlight.size());
                    inFlight.clear();
                }
            }
        }
    }

    private int pendingInFlight() {
        synchronized (inFlight) {
            return inFlight.size();
        }
    }

    private void signalIdle() {
        synchronized (idleLock) {
            idleLock.notifyAll();
        }
    }

    private boolean sampled() {
        double rate = samplingRate;
        if (rate >= 1.0d) {
            return true;
        }
        if (rate <= 0.0d) {
            return false;
        }
        return ThreadLocalRandom.current().nextDouble() < rate;
    }

    private static double clampRate(double rate) {
        if (Double.isNaN(rate)) {
            return 1.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, rate));
    }
}
