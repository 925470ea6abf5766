package ai.asr.trn.read;

import ai.asr.trn.parse.TranscriptLineParser;
import ai.asr.trn.parse.TrnParseException;
import ai.asr.trn.transcript.UtteranceRecord;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reads chunks of lines in the calling thread and parses them on a fixed pool of workers.
 *
 * <p>At most two chunks per worker are in flight. Chunks are collected in submission order, so records
 * come out in the same order as the lines. The first failure cancels every outstanding chunk and stops
 * the pool before it is rethrown.
 */
final class ParallelRecordIterator implements RecordIterator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParallelRecordIterator.class);
    static final String MDC_SOURCE = "trn.source";

    private final LineSource source;
    private final TranscriptLineParser parser;
    private final boolean warnOnAlternates;
    private final int chunkSize;
    private final int maxInFlight;
    private final ExecutorService executor;
    private final Deque<Future<List<UtteranceRecord>>> inFlight = new ArrayDeque<>();
    private Iterator<UtteranceRecord> current = Collections.emptyIterator();
    private boolean sourceExhausted;
    private boolean closed;

    ParallelRecordIterator(LineSource source, TranscriptLineParser parser, ReadOptions options) {
        if (!options.isParallel()) {
            throw new IllegalArgumentException("Parallel reading requires at least one worker");
        }
        this.source = source;
        this.parser = parser;
        this.warnOnAlternates = options.warnOnAlternates();
        this.chunkSize = options.chunkSize();
        this.maxInFlight = options.workers() * 2;
        this.executor = Executors.newFixedThreadPool(options.workers(), workerThreads());
        LOGGER.debug("Parsing {} with {} workers, {} lines per chunk", source.name(), options.workers(), chunkSize);
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (closed) {
                return false;
            }
            dispatch();
            Future<List<UtteranceRecord>> next = inFlight.poll();
            if (next == null) {
                close();
                return false;
            }
            current = await(next).iterator();
        }
        return true;
    }

    @Override
    public UtteranceRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!inFlight.isEmpty()) {
            LOGGER.debug("Cancelling {} outstanding chunks of {}", inFlight.size(), source.name());
        }
        inFlight.forEach(future -> future.cancel(true));
        inFlight.clear();
        executor.shutdownNow();
        source.close();
    }

    private void dispatch() {
        try {
            while (!sourceExhausted && inFlight.size() < maxInFlight) {
                List<NumberedLine> chunk = source.nextChunk(chunkSize);
                if (chunk.isEmpty()) {
                    sourceExhausted = true;
                    return;
                }
                inFlight.add(executor.submit(() -> parseChunk(chunk)));
            }
        } catch (RuntimeException ex) {
            close();
            throw ex;
        }
    }

    private List<UtteranceRecord> await(Future<List<UtteranceRecord>> future) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            close();
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Trn parser worker failed", cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            close();
            throw new IllegalStateException("Interrupted while waiting for trn parser workers", ex);
        }
    }

    private List<UtteranceRecord> parseChunk(List<NumberedLine> chunk) {
        List<UtteranceRecord> records = new ArrayList<>(chunk.size());
        MDC.put(MDC_SOURCE, source.name());
        try {
            for (NumberedLine line : chunk) {
                if (Thread.currentThread().isInterrupted()) {
                    return records;
                }
                try {
                    parser.parse(line.text(), warnOnAlternates).ifPresent(records::add);
                } catch (TrnParseException ex) {
                    throw new TrnReadException(source.name(), line.number(), line.text(), ex);
                }
            }
            return records;
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "trn-parser-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
