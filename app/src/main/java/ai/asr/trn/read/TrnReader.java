package ai.asr.trn.read;

import ai.asr.trn.parse.TranscriptLineParser;
import ai.asr.trn.parse.TrnLineParser;
import ai.asr.trn.transcript.Transcript;
import ai.asr.trn.transcript.UtteranceRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads NIST sclite trn files into utterance records.
 *
 * <p>Blank lines are skipped. The first malformed line aborts the read with a {@link TrnReadException};
 * no partial result is returned from {@link #readAll(Path)} or {@link #readMap(Path)}.
 */
public class TrnReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrnReader.class);

    private final TranscriptLineParser parser;
    private final ReadOptions options;

    public TrnReader() {
        this(new TrnLineParser(), ReadOptions.defaults());
    }

    public TrnReader(ReadOptions options) {
        this(new TrnLineParser(), options);
    }

    public TrnReader(TranscriptLineParser parser, ReadOptions options) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.options = Objects.requireNonNull(options, "options");
    }

    public ReadOptions options() {
        return options;
    }

    /**
     * Lazily parses {@code path}. The returned stream must be closed to release the file and any workers.
     */
    public Stream<UtteranceRecord> stream(Path path) {
        Objects.requireNonNull(path, "path");
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to open trn file: " + path, ex);
        }
        return stream(path.toString(), reader);
    }

    /**
     * Lazily parses the lines of {@code reader}. Closing the stream closes the reader.
     */
    public Stream<UtteranceRecord> stream(String sourceName, Reader reader) {
        RecordIterator iterator = open(sourceName, reader);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(iterator::close);
    }

    public List<UtteranceRecord> readAll(Path path) {
        try (Stream<UtteranceRecord> records = stream(path)) {
            List<UtteranceRecord> result = records.collect(Collectors.toList());
            LOGGER.info("Read {} utterances from {}", result.size(), path);
            return result;
        }
    }

    /**
     * Reads {@code path} into a map keyed by utterance id, in file order. A repeated id keeps its last transcript.
     */
    public Map<String, Transcript> readMap(Path path) {
        Map<String, Transcript> transcripts = new LinkedHashMap<>();
        for (UtteranceRecord record : readAll(path)) {
            if (transcripts.put(record.utteranceId(), record.transcript()) != null) {
                LOGGER.debug("Utterance {} appears more than once in {}", record.utteranceId(), path);
            }
        }
        return transcripts;
    }

    private RecordIterator open(String sourceName, Reader reader) {
        BufferedReader buffered = reader instanceof BufferedReader bufferedReader
                ? bufferedReader
                : new BufferedReader(reader);
        LineSource source = new LineSource(sourceName, buffered);
        if (options.isParallel()) {
            return new ParallelRecordIterator(source, parser, options);
        }
        return new SequentialRecordIterator(source, parser, options.warnOnAlternates());
    }
}
