package ai.asr.trn.read;

import ai.asr.trn.parse.TranscriptLineParser;
import ai.asr.trn.parse.TrnParseException;
import ai.asr.trn.transcript.UtteranceRecord;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Parses lines in the calling thread as they are requested.
 */
final class SequentialRecordIterator implements RecordIterator {

    private final LineSource source;
    private final TranscriptLineParser parser;
    private final boolean warnOnAlternates;
    private UtteranceRecord next;

    SequentialRecordIterator(LineSource source, TranscriptLineParser parser, boolean warnOnAlternates) {
        this.source = source;
        this.parser = parser;
        this.warnOnAlternates = warnOnAlternates;
    }

    @Override
    public boolean hasNext() {
        while (next == null) {
            NumberedLine line = source.next();
            if (line == null) {
                return false;
            }
            next = parseLine(line).orElse(null);
        }
        return true;
    }

    @Override
    public UtteranceRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        UtteranceRecord record = next;
        next = null;
        return record;
    }

    @Override
    public void close() {
        source.close();
    }

    private Optional<UtteranceRecord> parseLine(NumberedLine line) {
        try {
            return parser.parse(line.text(), warnOnAlternates);
        } catch (TrnParseException ex) {
            throw new TrnReadException(source.name(), line.number(), line.text(), ex);
        }
    }
}
