package ai.asr.trn.parse;

import ai.asr.trn.transcript.UtteranceRecord;
import java.util.Optional;

/**
 * Turns single trn lines into utterance records.
 */
public interface TranscriptLineParser {

    /**
     * Parses one line.
     *
     * @param line raw line, with or without its trailing newline
     * @param warnOnAlternates log a warning when the transcript contains alternates
     * @return the record, or empty when the line is blank
     * @throws TrnParseException when the line is malformed
     */
    Optional<UtteranceRecord> parse(String line, boolean warnOnAlternates);

    default Optional<UtteranceRecord> parse(String line) {
        return parse(line, true);
    }
}
