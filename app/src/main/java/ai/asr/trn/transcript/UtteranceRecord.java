package ai.asr.trn.transcript;

import java.util.Objects;

/**
 * A parsed trn line: the utterance identifier and its transcript.
 */
public record UtteranceRecord(String utteranceId, Transcript transcript) {

    public UtteranceRecord {
        Objects.requireNonNull(utteranceId, "utteranceId");
        Objects.requireNonNull(transcript, "transcript");
    }

    public boolean hasAlternates() {
        return transcript.hasAlternates();
    }
}
