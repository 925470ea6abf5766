package ai.asr.trn.transcript;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered entries of one utterance, left to right as they appear in the source line.
 */
public record Transcript(List<TranscriptEntry> entries) {

    public Transcript {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static Transcript empty() {
        return new Transcript(List.of());
    }

    public static Transcript of(TranscriptEntry... entries) {
        return new Transcript(Arrays.asList(entries));
    }

    public static Transcript ofWords(String... words) {
        return new Transcript(Arrays.stream(words).<TranscriptEntry>map(Token::new).toList());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean hasAlternates() {
        return entries.stream().anyMatch(TranscriptEntry::isAlternate);
    }
}
