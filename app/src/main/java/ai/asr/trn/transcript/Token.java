package ai.asr.trn.transcript;

import java.util.Objects;

/**
 * A single word-like unit taken verbatim from the source line.
 */
public record Token(String text) implements TranscriptEntry {

    public Token {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("token text must not be empty");
        }
    }

    @Override
    public boolean isAlternate() {
        return false;
    }

    @Override
    public String toString() {
        return text;
    }
}
