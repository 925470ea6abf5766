package ai.asr.trn.read;

import java.util.Objects;

/**
 * A raw line together with its 1-based position in the source.
 */
record NumberedLine(long number, String text) {

    NumberedLine {
        Objects.requireNonNull(text, "text");
    }
}
