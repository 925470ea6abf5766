package ai.asr.trn.transcript;

/**
 * One position in a transcript: either a plain {@link Token} or an {@link Alternate}.
 */
public interface TranscriptEntry {

    boolean isAlternate();
}
