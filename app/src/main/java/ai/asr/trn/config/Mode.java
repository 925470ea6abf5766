package ai.asr.trn.config;

/**
 * What the CLI does with the trn files it reads.
 */
public enum Mode {
    /** Print every parsed utterance of one file back in trn notation. */
    DUMP,
    /** Line up a reference and a hypothesis file for error-rate scoring. */
    PAIR;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DUMP;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean needsHypothesis() {
        return this == PAIR;
    }
}
