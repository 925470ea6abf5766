package ai.asr.trn.read;

/**
 * Settings for reading a whole trn file.
 *
 * @param warnOnAlternates log a warning for every utterance holding an alternate
 * @param workers number of parser threads; zero parses in the reading thread
 * @param chunkSize lines handed to a worker at a time
 */
public record ReadOptions(boolean warnOnAlternates, int workers, int chunkSize) {

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    public ReadOptions {
        if (workers < 0) {
            throw new IllegalArgumentException("workers must be zero or greater");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1");
        }
    }

    public static ReadOptions defaults() {
        return new ReadOptions(true, 0, DEFAULT_CHUNK_SIZE);
    }

    public ReadOptions withoutWarnings() {
        return new ReadOptions(false, workers, chunkSize);
    }

    public boolean isParallel() {
        return workers > 0;
    }
}
