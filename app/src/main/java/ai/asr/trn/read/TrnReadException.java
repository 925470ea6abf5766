package ai.asr.trn.read;

import ai.asr.trn.parse.TrnParseException;

/**
 * Aborts a trn read at the first malformed line.
 */
public class TrnReadException extends RuntimeException {

    private final String source;
    private final long lineNumber;
    private final String line;

    public TrnReadException(String source, long lineNumber, String line, TrnParseException cause) {
        super(String.format("%s:%d: %s: %s", source, lineNumber, cause.getMessage(), line.strip()), cause);
        this.source = source;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public String source() {
        return source;
    }

    public long lineNumber() {
        return lineNumber;
    }

    public String line() {
        return line;
    }
}
