package ai.asr.trn.parse;

/**
 * Runtime exception raised when a trn line cannot be turned into an utterance record.
 */
public class TrnParseException extends RuntimeException {

    public TrnParseException(String message) {
        super(message);
    }
}
