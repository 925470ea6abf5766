package ai.asr.trn.parse;

/**
 * The line has no trailing {@code (utterance-id)} group.
 */
public class TrnFormatException extends TrnParseException {

    public TrnFormatException(String message) {
        super(message);
    }
}
