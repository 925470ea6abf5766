package ai.asr.trn.parse;

/**
 * An alternate group was closed while its last branch held nothing, as in <code>{}</code> or <code>{a / }</code>.
 */
public class EmptyAlternateException extends TrnParseException {

    public EmptyAlternateException(String message) {
        super(message);
    }
}
