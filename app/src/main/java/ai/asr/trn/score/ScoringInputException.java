package ai.asr.trn.score;

/**
 * Reference and hypothesis transcripts cannot be handed to an error-rate computation as they are.
 */
public class ScoringInputException extends RuntimeException {

    public ScoringInputException(String message) {
        super(message);
    }
}
