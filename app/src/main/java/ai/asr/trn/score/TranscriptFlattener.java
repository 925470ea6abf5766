package ai.asr.trn.score;

import ai.asr.trn.transcript.Token;
import ai.asr.trn.transcript.Transcript;
import ai.asr.trn.transcript.TranscriptEntry;
import java.util.stream.Collectors;

/**
 * Joins the plain tokens of a transcript into the single string word-error-rate tools expect.
 */
public class TranscriptFlattener {

    public String join(String utteranceId, Transcript transcript) {
        if (transcript.hasAlternates()) {
            throw new ScoringInputException("Transcript for utterance " + utteranceId
                    + " contains unresolved alternates");
        }
        return transcript.entries().stream()
                .map(TranscriptFlattener::text)
                .collect(Collectors.joining(" "));
    }

    private static String text(TranscriptEntry entry) {
        return ((Token) entry).text();
    }
}
