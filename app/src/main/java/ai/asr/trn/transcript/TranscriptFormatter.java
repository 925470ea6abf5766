package ai.asr.trn.transcript;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders transcripts back into trn notation.
 */
public class TranscriptFormatter {

    public String format(UtteranceRecord record) {
        String body = format(record.transcript());
        String id = "(" + record.utteranceId() + ")";
        return body.isEmpty() ? id : body + " " + id;
    }

    public String format(Transcript transcript) {
        return formatEntries(transcript.entries());
    }

    private String formatEntries(List<TranscriptEntry> entries) {
        return entries.stream()
                .map(this::formatEntry)
                .collect(Collectors.joining(" "));
    }

    private String formatEntry(TranscriptEntry entry) {
        if (entry instanceof Alternate alternate) {
            return alternate.branches().stream()
                    .map(this::formatEntries)
                    .collect(Collectors.joining(" / ", "{", "}"));
        }
        return ((Token) entry).text();
    }
}
