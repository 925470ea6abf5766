package ai.asr.trn.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptFormatterTest {

    private final TranscriptFormatter formatter = new TranscriptFormatter();

    @Test
    void writesWordsFollowedByUtteranceId() {
        UtteranceRecord record = new UtteranceRecord("utt1", Transcript.ofWords("hello", "world"));

        assertThat(formatter.format(record)).isEqualTo("hello world (utt1)");
    }

    @Test
    void writesAlternatesWithBracesAndSlashes() {
        Alternate inner = Alternate.ofWords(List.of(List.of("b"), List.of("c")));
        Transcript transcript = Transcript.of(
                new Token("a"),
                new Alternate(List.of(List.<TranscriptEntry>of(new Token("x"), inner), List.<TranscriptEntry>of())),
                new Token("d"));

        assertThat(formatter.format(transcript)).isEqualTo("a {x {b / c} / } d");
    }

    @Test
    void emptyTranscriptIsJustTheId() {
        assertThat(formatter.format(new UtteranceRecord("spk 1", Transcript.empty()))).isEqualTo("(spk 1)");
    }

    @Test
    void modelRejectsInvalidParts() {
        assertThatThrownBy(() -> new Token("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Alternate(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
