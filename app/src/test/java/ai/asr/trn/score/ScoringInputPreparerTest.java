package ai.asr.trn.score;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.asr.trn.transcript.Alternate;
import ai.asr.trn.transcript.Token;
import ai.asr.trn.transcript.Transcript;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScoringInputPreparerTest {

    private final ScoringInputPreparer preparer = new ScoringInputPreparer();

    @Test
    void alignsReferenceAndHypothesisSortedById() {
        Map<String, Transcript> references = new LinkedHashMap<>();
        references.put("utt2", Transcript.ofWords("good", "morning"));
        references.put("utt1", Transcript.ofWords("hello", "world"));
        Map<String, Transcript> hypotheses = Map.of(
                "utt1", Transcript.ofWords("hello", "word"),
                "utt2", Transcript.empty());

        ScoringInput input = preparer.prepare(references, hypotheses);

        assertThat(input.utteranceIds()).containsExactly("utt1", "utt2");
        assertThat(input.references()).containsExactly("hello world", "good morning");
        assertThat(input.hypotheses()).containsExactly("hello word", "");
    }

    @Test
    void rejectsEmptyReferences() {
        Map<String, Transcript> references = Map.of(
                "b", Transcript.empty(),
                "a", Transcript.empty(),
                "c", Transcript.ofWords("fine"));

        assertThatThrownBy(() -> preparer.prepare(references, Map.of()))
                .isInstanceOf(ScoringInputException.class)
                .hasMessageContaining("reference transcriptions are empty: a, b");
    }

    @Test
    void listsUtterancesMissingOnEitherSide() {
        Map<String, Transcript> references = Map.of(
                "shared", Transcript.ofWords("x"),
                "onlyRef", Transcript.ofWords("y"));
        Map<String, Transcript> hypotheses = Map.of(
                "shared", Transcript.ofWords("x"),
                "onlyHyp", Transcript.ofWords("z"));

        assertThatThrownBy(() -> preparer.prepare(references, hypotheses))
                .isInstanceOf(ScoringInputException.class)
                .hasMessageContaining("Missing from hyp: onlyRef")
                .hasMessageContaining("Missing from ref: onlyHyp");
    }

    @Test
    void refusesToFlattenUnresolvedAlternates() {
        Transcript withAlternate = Transcript.of(new Token("a"), Alternate.ofWords(List.of(List.of("b"), List.of("c"))));

        assertThatThrownBy(() -> new TranscriptFlattener().join("utt1", withAlternate))
                .isInstanceOf(ScoringInputException.class)
                .hasMessageContaining("utt1");
    }
}
