package ai.asr.trn.score;

import java.util.List;
import java.util.Objects;

/**
 * Reference and hypothesis strings aligned by utterance id, sorted by id.
 */
public record ScoringInput(List<String> utteranceIds, List<String> references, List<String> hypotheses) {

    public ScoringInput {
        utteranceIds = List.copyOf(Objects.requireNonNull(utteranceIds, "utteranceIds"));
        references = List.copyOf(Objects.requireNonNull(references, "references"));
        hypotheses = List.copyOf(Objects.requireNonNull(hypotheses, "hypotheses"));
        if (references.size() != utteranceIds.size() || hypotheses.size() != utteranceIds.size()) {
            throw new IllegalArgumentException("references and hypotheses must align with utteranceIds");
        }
    }

    public int size() {
        return utteranceIds.size();
    }
}
