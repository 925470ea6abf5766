package ai.asr.trn.score;

import ai.asr.trn.transcript.Transcript;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a reference and a hypothesis file describe the same utterances and lines them up for scoring.
 */
public class ScoringInputPreparer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScoringInputPreparer.class);

    private final TranscriptFlattener flattener;

    public ScoringInputPreparer() {
        this(new TranscriptFlattener());
    }

    public ScoringInputPreparer(TranscriptFlattener flattener) {
        this.flattener = Objects.requireNonNull(flattener, "flattener");
    }

    public ScoringInput prepare(Map<String, Transcript> references, Map<String, Transcript> hypotheses) {
        Objects.requireNonNull(references, "references");
        Objects.requireNonNull(hypotheses, "hypotheses");

        Set<String> emptyReferences = references.entrySet().stream()
                .filter(entry -> entry.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!emptyReferences.isEmpty()) {
            throw new ScoringInputException("One or more reference transcriptions are empty: "
                    + String.join(", ", emptyReferences));
        }

        Set<String> ids = new TreeSet<>(references.keySet());
        if (!ids.equals(hypotheses.keySet())) {
            throw new ScoringInputException(describeMismatch(ids, hypotheses.keySet()));
        }

        List<String> referenceText = new ArrayList<>(ids.size());
        List<String> hypothesisText = new ArrayList<>(ids.size());
        for (String id : ids) {
            referenceText.add(flattener.join(id, references.get(id)));
            hypothesisText.add(flattener.join(id, hypotheses.get(id)));
        }
        LOGGER.info("Prepared {} reference/hypothesis pairs", ids.size());
        return new ScoringInput(new ArrayList<>(ids), referenceText, hypothesisText);
    }

    private static String describeMismatch(Set<String> referenceIds, Set<String> hypothesisIds) {
        Set<String> missingFromHypothesis = new TreeSet<>(referenceIds);
        missingFromHypothesis.removeAll(hypothesisIds);
        Set<String> missingFromReference = new TreeSet<>(hypothesisIds);
        missingFromReference.removeAll(referenceIds);

        StringBuilder message = new StringBuilder("ref and hyp file have different utterances!");
        if (!missingFromHypothesis.isEmpty()) {
            message.append(" Missing from hyp: ").append(String.join(" ", missingFromHypothesis));
        }
        if (!missingFromReference.isEmpty()) {
            message.append(" Missing from ref: ").append(String.join(" ", missingFromReference));
        }
        return message.toString();
    }
}
