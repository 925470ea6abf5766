package ai.asr.trn.transcript;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Competing entry sequences at the same transcript position, written {@code {a / b}} in trn files.
 * Branches may nest further alternates.
 */
public record Alternate(List<List<TranscriptEntry>> branches) implements TranscriptEntry {

    public Alternate {
        Objects.requireNonNull(branches, "branches");
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("alternate must have at least one branch");
        }
        branches = branches.stream()
                .map(List::copyOf)
                .collect(Collectors.toUnmodifiableList());
    }

    public static Alternate ofWords(List<List<String>> words) {
        return new Alternate(words.stream()
                .map(branch -> branch.stream()
                        .<TranscriptEntry>map(Token::new)
                        .collect(Collectors.toList()))
                .collect(Collectors.toList()));
    }

    @Override
    public boolean isAlternate() {
        return true;
    }
}
