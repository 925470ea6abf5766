package ai.asr.trn.parse;

import ai.asr.trn.transcript.Alternate;
import ai.asr.trn.transcript.Token;
import ai.asr.trn.transcript.TranscriptEntry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tracks the alternate scopes opened while scanning one line.
 *
 * <p>The bottom of the stack is the transcript itself; every opening brace pushes a frame holding the
 * branches collected so far. A frame is turned into an {@link Alternate} when it closes and added to
 * whatever is below it. Instances are single-use and not thread-safe.
 */
final class AlternateTree {

    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private int topLevelAlternates;

    boolean isOpen() {
        return !frames.isEmpty();
    }

    int depth() {
        return frames.size();
    }

    /**
     * Alternates closed directly into the transcript. Nested ones count through their outermost group.
     */
    int topLevelAlternates() {
        return topLevelAlternates;
    }

    void addToken(String text) {
        currentTarget().add(new Token(text));
    }

    void open() {
        frames.push(new Frame());
    }

    void startNewBranch() {
        if (!isOpen()) {
            throw new IllegalStateException("Branch separator outside of an alternate");
        }
        frames.peek().startNewBranch();
    }

    void close() {
        if (!isOpen()) {
            throw new IllegalStateException("No alternate is open");
        }
        Frame frame = frames.peek();
        if (frame.currentBranch().isEmpty()) {
            throw new EmptyAlternateException("Empty alternate found (\"{ }\")");
        }
        frames.pop();
        currentTarget().add(new Alternate(frame.branches));
        if (!isOpen()) {
            topLevelAlternates++;
        }
    }

    /**
     * Entries collected at the top level. Frames still open are not part of the result.
     */
    List<TranscriptEntry> transcript() {
        return transcript;
    }

    private List<TranscriptEntry> currentTarget() {
        return isOpen() ? frames.peek().currentBranch() : transcript;
    }

    private static final class Frame {

        private final List<List<TranscriptEntry>> branches = new ArrayList<>();

        private Frame() {
            branches.add(new ArrayList<>());
        }

        private List<TranscriptEntry> currentBranch() {
            return branches.get(branches.size() - 1);
        }

        private void startNewBranch() {
            branches.add(new ArrayList<>());
        }
    }
}
