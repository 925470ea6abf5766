package ai.asr.trn.parse;

import ai.asr.trn.transcript.Transcript;
import ai.asr.trn.transcript.UtteranceRecord;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser reproducing sclite's reading of trn lines.
 *
 * <p>Rules that differ from a strict grammar:
 * <ul>
 *     <li>the last parenthesised group is the utterance id, spaces included; text after it is ignored</li>
 *     <li>parentheses inside the transcript are ordinary word characters</li>
 *     <li>slashes and closing braces outside an alternate are ordinary word characters</li>
 *     <li>an alternate still open at the end of the line is dropped</li>
 * </ul>
 * The parser is stateless and may be shared between threads.
 */
public class TrnLineParser implements TranscriptLineParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrnLineParser.class);

    private static final char ALTERNATE_OPEN = '{';
    private static final char ALTERNATE_CLOSE = '}';
    private static final char BRANCH_SEPARATOR = '/';

    @Override
    public Optional<UtteranceRecord> parse(String line, boolean warnOnAlternates) {
        if (line == null) {
            return Optional.empty();
        }
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return Optional.empty();
        }
        int lastOpen = stripped.lastIndexOf('(');
        int lastClose = stripped.lastIndexOf(')');
        if (lastOpen < 0 || lastClose < 0 || lastOpen > lastClose) {
            throw new TrnFormatException("Line does not end in utterance id");
        }
        String utteranceId = stripped.substring(lastOpen + 1, lastClose);
        String body = stripped.substring(0, lastOpen).strip();

        AlternateTree tree = scan(body);
        if (tree.isOpen()) {
            LOGGER.debug("Dropping unterminated alternate in utt=\"{}\"", utteranceId);
        }
        if (tree.topLevelAlternates() > 0 && warnOnAlternates) {
            LOGGER.warn("Found an alternate in transcription for utt=\"{}\". Transcript will contain an array of "
                    + "alternates at that point, and will not be compatible with flat token consumers until "
                    + "resolved. To suppress this warning, disable alternate warnings", utteranceId);
        }
        return Optional.of(new UtteranceRecord(utteranceId, new Transcript(tree.transcript())));
    }

    private AlternateTree scan(String body) {
        AlternateTree tree = new AlternateTree();
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch == ALTERNATE_OPEN) {
                flush(tree, token);
                tree.open();
            } else if (ch == BRANCH_SEPARATOR && tree.isOpen()) {
                flush(tree, token);
                tree.startNewBranch();
            } else if (ch == ALTERNATE_CLOSE && tree.isOpen()) {
                flush(tree, token);
                tree.close();
            } else if (Character.isWhitespace(ch)) {
                flush(tree, token);
            } else {
                token.append(ch);
            }
        }
        if (!tree.isOpen()) {
            flush(tree, token);
        }
        return tree;
    }

    private void flush(AlternateTree tree, StringBuilder token) {
        if (token.length() > 0) {
            tree.addToken(token.toString());
            token.setLength(0);
        }
    }
}
