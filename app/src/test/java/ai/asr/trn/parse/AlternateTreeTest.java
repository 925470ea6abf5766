package ai.asr.trn.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.asr.trn.transcript.Alternate;
import ai.asr.trn.transcript.Token;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlternateTreeTest {

    @Test
    void tokensGoToTranscriptWhileNoScopeIsOpen() {
        AlternateTree tree = new AlternateTree();

        tree.addToken("a");
        tree.addToken("b");

        assertThat(tree.isOpen()).isFalse();
        assertThat(tree.transcript()).containsExactly(new Token("a"), new Token("b"));
    }

    @Test
    void closedScopeBecomesOneTranscriptEntry() {
        AlternateTree tree = new AlternateTree();

        tree.open();
        tree.addToken("x");
        tree.startNewBranch();
        tree.addToken("y");
        tree.close();

        assertThat(tree.isOpen()).isFalse();
        assertThat(tree.topLevelAlternates()).isEqualTo(1);
        assertThat(tree.transcript()).containsExactly(Alternate.ofWords(List.of(List.of("x"), List.of("y"))));
    }

    @Test
    void tracksDepthOfNestedScopes() {
        AlternateTree tree = new AlternateTree();

        tree.open();
        tree.open();
        assertThat(tree.depth()).isEqualTo(2);

        tree.addToken("inner");
        tree.close();
        assertThat(tree.depth()).isEqualTo(1);
        assertThat(tree.transcript()).isEmpty();
        assertThat(tree.topLevelAlternates()).isZero();
    }

    @Test
    void openScopeContentIsNotInTranscript() {
        AlternateTree tree = new AlternateTree();

        tree.addToken("kept");
        tree.open();
        tree.addToken("pending");

        assertThat(tree.transcript()).containsExactly(new Token("kept"));
    }

    @Test
    void newBranchRequiresOpenScope() {
        AlternateTree tree = new AlternateTree();

        assertThatThrownBy(tree::startNewBranch).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeRequiresOpenScope() {
        AlternateTree tree = new AlternateTree();

        assertThatThrownBy(tree::close).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closingEmptyBranchFails() {
        AlternateTree tree = new AlternateTree();
        tree.open();

        assertThatThrownBy(tree::close).isInstanceOf(EmptyAlternateException.class);
    }
}
