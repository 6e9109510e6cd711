package me.christianrobert.ftranspile.frontend.preprocessing;

import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.CommentBlock;
import me.christianrobert.ftranspile.ir.Intrinsic;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.Source;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the comment clustering and pragma merging passes.
 */
class SanitizerTest {

    private static Comment comment(String text, int line) {
        return new Comment(text, new Source(line, line, text));
    }

    // ========== COMMENT CLUSTERING ==========

    @Test
    void adjacentCommentsFormOneBlock() {
        // Given
        List<Node> body = List.of(comment("! a", 1), comment("! b", 2), new Intrinsic("stop", null, null));

        // When
        List<Node> result = Sanitizer.clusterComments(body);

        // Then
        assertEquals(2, result.size());
        CommentBlock block = assertInstanceOf(CommentBlock.class, result.get(0));
        assertEquals(2, block.getComments().size());
        assertEquals(1, block.getSource().getLineStart());
        assertEquals(2, block.getSource().getLineEnd());
    }

    @Test
    void commentsSeparatedByBlankLinesStayApart() {
        List<Node> body = List.of(comment("! a", 1), comment("! b", 3));

        List<Node> result = Sanitizer.clusterComments(body);

        assertEquals(2, result.size());
        assertInstanceOf(Comment.class, result.get(0));
        assertInstanceOf(Comment.class, result.get(1));
    }

    @Test
    void singleCommentIsNotWrapped() {
        List<Node> result = Sanitizer.clusterComments(List.of(comment("! only", 4)));

        assertInstanceOf(Comment.class, result.get(0));
    }

    // ========== PRAGMAS ==========

    @Test
    void continuedPragmaAbsorbsNextLine() {
        // Given
        List<Node> body = List.of(
                new Pragma("acc", "parallel loop &", new Source(1, 1, "!$acc parallel loop &")),
                new Pragma("acc", "& gang vector", new Source(2, 2, "!$acc& gang vector")),
                new Pragma("omp", "barrier", new Source(3, 3, "!$omp barrier")));

        // When
        List<Node> result = Sanitizer.combineMultilinePragmas(body);

        // Then
        assertEquals(2, result.size());
        Pragma merged = (Pragma) result.get(0);
        assertEquals("parallel loop gang vector", merged.getContent());
        assertEquals(2, merged.getSource().getLineEnd());
        assertEquals("barrier", ((Pragma) result.get(1)).getContent());
    }

    @Test
    void pragmasWithDifferentKeywordsAreNotMerged() {
        List<Node> body = List.of(
                new Pragma("acc", "data &", null),
                new Pragma("omp", "parallel", null));

        List<Node> result = Sanitizer.combineMultilinePragmas(body);

        assertEquals(2, result.size());
        assertEquals("data &", ((Pragma) result.get(0)).getContent());
    }
}
