package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.frontend.context.StructuralViolationException;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.frontend.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for splitting flat construct children into branches.
 */
class ConstructLayoutTest {

    private static final String SOURCE = """
            subroutine foo(x)
              integer :: x
              if (x > 1) then
                x = 1
              else if (x < 0) then
                x = 0
              else
                x = 2
                x = x + 1
              end if
            end subroutine foo
            """;

    private FortranParser.IfConstructContext ifConstruct;
    private SourceText text;

    @BeforeEach
    void setUp() {
        ParseResult result = new AntlrParser().parseProgram(SOURCE);
        assertFalse(result.hasErrors(), result::getErrorMessage);
        text = new SourceText(result.getOriginalSource(), result.getTokens());

        FortranParser.ProgramContext program = (FortranParser.ProgramContext) result.getTree();
        ifConstruct = program.programItem(0).subprogram().subroutineSubprogram()
                .executionPart().executionItem(0).ifConstruct();
        assertNotNull(ifConstruct);
    }

    private ConstructLayout ifLayout() {
        return ConstructLayout.of(ifConstruct, FortranParser.IfThenStmtContext.class,
                List.of(FortranParser.EndIfStmtContext.class),
                List.of(FortranParser.ElseIfStmtContext.class, FortranParser.ElseStmtContext.class), text);
    }

    @Test
    void branchesFollowSourceOrder() {
        // When
        ConstructLayout layout = ifLayout();

        // Then
        assertTrue(layout.getPre().isEmpty());
        assertEquals(3, layout.getBranches().size());
        assertInstanceOf(FortranParser.IfThenStmtContext.class, layout.getBranches().get(0).getMarker());
        assertInstanceOf(FortranParser.ElseIfStmtContext.class, layout.getBranches().get(1).getMarker());
        assertInstanceOf(FortranParser.ElseStmtContext.class, layout.getBranches().get(2).getMarker());
        assertSame(layout.getBranches().get(0), layout.getFirst());
        assertInstanceOf(FortranParser.EndIfStmtContext.class, layout.getEnd());
    }

    @Test
    void itemsBelongToTheirBranch() {
        ConstructLayout layout = ifLayout();

        assertEquals(1, layout.getBranches().get(0).getItems().size());
        assertEquals(1, layout.getBranches().get(1).getItems().size());
        assertEquals(2, layout.getBranches().get(2).getItems().size());
    }

    // ========== STRUCTURAL VIOLATIONS ==========

    @Test
    void missingStartMarker() {
        StructuralViolationException e = assertThrows(StructuralViolationException.class,
                () -> ConstructLayout.of(ifConstruct, FortranParser.DoStmtContext.class,
                        List.of(FortranParser.EndIfStmtContext.class), List.of(), text));

        assertEquals("ifConstruct", e.getConstruct());
        assertTrue(e.getMessage().contains("DoStmtContext"));
    }

    @Test
    void missingEndMarker() {
        StructuralViolationException e = assertThrows(StructuralViolationException.class,
                () -> ConstructLayout.of(ifConstruct, FortranParser.IfThenStmtContext.class,
                        List.of(FortranParser.EndDoStmtContext.class), List.of(), text));

        assertTrue(e.getMessage().contains("End marker"));
    }

    @Test
    void nodeAfterEndMarker() {
        // Given
        ifConstruct.addAnyChild(new FortranParser.AssignmentStmtContext(ifConstruct, 0));

        // When / Then
        StructuralViolationException e = assertThrows(StructuralViolationException.class, this::ifLayout);
        assertTrue(e.getMessage().contains("after the end marker"));
    }
}
