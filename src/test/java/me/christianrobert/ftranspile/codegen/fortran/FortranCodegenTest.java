package me.christianrobert.ftranspile.codegen.fortran;

import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.codegen.CodegenTestBase;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.ir.CallStatement;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.scope.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Fortran printer.
 */
class FortranCodegenTest extends CodegenTestBase {

    private Scope scope;

    @BeforeEach
    void setUp() {
        scope = new Scope();
    }

    private CallStatement call(String name, String... args) {
        List<Expression> arguments = new ArrayList<>();
        for (String arg : args) {
            arguments.add(new Scalar(arg, scope));
        }
        return new CallStatement(name, arguments, Map.of(), null, null, null);
    }

    // ========== PROGRAM UNITS ==========

    @Test
    void moduleWithContainedRoutine() {
        SourceFile ir = lower("""
                module solver
                  integer :: nlev
                contains
                  subroutine step(x)
                    real :: x
                    x = x * 0.5
                  end subroutine step
                end module solver
                """);

        assertEquals("""
                MODULE solver
                  INTEGER :: nlev
                CONTAINS
                  SUBROUTINE step(x)
                    REAL :: x
                    x = x*0.5
                  END SUBROUTINE step
                END MODULE solver""", FortranCodegen.fgen(ir));
    }

    @Test
    void functionWithResultAndUse() {
        SourceFile ir = lower("""
                function twice(a) result(r)
                  use consts, only: factor
                  real(8) :: a, r
                  r = factor * a
                end function twice
                """);

        assertEquals("""
                FUNCTION twice(a) RESULT(r)
                  USE consts, ONLY: factor
                  REAL(KIND=8) :: a, r
                  r = factor*a
                END FUNCTION twice""", FortranCodegen.fgen(ir));
    }

    // ========== CONTROL FLOW ==========

    @Test
    void ifElseIfChainIsFolded() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  integer :: x
                  if (x > 1) then
                    x = 1
                  else if (x /= 0) then
                    x = 0
                  else
                    x = 2
                  end if
                  if (x > 1) x = 0
                end subroutine foo
                """);

        String out = FortranCodegen.fgen(ir);

        assertTrue(out.contains("""
                  IF (x > 1) THEN
                    x = 1
                  ELSE IF (x /= 0) THEN
                    x = 0
                  ELSE
                    x = 2
                  END IF
                """), out);
        assertTrue(out.contains("  IF (x > 1) x = 0\n"), out);
    }

    @Test
    void labelledDoIsReemittedWithEndDo() {
        SourceFile ir = lower("""
                subroutine foo(n)
                  integer :: n, i, s
                  do 10 i = 1, n, 2
                    s = s + i
                10 continue
                end subroutine foo
                """);

        String out = FortranCodegen.fgen(ir);

        assertTrue(out.contains("""
                  DO 10 i=1, n, 2
                    s = s + i
                  10 END DO
                """), out);
    }

    @Test
    void selectCaseWithRangeAndDefault() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  integer :: x
                  select case (x)
                  case (1, 2)
                    x = 0
                  case (3:)
                    x = 1
                  case default
                    x = 2
                  end select
                end subroutine foo
                """);

        String out = FortranCodegen.fgen(ir);

        assertTrue(out.contains("""
                  SELECT CASE (x)
                  CASE (1, 2)
                    x = 0
                  CASE (3:)
                    x = 1
                  CASE DEFAULT
                    x = 2
                  END SELECT
                """), out);
    }

    @Test
    void commentsAndPragmasArePrintedVerbatim() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  integer :: x
                  !$omp parallel
                  x = 1 ! reset
                  ! done
                end subroutine foo
                """);

        String out = FortranCodegen.fgen(ir);

        assertTrue(out.contains("  !$omp parallel\n"), out);
        assertTrue(out.contains("  x = 1  ! reset\n"), out);
        assertTrue(out.contains("  ! done\n"), out);
    }

    @Test
    void typedExternalsKeepTheirReturnType() {
        // Given
        SourceFile ir = lower("""
                subroutine foo()
                  implicit none
                  real, external :: f
                  external :: s
                end subroutine foo
                """);

        // When
        String out = FortranCodegen.fgen(ir);

        // Then
        assertTrue(out.contains("  REAL, EXTERNAL :: f\n"), out);
        assertTrue(out.contains("  external :: s\n"), out);
    }

    @Test
    void unsupportedUseFormsAreReemittedVerbatim() {
        SourceFile ir = lower("""
                subroutine foo()
                  use faraway, thing => other
                end subroutine foo
                """);

        String out = FortranCodegen.fgen(ir);

        assertTrue(out.contains("  use faraway, thing => other\n"), out);
    }

    @Test
    void explicitParenthesesSurviveRegeneration() {
        // Given
        SourceFile ir = lower("""
                subroutine foo(a, b, c, x, s)
                  logical :: a, b, c
                  integer :: x
                  character(len=8) :: s
                  a = (a .and. b) .or. c
                  a = (x == 1)
                  s = (s // s) // s
                end subroutine foo
                """);

        // When
        String out = FortranCodegen.fgen(ir);

        // Then
        assertTrue(out.contains("  a = (a .and. b) .or. c\n"), out);
        assertTrue(out.contains("  a = (x == 1)\n"), out);
        assertTrue(out.contains("  s = (s // s) // s\n"), out);
    }

    @Test
    void cppLinesStayInColumnOne() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  integer :: x
                #ifdef DEBUG
                  x = 1
                #endif
                end subroutine foo
                """);

        String out = FortranCodegen.fgen(ir);

        assertTrue(out.contains("\n#ifdef DEBUG\n  x = 1\n#endif\n"), out);
    }

    // ========== LINE LAYOUT ==========

    @Test
    void longLinesAreContinued() {
        FortranCodegen codegen = new FortranCodegen(new CodegenOptions(30, 4, false));

        String out = codegen.generate(call("update", "alpha", "beta", "gamma", "delta"));

        assertEquals("CALL update(alpha, beta, &\n& gamma, delta)", out);
        for (String line : out.split("\n")) {
            assertTrue(line.length() <= 30, line);
        }
    }

    @Test
    void argumentListsAreChunked() {
        FortranCodegen codegen = new FortranCodegen(new CodegenOptions(200, 2, false));

        String out = codegen.generate(call("f", "a", "b", "c", "d", "e"));

        assertEquals("CALL f(a, b, &\n& c, d, &\n& e)", out);
    }

    @Test
    void pragmasAreNeverWrapped() {
        FortranCodegen codegen = new FortranCodegen(new CodegenOptions(20, 4, false));
        String content = "parallel do private(i, j, k) schedule(static)";

        String out = codegen.generate(new Pragma("omp", content, null));

        assertEquals("!$omp " + content, out);
    }

    @Test
    void conservativeModeReusesOriginalStatementText() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  integer :: x
                  x=x+1
                end subroutine foo
                """);

        String conservative = new FortranCodegen(CodegenOptions.defaults().withConservative(true)).generate(ir);
        String regenerated = FortranCodegen.fgen(ir);

        assertTrue(conservative.startsWith("SUBROUTINE foo(x)"), conservative);
        assertTrue(conservative.contains("  x=x+1\n"), conservative);
        assertTrue(regenerated.contains("  x = x + 1\n"), regenerated);
    }
}
