package me.christianrobert.ftranspile.codegen.python;

import me.christianrobert.ftranspile.codegen.CodegenTestBase;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.scope.BasicType;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Python/NumPy printer.
 */
class PyCodegenTest extends CodegenTestBase {

    @Test
    void functionReturnsItsResult() {
        SourceFile ir = lower("""
                function twice(a) result(r)
                  real :: a, r
                  r = 2.0 * a
                end function twice
                """);

        assertEquals("""
                import numpy as np
                def twice(a: np.float64):
                    r = 2.0*a
                    return r""", PyCodegen.pygen(ir));
    }

    @Test
    void moduleVariablesPrecedeRoutines() {
        SourceFile ir = lower("""
                module consts
                  integer :: nlev = 3
                contains
                  subroutine step(x)
                    integer, intent(inout) :: x
                    x = x + nlev
                  end subroutine step
                end module consts
                """);

        assertEquals("""
                # module consts

                import numpy as np

                nlev = 3

                def step(x: np.int32):
                    x = x + nlev""", PyCodegen.pygen(ir));
    }

    @Test
    void countedLoopsUseInclusiveRange() {
        SourceFile ir = lower("""
                subroutine foo(n)
                  integer, intent(in) :: n
                  integer :: i, s
                  do i = 1, n
                    s = s + i
                  end do
                  do i = n, 1, -1
                    s = s - i
                  end do
                end subroutine foo
                """);

        String out = PyCodegen.pygen(ir);

        assertTrue(out.contains("    for i in range(1, n + 1):\n        s = s + i"), out);
        assertTrue(out.contains("    for i in range(n, 1 + -1, -1):\n        s = s - i"), out);
    }

    @Test
    void conditionalChainUsesElif() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  integer, intent(inout) :: x
                  if (x > 1 .and. x /= 5) then
                    x = 1
                  else if (x < 0) then
                    x = 0
                  else
                    x = 2
                  end if
                end subroutine foo
                """);

        assertEquals("""
                import numpy as np
                def foo(x: np.int32):
                    if x > 1 and x != 5:
                        x = 1
                    elif x < 0:
                        x = 0
                    else:
                        x = 2""", PyCodegen.pygen(ir));
    }

    @Test
    void selectCaseBecomesIfChainWithPass() {
        SourceFile ir = lower("""
                subroutine pick(n)
                  integer, intent(inout) :: n
                  select case (n)
                  case (1, 2)
                    n = 0
                  case (5:9)
                    n = 1
                  case (10)
                  case default
                    n = 2
                  end select
                end subroutine pick
                """);

        assertEquals("""
                import numpy as np
                def pick(n: np.int32):
                    if n == 1 or n == 2:
                        n = 0
                    elif 5 <= n <= 9:
                        n = 1
                    elif n == 10:
                        pass
                    else:
                        n = 2""", PyCodegen.pygen(ir));
    }

    @Test
    void emptyRoutineGetsPass() {
        SourceFile ir = lower("""
                subroutine noop()
                end subroutine noop
                """);

        assertEquals("import numpy as np\ndef noop():\n    pass", PyCodegen.pygen(ir));
    }

    @Test
    void unsupportedNodesLeaveVisibleMarker() {
        String out = PyCodegen.pygen(new Pragma("omp", "barrier", null));

        assertTrue(out.startsWith("# <"), out);
    }

    // ========== TYPE ANNOTATIONS ==========

    @Test
    void numpyTypesFollowTagKindAndShape() {
        assertEquals("np.int32", PyCodegen.numpyType(SymbolAttributes.of(BasicType.INTEGER)));
        assertEquals("np.bool_", PyCodegen.numpyType(SymbolAttributes.of(BasicType.LOGICAL)));
        assertEquals("np.float64", PyCodegen.numpyType(SymbolAttributes.of(BasicType.REAL)));
        assertEquals("np.float32", PyCodegen.numpyType(SymbolAttributes.builder()
                .dtype(BasicType.REAL).kind(new IntLiteral(4)).build()));
        assertEquals("np.ndarray", PyCodegen.numpyType(SymbolAttributes.builder()
                .dtype(BasicType.REAL).shape(List.of(new IntLiteral(3))).build()));
    }
}
