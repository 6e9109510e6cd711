package me.christianrobert.ftranspile.codegen.maxj;

import me.christianrobert.ftranspile.codegen.CodegenException;
import me.christianrobert.ftranspile.codegen.CodegenTestBase;
import me.christianrobert.ftranspile.expression.Array;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.Scalar;
import me.christianrobert.ftranspile.expression.TypedSymbol;
import me.christianrobert.ftranspile.ir.Assignment;
import me.christianrobert.ftranspile.ir.Declaration;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.Section;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.scope.BasicType;
import me.christianrobert.ftranspile.scope.Scope;
import me.christianrobert.ftranspile.scope.SymbolAttributes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the MaxJ printer.
 */
class MaxjCodegenTest extends CodegenTestBase {

    private static Module emptyModule(String name) {
        return new Module(name, new Section(List.of()), List.of(), new Scope(), null, null);
    }

    // ========== CLASS SHAPE ==========

    @Test
    void kernelModuleBecomesKernelClass() {
        SourceFile ir = lower("""
                module movekernel
                  use maxcompiler
                  real(4) :: gain
                contains
                  subroutine step(x)
                    integer, intent(in) :: x
                    gain = gain * x
                  end subroutine step
                end module movekernel
                """);

        assertEquals("""
                package move;
                import maxcompiler;
                class movekernel extends Kernel {
                  float gain;
                  step(int x) {
                    gain = gain*x;
                  }
                }""", MaxjCodegen.maxjgen(ir));
    }

    @Test
    void managerModuleBecomesInterface() {
        assertEquals("""
                package demo;
                public interface demoManager extends ManagerPCIe, ManagerKernel {
                }""", MaxjCodegen.maxjgen(emptyModule("demoManager")));
    }

    @Test
    void max5cManagerImplementsManagerInterface() {
        String out = MaxjCodegen.maxjgen(emptyModule("demoManagerMAX5C"));

        assertTrue(out.startsWith("package demo;\n"), out);
        assertTrue(out.contains("public class demoManagerMAX5C extends MAX5CManager implements demoManager {"), out);
    }

    @Test
    void otherModuleNamesAreRejected() {
        CodegenException e = assertThrows(CodegenException.class,
                () -> MaxjCodegen.maxjgen(emptyModule("physics")));

        assertEquals("MaxJ", e.getTarget());
        assertTrue(e.getMessage().contains("physics"));
    }

    // ========== STATEMENTS ==========

    @Test
    void keywordArgumentsAreRejected() {
        SourceFile ir = lower("""
                subroutine foo(x)
                  real, intent(inout) :: x
                  call update(x, scale=2.0)
                end subroutine foo
                """);

        CodegenException e = assertThrows(CodegenException.class, () -> MaxjCodegen.maxjgen(ir));
        assertNotNull(e.getNode());
    }

    @Test
    void streamArraysAreConnected() {
        // Given
        Scope scope = new Scope();
        scope.define("buf", SymbolAttributes.builder().dtype(BasicType.REAL)
                .shape(List.of(new IntLiteral(8))).stream(true).build());
        scope.define("x", SymbolAttributes.of(BasicType.REAL));
        TypedSymbol buf = new Array("buf", scope, null);
        Declaration declaration = new Declaration(List.of(buf), null, false, null, null, null);
        Assignment assignment = new Assignment(buf, new Scalar("x", scope), false, null, null, null);

        // When / Then
        assertEquals("DFEVector<DFEVar> buf;", MaxjCodegen.maxjgen(declaration));
        assertEquals("buf <== x;", MaxjCodegen.maxjgen(assignment));
    }

    @Test
    void loopsAndConditionalsUseJavaSyntax() {
        SourceFile ir = lower("""
                subroutine run(n)
                  integer, intent(in) :: n
                  integer :: i, s
                  do i = 1, n
                    s = s + i
                  end do
                  if (s == 0) then
                    s = 1
                  else
                    s = 2
                  end if
                end subroutine run
                """);

        assertEquals("""
                run(int n) {
                  int i;
                  int s;
                  for (i = 1; i <= n; i += 1) {
                    s = s + i;
                  }
                  if (s.eq(0)) {
                    s = 1;
                  } else {
                    s = 2;
                  }
                }""", MaxjCodegen.maxjgen(ir));
    }

    @Test
    void selectCaseBecomesSwitch() {
        SourceFile ir = lower("""
                subroutine pick(n)
                  integer, intent(inout) :: n
                  select case (n)
                  case (1)
                    n = 0
                  case default
                    n = 1
                  end select
                end subroutine pick
                """);

        assertEquals("""
                pick(int n) {
                  switch (n) {
                    case 1:
                      n = 0;
                      break;
                    default:
                      n = 1;
                  }
                }""", MaxjCodegen.maxjgen(ir));
    }
}
