package me.christianrobert.ftranspile.codegen;

import me.christianrobert.ftranspile.codegen.fortran.FortranCodegen;
import me.christianrobert.ftranspile.codegen.maxj.MaxjCodegen;
import me.christianrobert.ftranspile.codegen.python.PyCodegen;
import me.christianrobert.ftranspile.ir.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One lowered routine printed by every backend.
 */
class BackendDivergenceTest extends CodegenTestBase {

    private SourceFile ir;

    @BeforeEach
    void setUp() {
        ir = lower("""
                subroutine foo(x)
                  integer, intent(inout) :: x
                  x = x + 1
                end subroutine foo
                """);
    }

    @Test
    void fortranKeepsDeclarations() {
        assertEquals("""
                SUBROUTINE foo(x)
                  INTEGER, INTENT(INOUT) :: x
                  x = x + 1
                END SUBROUTINE foo""", FortranCodegen.fgen(ir));
    }

    @Test
    void maxjDropsIntentDeclarations() {
        assertEquals("""
                foo(int x) {
                  x = x + 1;
                }""", MaxjCodegen.maxjgen(ir));
    }

    @Test
    void pythonAnnotatesArguments() {
        assertEquals("""
                import numpy as np
                def foo(x: np.int32):
                    x = x + 1""", PyCodegen.pygen(ir));
    }

    @Test
    void printersDoNotChangeTheIr() {
        // Given
        String before = FortranCodegen.fgen(ir);

        // When
        MaxjCodegen.maxjgen(ir);
        PyCodegen.pygen(ir);

        // Then
        assertEquals(before, FortranCodegen.fgen(ir));
    }
}
