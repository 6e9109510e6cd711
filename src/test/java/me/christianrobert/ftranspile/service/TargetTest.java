package me.christianrobert.ftranspile.service;

import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.codegen.fortran.FortranCodegen;
import me.christianrobert.ftranspile.codegen.maxj.MaxjCodegen;
import me.christianrobert.ftranspile.codegen.python.PyCodegen;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TargetTest {

    @Test
    void lookupByNameOrExtension() {
        assertEquals(Target.PYTHON, Target.fromName("py"));
        assertEquals(Target.MAXJ, Target.fromName(" MaxJ "));
        assertEquals(Target.FORTRAN, Target.fromName("F90"));
        assertEquals(Target.FORTRAN, Target.fromName("fortran"));
    }

    @Test
    void unknownTargetIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Target.fromName("cobol"));
        assertTrue(e.getMessage().contains("cobol"));
        assertThrows(IllegalArgumentException.class, () -> Target.fromName(null));
    }

    @Test
    void eachCallReturnsAFreshGenerator() {
        CodegenOptions options = CodegenOptions.defaults();

        assertInstanceOf(FortranCodegen.class, Target.FORTRAN.generator(options));
        assertInstanceOf(MaxjCodegen.class, Target.MAXJ.generator(options));
        assertInstanceOf(PyCodegen.class, Target.PYTHON.generator(options));
        assertNotSame(Target.PYTHON.generator(options), Target.PYTHON.generator(options));
    }
}
