package me.christianrobert.ftranspile.service;

import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.codegen.Stringifier;
import me.christianrobert.ftranspile.codegen.fortran.FortranCodegen;
import me.christianrobert.ftranspile.codegen.maxj.MaxjCodegen;
import me.christianrobert.ftranspile.codegen.python.PyCodegen;

import java.util.Locale;

/**
 * Output languages. Each call to {@link #generator(CodegenOptions)} returns a fresh,
 * single-use code generator.
 */
public enum Target {

    FORTRAN("f90") {
        @Override
        public Stringifier generator(CodegenOptions options) {
            return new FortranCodegen(options);
        }
    },
    MAXJ("maxj") {
        @Override
        public Stringifier generator(CodegenOptions options) {
            return new MaxjCodegen(options);
        }
    },
    PYTHON("py") {
        @Override
        public Stringifier generator(CodegenOptions options) {
            return new PyCodegen(options);
        }
    };

    private final String extension;

    Target(String extension) {
        this.extension = extension;
    }

    public abstract Stringifier generator(CodegenOptions options);

    public String getExtension() {
        return extension;
    }

    /**
     * Case-insensitive lookup by constant name or file extension.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static Target fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Target name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Target target : values()) {
            if (target.name().toLowerCase(Locale.ROOT).equals(normalized) || target.extension.equals(normalized)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown target: " + name);
    }
}
