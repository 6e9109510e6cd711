package me.christianrobert.ftranspile.scope;

import me.christianrobert.ftranspile.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Type and attribute record bound to a name within a {@link Scope}.
 *
 * <p>Instances are immutable. Updates go through {@link #toBuilder()} or one of the
 * {@code with*} shortcuts, which return a modified copy and leave the original
 * (possibly shared by several symbols of one declaration) untouched.</p>
 *
 * <pre>
 * SymbolAttributes base = SymbolAttributes.of(BasicType.REAL);
 * SymbolAttributes arr  = base.withShape(List.of(new IntLiteral(10)));
 * </pre>
 */
public class SymbolAttributes {

    private final DataType dtype;
    private final Expression kind;
    private final Expression length;
    private final List<Expression> shape;
    private final String intent;
    private final Expression initial;
    private final String module;
    private final boolean allocatable;
    private final boolean pointer;
    private final boolean optional;
    private final boolean parameter;
    private final boolean target;
    private final boolean contiguous;
    private final boolean external;
    private final boolean imported;
    private final boolean stream;

    private SymbolAttributes(Builder b) {
        this.dtype = b.dtype != null ? b.dtype : BasicType.DEFERRED;
        this.kind = b.kind;
        this.length = b.length;
        this.shape = b.shape != null ? Collections.unmodifiableList(new ArrayList<>(b.shape)) : null;
        this.intent = b.intent;
        this.initial = b.initial;
        this.module = b.module;
        this.allocatable = b.allocatable;
        this.pointer = b.pointer;
        this.optional = b.optional;
        this.parameter = b.parameter;
        this.target = b.target;
        this.contiguous = b.contiguous;
        this.external = b.external;
        this.imported = b.imported;
        this.stream = b.stream;
    }

    public static SymbolAttributes of(DataType dtype) {
        return builder().dtype(dtype).build();
    }

    /**
     * Attributes of a name whose type is unknown (e.g. imported from an unavailable module).
     */
    public static SymbolAttributes deferred() {
        return of(BasicType.DEFERRED);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.dtype = dtype;
        b.kind = kind;
        b.length = length;
        b.shape = shape;
        b.intent = intent;
        b.initial = initial;
        b.module = module;
        b.allocatable = allocatable;
        b.pointer = pointer;
        b.optional = optional;
        b.parameter = parameter;
        b.target = target;
        b.contiguous = contiguous;
        b.external = external;
        b.imported = imported;
        b.stream = stream;
        return b;
    }

    public SymbolAttributes withDtype(DataType newType) {
        return toBuilder().dtype(newType).build();
    }

    public SymbolAttributes withShape(List<Expression> newShape) {
        return toBuilder().shape(newShape).build();
    }

    public SymbolAttributes withInitial(Expression newInitial) {
        return toBuilder().initial(newInitial).build();
    }

    public SymbolAttributes withImported(String fromModule) {
        return toBuilder().imported(true).module(fromModule).build();
    }

    public SymbolAttributes withStream(boolean isStream) {
        return toBuilder().stream(isStream).build();
    }

    public DataType getDtype() {
        return dtype;
    }

    public TypeTag getTag() {
        return dtype.getTag();
    }

    public Expression getKind() {
        return kind;
    }

    public Expression getLength() {
        return length;
    }

    /**
     * Dimension specifications, or null for scalars.
     */
    public List<Expression> getShape() {
        return shape;
    }

    public boolean isArray() {
        return shape != null && !shape.isEmpty();
    }

    public String getIntent() {
        return intent;
    }

    public Expression getInitial() {
        return initial;
    }

    public String getModule() {
        return module;
    }

    public boolean isAllocatable() {
        return allocatable;
    }

    public boolean isPointer() {
        return pointer;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isParameter() {
        return parameter;
    }

    public boolean isTarget() {
        return target;
    }

    public boolean isContiguous() {
        return contiguous;
    }

    public boolean isExternal() {
        return external;
    }

    public boolean isImported() {
        return imported;
    }

    /**
     * True for values living on a dataflow stream rather than in memory.
     */
    public boolean isStream() {
        return stream;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SymbolAttributes{dtype=").append(dtype.getName());
        if (kind != null) {
            sb.append(", kind=").append(kind);
        }
        if (shape != null) {
            sb.append(", shape=").append(shape);
        }
        if (intent != null) {
            sb.append(", intent=").append(intent);
        }
        if (imported) {
            sb.append(", imported from ").append(module);
        }
        return sb.append("}").toString();
    }

    public static class Builder {
        private DataType dtype;
        private Expression kind;
        private Expression length;
        private List<Expression> shape;
        private String intent;
        private Expression initial;
        private String module;
        private boolean allocatable;
        private boolean pointer;
        private boolean optional;
        private boolean parameter;
        private boolean target;
        private boolean contiguous;
        private boolean external;
        private boolean imported;
        private boolean stream;

        private Builder() {
        }

        public Builder dtype(DataType dtype) {
            this.dtype = dtype;
            return this;
        }

        public Builder kind(Expression kind) {
            this.kind = kind;
            return this;
        }

        public Builder length(Expression length) {
            this.length = length;
            return this;
        }

        public Builder shape(List<Expression> shape) {
            this.shape = shape;
            return this;
        }

        public Builder intent(String intent) {
            this.intent = intent;
            return this;
        }

        public Builder initial(Expression initial) {
            this.initial = initial;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder allocatable(boolean allocatable) {
            this.allocatable = allocatable;
            return this;
        }

        public Builder pointer(boolean pointer) {
            this.pointer = pointer;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder parameter(boolean parameter) {
            this.parameter = parameter;
            return this;
        }

        public Builder target(boolean target) {
            this.target = target;
            return this;
        }

        public Builder contiguous(boolean contiguous) {
            this.contiguous = contiguous;
            return this;
        }

        public Builder external(boolean external) {
            this.external = external;
            return this;
        }

        public Builder imported(boolean imported) {
            this.imported = imported;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public SymbolAttributes build() {
            return new SymbolAttributes(this);
        }
    }
}
