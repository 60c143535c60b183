package work.isu.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed-vocabulary expression tree. Shape is fully determined by the prefix syntax,
 * so no precedence or associativity information is stored.
 */
public sealed interface Expr permits Expr.Const, Expr.Var, Expr.Binary, Expr.Index, Expr.Call {

    <R> R accept(ExprVisitor<R> visitor);

    /** Typed literal: {@code int} as {@link Long}, {@code bool}, {@code string}, or an empty list/map. */
    record Const(ValueType type, Object value) implements Expr {
        public Const {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(value, "value");
            switch (type) {
                case INT -> {
                    if (!(value instanceof Long)) throw new IllegalArgumentException("int literal must be a Long");
                }
                case BOOL -> {
                    if (!(value instanceof Boolean)) throw new IllegalArgumentException("bool literal must be a Boolean");
                }
                case STRING -> {
                    if (!(value instanceof String)) throw new IllegalArgumentException("string literal must be a String");
                }
                case LIST -> {
                    if (!(value instanceof List<?> list) || !list.isEmpty()) {
                        throw new IllegalArgumentException("list literal must be empty");
                    }
                    value = List.of();
                }
                case MAP -> {
                    if (!(value instanceof Map<?, ?> map) || !map.isEmpty()) {
                        throw new IllegalArgumentException("map literal must be empty");
                    }
                    value = Map.of();
                }
                case ANY -> throw new IllegalArgumentException("literals cannot have type any");
            }
        }

        public static Const ofInt(long value) {
            return new Const(ValueType.INT, value);
        }

        public static Const ofBool(boolean value) {
            return new Const(ValueType.BOOL, value);
        }

        public static Const ofString(String value) {
            return new Const(ValueType.STRING, value);
        }

        public static Const emptyList() {
            return new Const(ValueType.LIST, List.of());
        }

        public static Const emptyMap() {
            return new Const(ValueType.MAP, Map.of());
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConst(this);
        }
    }

    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Index(Expr target, Expr index) implements Expr {
        public Index {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    record Call(StdFunction function, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }
}
