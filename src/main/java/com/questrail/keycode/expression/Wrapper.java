package com.questrail.keycode.expression;

import com.questrail.keycode.table.ProtocolLayout;
import com.questrail.keycode.table.WrapperKind;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A callable wrapper name bound to its packing rule.
 *
 * <p>Some names fix the leading argument of their kind: {@code LCTL_T(kc)} is
 * {@link WrapperKind#MOD_TAP} with the modifier bits preset, {@code LT3(kc)}
 * is {@link WrapperKind#LAYER_TAP} with layer 3 preset. Such a wrapper takes
 * one argument fewer than its kind.</p>
 */
public record Wrapper(String name, WrapperKind kind, OptionalInt fixedArgument)
{
    public Wrapper {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(fixedArgument, "fixedArgument");
        if (fixedArgument.isPresent() && kind.arity() < 2) {
            throw new IllegalArgumentException(name + ": " + kind + " has no argument to fix");
        }
    }

    public static Wrapper of(String name, WrapperKind kind) {
        return new Wrapper(name, kind, OptionalInt.empty());
    }

    public static Wrapper fixed(String name, WrapperKind kind, int firstArgument) {
        return new Wrapper(name, kind, OptionalInt.of(firstArgument));
    }

    public Wrapper withName(String name) {
        return new Wrapper(name, kind, fixedArgument);
    }

    /** Number of arguments a call site must supply. */
    public int arity() {
        return fixedArgument.isPresent() ? kind.arity() - 1 : kind.arity();
    }

    /**
     * Packs call-site arguments.
     *
     * @throws KeycodeExpressionException if the argument count is wrong
     */
    public int apply(ProtocolLayout layout, int... args) {
        if (args.length != arity()) {
            throw new KeycodeExpressionException(
                    "Wrong argument count for " + name + ": expected " + arity() + ", got " + args.length);
        }
        if (fixedArgument.isEmpty()) {
            return kind.pack(layout, args);
        }
        int[] full = new int[args.length + 1];
        full[0] = fixedArgument.getAsInt();
        System.arraycopy(args, 0, full, 1, args.length);
        return kind.pack(layout, full);
    }
}
