package com.questrail.keycode.expression;

import java.util.Objects;

/**
 * Lexical unit of a keycode expression.
 *
 * <p>A wrapper call is lexed as a single {@link Call} token covering the name
 * and its opening parenthesis, so {@code LT(1, KC_A)} and {@code LT (1, KC_A)}
 * are equivalent while {@code KC_A (1)} is not an identifier followed by a
 * group.</p>
 */
public sealed interface ExpressionToken
        permits ExpressionToken.Call,
                ExpressionToken.Number,
                ExpressionToken.Identifier,
                ExpressionToken.Symbol
{
    /** Source text of the token, used in error messages. */
    String text();

    /** {@code NAME(}: opens a wrapper call. */
    record Call(String name) implements ExpressionToken {
        public Call {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String text() {
            return name + "(";
        }
    }

    /** Decimal or {@code 0x} hexadecimal literal. */
    record Number(String text, int value) implements ExpressionToken {
        public Number {
            Objects.requireNonNull(text, "text");
        }
    }

    record Identifier(String name) implements ExpressionToken {
        public Identifier {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String text() {
            return name;
        }
    }

    /** Operator or punctuation: {@code | ^ & + - << >> , ( )}. */
    record Symbol(String text) implements ExpressionToken {
        public Symbol {
            Objects.requireNonNull(text, "text");
        }

        public boolean is(String symbol) {
            return text.equals(symbol);
        }
    }
}
