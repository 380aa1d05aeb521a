package com.questrail.keycode.expression;

import com.questrail.keycode.table.ProtocolLayout;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ExpressionEvaluator
 * =============================================================================
 * Recursive-descent evaluator for keycode text such as {@code LT(2, KC_A)},
 * {@code LCTL_T(KC_ESC)} or {@code MOD_LCTL | MOD_LSFT}.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   expr     := xor ( '|' xor )*
 *   xor      := and ( '^' and )*
 *   and      := additive ( '&amp;' additive )*
 *   additive := shift ( ('+' | '-') shift )*
 *   shift    := unary ( ('&lt;&lt;' | '&gt;&gt;') unary )*
 *   unary    := ('-' | '+') unary | primary
 *   primary  := '(' expr ')' | NUMBER | IDENTIFIER
 *             | NAME '(' [ expr ( ',' expr )* ] ')'
 * </pre>
 * {@code >>} is a logical shift.
 *
 * <h2>Failure</h2>
 * <p>Every failure raises {@link KeycodeExpressionException}: invalid
 * characters, unknown identifiers or wrapper names, wrong argument counts,
 * unbalanced parentheses, nesting deeper than {@value #MAX_DEPTH} levels and
 * tokens left after a complete expression ({@code "KC_A KC_B"}). The evaluator never returns a partial result.</p>
 *
 * <p>An evaluator is bound to one protocol layout and one identifier
 * resolver and holds no other state; {@link #evaluate} may be called from any
 * thread.</p>
 */
public final class ExpressionEvaluator
{
    /** Deepest nesting of parentheses, calls and signs accepted. */
    static final int MAX_DEPTH = 256;

    private final ProtocolLayout layout;
    private final WrapperCatalog wrappers;
    private final IdentifierResolver identifiers;

    public ExpressionEvaluator(ProtocolLayout layout, IdentifierResolver identifiers) {
        this(layout, WrapperCatalog.standard(), identifiers);
    }

    public ExpressionEvaluator(ProtocolLayout layout, WrapperCatalog wrappers, IdentifierResolver identifiers) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.wrappers = Objects.requireNonNull(wrappers, "wrappers");
        this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
    }

    public ProtocolLayout layout() {
        return layout;
    }

    /**
     * @throws KeycodeExpressionException if {@code text} is not a valid expression
     */
    public int evaluate(String text) {
        return new Parser(text, ExpressionTokenizer.tokenize(text)).parse();
    }

    private final class Parser
    {
        private final String source;
        private final List<ExpressionToken> tokens;
        private int pos;
        private int depth;

        Parser(String source, List<ExpressionToken> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        int parse() {
            int value = expr();
            if (pos < tokens.size()) {
                throw fail("Unexpected trailing token '" + tokens.get(pos).text() + "'");
            }
            return value;
        }

        private int expr() {
            int left = xor();
            while (accept("|")) {
                left |= xor();
            }
            return left;
        }

        private int xor() {
            int left = and();
            while (accept("^")) {
                left ^= and();
            }
            return left;
        }

        private int and() {
            int left = additive();
            while (accept("&")) {
                left &= additive();
            }
            return left;
        }

        private int additive() {
            int left = shift();
            while (true) {
                if (accept("+")) {
                    left += shift();
                } else if (accept("-")) {
                    left -= shift();
                } else {
                    return left;
                }
            }
        }

        private int shift() {
            int left = unary();
            while (true) {
                if (accept("<<")) {
                    left <<= unary();
                } else if (accept(">>")) {
                    left >>>= unary();
                } else {
                    return left;
                }
            }
        }

        // every nesting path (parentheses, calls, sign chains) passes through here
        private int unary() {
            if (++depth > MAX_DEPTH) {
                throw fail("Expression nested deeper than " + MAX_DEPTH);
            }
            try {
                if (accept("-")) {
                    return -unary();
                }
                if (accept("+")) {
                    return unary();
                }
                return primary();
            } finally {
                depth--;
            }
        }

        private int primary() {
            if (pos >= tokens.size()) {
                throw fail("Unexpected end of expression");
            }
            ExpressionToken token = tokens.get(pos++);

            if (token instanceof ExpressionToken.Number number) {
                return number.value();
            }
            if (token instanceof ExpressionToken.Identifier identifier) {
                OptionalInt value = identifiers.resolve(identifier.name());
                if (value.isEmpty()) {
                    throw fail("Unknown identifier '" + identifier.name() + "'");
                }
                return value.getAsInt();
            }
            if (token instanceof ExpressionToken.Call call) {
                return call(call.name());
            }
            if (token instanceof ExpressionToken.Symbol symbol && symbol.is("(")) {
                int value = expr();
                expect(")");
                return value;
            }
            throw fail("Unexpected token '" + token.text() + "'");
        }

        private int call(String name) {
            Wrapper wrapper = wrappers.find(name)
                    .orElseThrow(() -> fail("Unknown function '" + name + "'"));
            List<Integer> args = new ArrayList<>(2);
            if (!peek(")")) {
                args.add(expr());
                while (accept(",")) {
                    args.add(expr());
                }
            }
            expect(")");
            return wrapper.apply(layout, args.stream().mapToInt(Integer::intValue).toArray());
        }

        private boolean peek(String symbol) {
            return pos < tokens.size()
                    && tokens.get(pos) instanceof ExpressionToken.Symbol s
                    && s.is(symbol);
        }

        private boolean accept(String symbol) {
            if (peek(symbol)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(String symbol) {
            if (!accept(symbol)) {
                throw fail("Expected '" + symbol + "'");
            }
        }

        private KeycodeExpressionException fail(String message) {
            return new KeycodeExpressionException(message + " in: " + source);
        }
    }
}
