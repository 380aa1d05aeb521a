package com.questrail.keycode.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ExpressionTokenizer
 * =============================================================================
 * Splits keycode text into {@link ExpressionToken}s.
 *
 * <h2>Alphabet</h2>
 * <ul>
 *   <li>{@code NAME(}: identifier immediately (or after blanks) followed by
 *       an opening parenthesis</li>
 *   <li>number: {@code 0x1F}, {@code 0X1f}, {@code 31}</li>
 *   <li>identifier: {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>symbols: {@code << >> , | & ^ + - ( )}</li>
 * </ul>
 *
 * <p>Whitespace between tokens is ignored. Any other character fails the
 * whole input; nothing is silently skipped.</p>
 */
public final class ExpressionTokenizer
{
    private static final Pattern TOKEN = Pattern.compile(
            "([A-Za-z_][A-Za-z0-9_]*)\\s*\\("
                    + "|(0[xX][0-9a-fA-F]+|\\d+)"
                    + "|([A-Za-z_][A-Za-z0-9_]*)"
                    + "|(<<|>>)"
                    + "|\\s*([,|&^+\\-()])\\s*");

    private ExpressionTokenizer() {
    }

    public static List<ExpressionToken> tokenize(String text) {
        if (text == null) {
            throw new KeycodeExpressionException("Expression is null");
        }
        List<ExpressionToken> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        int last = 0;
        while (m.find()) {
            requireBlank(text, last, m.start());
            last = m.end();

            if (m.group(1) != null) {
                tokens.add(new ExpressionToken.Call(m.group(1)));
            } else if (m.group(2) != null) {
                tokens.add(number(m.group(2)));
            } else if (m.group(3) != null) {
                tokens.add(new ExpressionToken.Identifier(m.group(3)));
            } else if (m.group(4) != null) {
                tokens.add(new ExpressionToken.Symbol(m.group(4)));
            } else {
                tokens.add(new ExpressionToken.Symbol(m.group(5)));
            }
        }
        requireBlank(text, last, text.length());
        return tokens;
    }

    private static void requireBlank(String text, int from, int to) {
        if (!text.substring(from, to).isBlank()) {
            throw new KeycodeExpressionException("Invalid character in expression: " + text);
        }
    }

    private static ExpressionToken.Number number(String literal) {
        boolean hex = literal.length() > 1 && (literal.charAt(1) == 'x' || literal.charAt(1) == 'X');
        try {
            int value = hex
                    ? Integer.parseUnsignedInt(literal.substring(2), 16)
                    : Integer.parseInt(literal);
            return new ExpressionToken.Number(literal, value);
        } catch (NumberFormatException e) {
            throw new KeycodeExpressionException("Numeric literal out of range: " + literal, e);
        }
    }
}
