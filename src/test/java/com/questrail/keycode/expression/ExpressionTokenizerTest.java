package com.questrail.keycode.expression;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExpressionTokenizerTest
{
    @Test
    void splitsCallsIdentifiersNumbersAndSymbols() {
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize("LT(2, KC_A) | 0x1F << 3");

        assertEquals(List.of(
                new ExpressionToken.Call("LT"),
                new ExpressionToken.Number("2", 2),
                new ExpressionToken.Symbol(","),
                new ExpressionToken.Identifier("KC_A"),
                new ExpressionToken.Symbol(")"),
                new ExpressionToken.Symbol("|"),
                new ExpressionToken.Number("0x1F", 0x1F),
                new ExpressionToken.Symbol("<<"),
                new ExpressionToken.Number("3", 3)
        ), tokens);
    }

    @Test
    void callNameMayBeSeparatedFromParenthesisByBlanks() {
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize("MO  (1)");

        assertEquals(new ExpressionToken.Call("MO"), tokens.get(0));
        assertEquals("MO(", tokens.get(0).text());
    }

    @Test
    void hexLiteralsAcceptEitherCase() {
        assertEquals(new ExpressionToken.Number("0XfF", 0xFF), ExpressionTokenizer.tokenize("0XfF").get(0));
    }

    @Test
    void emptyAndBlankInputProduceNoTokens() {
        assertTrue(ExpressionTokenizer.tokenize("").isEmpty());
        assertTrue(ExpressionTokenizer.tokenize("   ").isEmpty());
    }

    @Test
    void invalidCharactersFailTheWholeInput() {
        KeycodeExpressionException e = assertThrows(KeycodeExpressionException.class,
                () -> ExpressionTokenizer.tokenize("KC_A * 2"));
        assertTrue(e.getMessage().startsWith("Invalid character in expression"));

        assertThrows(KeycodeExpressionException.class, () -> ExpressionTokenizer.tokenize("KC_A;"));
        assertThrows(KeycodeExpressionException.class, () -> ExpressionTokenizer.tokenize("~KC_A"));
    }

    @Test
    void oversizedLiteralsAreRejected() {
        KeycodeExpressionException e = assertThrows(KeycodeExpressionException.class,
                () -> ExpressionTokenizer.tokenize("99999999999"));
        assertTrue(e.getMessage().contains("out of range"));
        assertNotNull(e.getCause());
    }

    @Test
    void nullInputIsRejected() {
        assertThrows(KeycodeExpressionException.class, () -> ExpressionTokenizer.tokenize(null));
    }
}
