package com.example.hebphonics.parser.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class LexerTest {

    @Test
    void lexGroupsMarksWithTheirLetter() {
        // vav sheva, yod hiriq, qof dagesh qamats, resh tsere mahapakh, alef
        String word = "ו\u05B0י\u05B4ק\u05B8\u05BCר\u05B5\u05A4א";
        List<Token> expected = List.of(
                Token.builder("ו").vowel("\u05B0").build(),
                Token.builder("י").vowel("\u05B4").build(),
                Token.builder("ק").dagesh("\u05BC").vowel("\u05B8").build(),
                Token.builder("ר").vowel("\u05B5").accent("\u05A4").build(),
                Token.builder("א").build());

        assertEquals(expected, Lexer.lex(word));
    }

    @Test
    void shinDotIsPartOfTheLetter() {
        List<Token> tokens = Lexer.lex("ש\u05B8\u05C1");
        assertEquals(1, tokens.size());
        assertEquals("ש\u05C1", tokens.get(0).letter());
        assertEquals("\u05B8", tokens.get(0).vowel());
        assertEquals('ש', tokens.get(0).baseLetter());
    }

    @Test
    void metegAndMaqafAreKeptOutsideTheVowel() {
        // bet qamats meteg, mem maqaf
        List<Token> tokens = Lexer.lex("ב\u05B8\u05BDמ\u05BE");
        assertTrue(tokens.get(0).hasPoint('\u05BD'));
        assertEquals("\u05B8", tokens.get(0).vowel());
        assertTrue(tokens.get(1).hasPunctuation('\u05BE'));
        assertTrue(tokens.get(1).isBare());
    }

    @Test
    void joinersAreTreatedAsPunctuation() {
        List<Token> tokens = Lexer.lex("ו\u200C\u05B9");
        assertEquals(1, tokens.size());
        assertEquals(List.of("\u200C"), tokens.get(0).puncta());
        assertEquals("\u05B9", tokens.get(0).vowel());
    }

    @Test
    void emptyWordHasNoTokens() {
        assertTrue(Lexer.lex("").isEmpty());
    }

    @Test
    void markBeforeFirstLetterIsRejected() {
        LexException ex = assertThrows(LexException.class, () -> Lexer.lex("\u05B0א"));
        assertEquals(0, ex.position());
        assertEquals(0x05B0, ex.codePoint());
        assertTrue(ex.getMessage().startsWith("No base letter for mark at position 0"));
    }

    @Test
    void unknownCodePointIsRejectedWithItsPosition() {
        LexException ex = assertThrows(LexException.class, () -> Lexer.lex("ב\u05B0x"));
        assertEquals(2, ex.position());
        assertEquals('x', ex.codePoint());
        assertTrue(ex.getMessage().contains("latin_small_letter_x"), ex.getMessage());
    }
}
