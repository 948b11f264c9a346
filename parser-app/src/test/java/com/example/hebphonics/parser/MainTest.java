package com.example.hebphonics.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.google.gson.Gson;
import com.google.gson.JsonObject;

class MainTest {

    private final Gson gson = new Gson();

    @Test
    void mainPrintsOneRecordPerIndexableWord() throws Exception {
        // mem patah tav, then a word that does not lex
        String input = "מַת abc\nמַת\n";

        String actual = runMain(input);

        String[] lines = actual.split("\\R");
        assertEquals(2, lines.length);
        try (WordService service = new WordService()) {
            JsonObject expected = service.record("מַת");
            assertEquals(expected, gson.fromJson(lines[0], JsonObject.class));
            assertEquals(expected, gson.fromJson(lines[1], JsonObject.class));
        }
    }

    @Test
    void blankInputPrintsNothing() throws Exception {
        assertEquals("", runMain("  \n"));
    }

    private static String runMain(String input) throws Exception {
        PrintStream originalOut = System.out;
        InputStream originalIn = System.in;
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        try (ByteArrayInputStream stream = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
             PrintStream replacement = new PrintStream(capture, true, StandardCharsets.UTF_8.name())) {
            System.setIn(stream);
            System.setOut(replacement);
            Main.main(new String[0]);
        } finally {
            System.setOut(originalOut);
            System.setIn(originalIn);
        }
        return capture.toString(StandardCharsets.UTF_8.name());
    }
}
