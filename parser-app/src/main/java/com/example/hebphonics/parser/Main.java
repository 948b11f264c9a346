package com.example.hebphonics.parser;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads pointed Hebrew text from STDIN and prints one JSON record per indexable word.
 */
public final class Main {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private Main() {
    }

    public static void main(String[] args) throws IOException {
        try (WordService service = new WordService()) {
            String input = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            if (input.isBlank()) {
                System.err.println("Provide pointed Hebrew text via STDIN.");
                return;
            }
            for (JsonObject record : service.records(input)) {
                System.out.println(GSON.toJson(record));
            }
            System.out.flush();
        }
    }
}
