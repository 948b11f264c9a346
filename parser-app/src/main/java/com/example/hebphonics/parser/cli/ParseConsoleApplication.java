package com.example.hebphonics.parser.cli;

import com.example.hebphonics.parser.GrammarException;
import com.example.hebphonics.parser.WordService;
import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.HebrewParser;
import com.example.hebphonics.parser.grammar.LexException;
import com.example.hebphonics.parser.grammar.RuleSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Console front end of the parser. Words are taken from the arguments or, when there are
 * none, read line by line from STDIN. Each word is printed on one line as
 * {@code word<TAB>parse<TAB>syllables<TAB>rules}.
 */
public final class ParseConsoleApplication {

    private static final Logger LOG = LogManager.getLogger(ParseConsoleApplication.class);

    private static final String STRICT = "--strict";
    private static final String ENABLE = "--enable=";
    private static final String DISABLE = "--disable=";

    private final RuleSettings baseSettings;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public ParseConsoleApplication(RuleSettings baseSettings, InputStream in, PrintStream out, PrintStream err) {
        this.baseSettings = Objects.requireNonNull(baseSettings, "baseSettings");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        ParseConsoleApplication application =
                new ParseConsoleApplication(RuleSettings.loadDefault(), System.in, System.out, System.err);
        int exitCode = application.run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    int run(String[] args) {
        boolean strict = false;
        List<String> enabled = new ArrayList<>();
        List<String> disabled = new ArrayList<>();
        List<String> words = new ArrayList<>();
        for (String arg : args) {
            if (STRICT.equals(arg)) {
                strict = true;
            } else if (arg.startsWith(ENABLE)) {
                enabled.addAll(splitNames(arg.substring(ENABLE.length())));
            } else if (arg.startsWith(DISABLE)) {
                disabled.addAll(splitNames(arg.substring(DISABLE.length())));
            } else if (arg.startsWith("--")) {
                err.printf("Unknown option: %s%n", arg);
                printUsage();
                return 1;
            } else {
                words.addAll(WordService.splitWords(arg));
            }
        }

        HebrewParser parser;
        try {
            parser = new HebrewParser(baseSettings.with(enabled, disabled));
        } catch (GrammarException ex) {
            err.println(ex.getMessage());
            printUsage();
            return 1;
        }

        int failures = 0;
        if (!words.isEmpty()) {
            for (String word : words) {
                failures += processWord(parser, word, strict);
            }
        } else {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    for (String word : WordService.splitWords(line)) {
                        failures += processWord(parser, word, strict);
                    }
                }
            } catch (IOException ex) {
                LOG.error("Failed to read input", ex);
                err.printf("Failed to read input: %s%n", ex.getMessage());
                return 3;
            }
        }
        out.flush();
        if (failures > 0) {
            err.printf("Finished with errors (%d words not parsed).%n", failures);
            return 3;
        }
        return 0;
    }

    private int processWord(HebrewParser parser, String word, boolean strict) {
        try {
            List<Cluster> clusters = parser.parse(word);
            out.printf("%s\t%s\t%s\t%s%n",
                    word,
                    SymbolFormat.names(HebrewParser.flatten(clusters), " "),
                    SymbolFormat.syllables(parser.syllabify(clusters, strict)),
                    String.join(" ", HebrewParser.ruleTrace(clusters)));
            return 0;
        } catch (LexException ex) {
            LOG.warn("Skipping word: {}", ex.getMessage());
            err.printf("Cannot parse %s: %s%n", word, ex.getMessage());
            return 1;
        }
    }

    private static List<String> splitNames(String value) {
        List<String> names = new ArrayList<>();
        for (String name : Arrays.asList(value.split(","))) {
            if (!name.isBlank()) {
                names.add(name.trim());
            }
        }
        return names;
    }

    private void printUsage() {
        err.println("Usage: java -cp parser-app-<version>.jar com.example.hebphonics.parser.cli.ParseConsoleApplication"
                + " [--strict] [--enable=<rule>[,<rule>]] [--disable=<rule>[,<rule>]] [<word> ...]");
        err.println("Without words, input is read line by line from STDIN.");
    }
}
