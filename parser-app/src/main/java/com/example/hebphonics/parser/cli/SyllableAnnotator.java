package com.example.hebphonics.parser.cli;

import com.example.hebphonics.parser.WordService;
import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.HebrewParser;
import com.example.hebphonics.parser.grammar.LexException;
import com.example.hebphonics.parser.grammar.RuleSettings;
import com.example.hebphonics.parser.tokens.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Command line entry point that writes the syllable breakdown of every word in a text file to
 * a {@code .syllables.tsv} file next to it.
 */
public final class SyllableAnnotator {

    private static final Logger LOG = LogManager.getLogger(SyllableAnnotator.class);
    private static final String OUTPUT_SUFFIX = ".syllables.tsv";

    private final HebrewParser parser;
    private final PrintStream out;
    private final PrintStream err;

    public SyllableAnnotator(HebrewParser parser, PrintStream out, PrintStream err) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        HebrewParser parser = new HebrewParser(RuleSettings.loadDefault());
        SyllableAnnotator annotator = new SyllableAnnotator(parser, System.out, System.err);
        int exitCode = annotator.run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return 1;
        }

        List<Path> files = new ArrayList<>(args.length);
        for (String arg : args) {
            Path path = Path.of(arg);
            if (!Files.exists(path)) {
                err.printf("File not found: %s%n", path);
                return 2;
            }
            if (!Files.isRegularFile(path)) {
                err.printf("Not a regular file: %s%n", path);
                return 2;
            }
            files.add(path);
        }

        int failures = 0;
        for (Path file : files) {
            try {
                annotateFile(file);
            } catch (IOException ex) {
                failures++;
                LOG.error("Failed to annotate {}", file, ex);
                err.printf("Failed to read or write %s: %s%n", file, ex.getMessage());
            }
        }
        if (failures > 0) {
            err.printf("Finished with errors (%d files not processed).%n", failures);
            return 3;
        }
        return 0;
    }

    private void annotateFile(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Path outputFile = deriveOutputPath(file);
        List<String> rows = new ArrayList<>();
        int skipped = 0;
        for (String word : WordService.splitWords(content)) {
            try {
                List<Cluster> clusters = parser.parse(word);
                List<List<Symbol>> syllables = parser.syllabify(clusters);
                rows.add(String.join("\t",
                        word,
                        SymbolFormat.names(HebrewParser.flatten(clusters), " "),
                        SymbolFormat.syllables(syllables),
                        Integer.toString(syllables.size())));
            } catch (LexException ex) {
                skipped++;
                LOG.warn("Skipping word in {}: {}", file, ex.getMessage());
            }
        }
        writeOutput(outputFile, String.join(System.lineSeparator(), rows));
        out.printf("# %s: %d words, %d skipped -> %s%n", file, rows.size(), skipped, outputFile);
    }

    private void printUsage() {
        err.println("Usage: java -cp parser-app-<version>.jar com.example.hebphonics.parser.cli.SyllableAnnotator <file> [<file> ...]");
        err.println("Each file gets a " + OUTPUT_SUFFIX + " file beside it with one row per word.");
    }

    private static Path deriveOutputPath(Path inputFile) {
        Path fileName = inputFile.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Cannot determine file name for path: " + inputFile);
        }
        return inputFile.resolveSibling(fileName + OUTPUT_SUFFIX);
    }

    private static void writeOutput(Path outputFile, String content) throws IOException {
        String normalised = content;
        if (!normalised.isEmpty() && !normalised.endsWith(System.lineSeparator())) {
            normalised = normalised + System.lineSeparator();
        }
        Files.writeString(outputFile, normalised, StandardCharsets.UTF_8);
    }
}
