package com.example.hebphonics.parser;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.grammar.Gematria;
import com.example.hebphonics.parser.grammar.HebrewParser;
import com.example.hebphonics.parser.grammar.LexException;
import com.example.hebphonics.parser.grammar.RuleSettings;
import com.example.hebphonics.parser.grammar.Shemot;
import com.example.hebphonics.parser.tokens.CodePoints;
import com.example.hebphonics.parser.tokens.Symbol;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Builds the word records stored by the corpus index: the cleaned word, its sacred-name flag,
 * gematria, flattened parse, syllables and rule trace.
 */
public class WordService implements Closeable {

    private static final Logger LOG = LogManager.getLogger(WordService.class);
    private static final Pattern WORD_SEPARATOR = Pattern.compile("\\s+|(?<=־)");

    private final HebrewParser parser;
    private final ConcurrentMap<String, List<Cluster>> parseCache = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, JsonObject> recordCache = new ConcurrentHashMap<>();

    public WordService() {
        this(new HebrewParser(RuleSettings.loadDefault()));
    }

    public WordService(HebrewParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public HebrewParser parser() {
        return parser;
    }

    /**
     * Returns the record of a single word. The returned object is a copy and may be modified.
     *
     * @throws LexException when the word cannot be lexed
     */
    public JsonObject record(String word) {
        Objects.requireNonNull(word, "word");
        return recordCache.computeIfAbsent(word, key -> buildRecord(key, parsed(key))).deepCopy();
    }

    /**
     * A word is worth indexing when its parse has at least one letter and one vowel.
     *
     * @throws LexException when the word cannot be lexed
     */
    public boolean isIndexable(String word) {
        return isIndexable(parsed(Objects.requireNonNull(word, "word")));
    }

    /**
     * Splits text into words and returns the records of all indexable words.
     * Words that fail to lex are logged and skipped.
     */
    public List<JsonObject> records(String text) {
        List<JsonObject> records = new ArrayList<>();
        for (String word : splitWords(text)) {
            try {
                List<Cluster> clusters = parsed(word);
                if (isIndexable(clusters)) {
                    records.add(recordCache.computeIfAbsent(word, key -> buildRecord(key, clusters)).deepCopy());
                }
            } catch (LexException ex) {
                LOG.warn("Skipping word: {}", ex.getMessage());
            }
        }
        return records;
    }

    /**
     * Splits text into words on whitespace and after each maqaf. The maqaf stays with the word
     * before it, since it makes that word unaccented.
     */
    public static List<String> splitWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        for (String word : WORD_SEPARATOR.split(text.trim())) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    // parse results are frozen and unmodifiable
    private List<Cluster> parsed(String word) {
        return parseCache.computeIfAbsent(word, parser::parse);
    }

    private JsonObject buildRecord(String word, List<Cluster> clusters) {
        List<List<Symbol>> syllables = parser.syllabify(clusters);
        String clean = CodePoints.strip(word);

        JsonObject payload = new JsonObject();
        payload.addProperty("hebrew", clean);
        payload.addProperty("shemot", Shemot.isShem(clean));
        payload.addProperty("gematria", Gematria.valueOf(clean));
        payload.addProperty("parsed", join(HebrewParser.flatten(clusters)));

        JsonArray syllableArray = new JsonArray();
        for (List<Symbol> syllable : syllables) {
            JsonArray symbols = new JsonArray();
            for (Symbol symbol : syllable) {
                symbols.add(symbol.getName());
            }
            syllableArray.add(symbols);
        }
        payload.add("syllables", syllableArray);
        payload.addProperty("syllen", syllables.size());
        payload.addProperty("rules", String.join(" ", HebrewParser.ruleTrace(clusters)));
        return payload;
    }

    private static boolean isIndexable(List<Cluster> clusters) {
        boolean hasLetter = false;
        boolean hasVowel = false;
        for (Cluster cluster : clusters) {
            hasLetter |= cluster.letter() != null;
            hasVowel |= cluster.hasVowel();
        }
        return hasLetter && hasVowel;
    }

    private static String join(List<Symbol> symbols) {
        List<String> names = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            names.add(symbol.getName());
        }
        return String.join(" ", names);
    }

    @Override
    public void close() {
        recordCache.clear();
        parseCache.clear();
    }
}
