package com.example.hebphonics.parser.grammar;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Detects the seven names of God whose written form carries special obligations.
 */
public final class Shemot {

    // FIXME: classes such as [ָ|ַ] also accept a literal '|'; the intent was (ָ|ַ)
    private static final List<String> NAMES = List.of(
            "א(ֱ)?ל(ו)?ֹה",
            "א(.)?ד(ו)?ֹנ[ָ|ַ]י$",
            "י(ּ)?(ְ|ֱ|ֲ)?ה(ֹ)?ו[ָ|ִ]ה",
            "([^י]|^)שׁ[ַ|ָ]ד(ּ)?[ָ|ַ]י$",
            "^אֵל(.)?$",
            "^יָהּ$",
            "^צְבָאוֹת$");

    private static final Pattern SHEMOT = Pattern.compile(
            "(" + String.join(")|(", NAMES) + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private Shemot() {
    }

    /**
     * Returns {@code true} when one of the names occurs in the word as written.
     */
    public static boolean isShem(String word) {
        Objects.requireNonNull(word, "word");
        return SHEMOT.matcher(word).find();
    }
}
