package com.example.hebphonics.parser.grammar;

import com.example.hebphonics.parser.GrammarException;
import com.example.hebphonics.parser.grammar.rules.Rule;
import com.example.hebphonics.parser.grammar.rules.RuleBook;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Names of rules explicitly enabled or disabled for a parser. A disabled rule never fires, an
 * enabled rule turns on an opt-in heuristic, and every other rule runs.
 *
 * <p>Settings are read from JSON of the form
 * {@code {"enabled": ["sheva-na-after-meteg"], "disabled": ["sheva-modern-muted"]}}.</p>
 */
public final class RuleSettings {

    public static final String PATH_PROPERTY = "hebphonics.rules.path";
    public static final String PATH_ENV = "HEBPHONICS_RULES";
    public static final String DEFAULT_RESOURCE = "/hebphonics-rules.json";

    private static final Logger LOG = LogManager.getLogger(RuleSettings.class);
    private static final Gson GSON = new GsonBuilder().create();
    private static final RuleSettings DEFAULTS = new RuleSettings(Collections.emptySet(), Collections.emptySet());

    private final Set<String> enabled;
    private final Set<String> disabled;

    private RuleSettings(Set<String> enabled, Set<String> disabled) {
        this.enabled = enabled;
        this.disabled = disabled;
    }

    public static RuleSettings defaults() {
        return DEFAULTS;
    }

    /**
     * @throws GrammarException when a name is not a known rule
     */
    public static RuleSettings of(Collection<String> enabled, Collection<String> disabled) {
        Set<String> enabledNames = validate(Objects.requireNonNull(enabled, "enabled"));
        Set<String> disabledNames = validate(Objects.requireNonNull(disabled, "disabled"));
        for (String name : enabledNames) {
            Rule rule = RuleBook.forName(name);
            if (rule != null && rule.availability() == Rule.Availability.UNIMPLEMENTED) {
                LOG.warn("Rule '{}' is not implemented and will not be applied", name);
            }
        }
        return new RuleSettings(enabledNames, disabledNames);
    }

    /**
     * Resolves settings from the {@value #PATH_PROPERTY} system property, the
     * {@value #PATH_ENV} environment variable or the bundled {@value #DEFAULT_RESOURCE}, in
     * that order, falling back to {@link #defaults()}.
     */
    public static RuleSettings loadDefault() {
        String systemProperty = System.getProperty(PATH_PROPERTY);
        if (systemProperty != null && !systemProperty.isBlank()) {
            LOG.info("Loading rule settings from system property {}: {}", PATH_PROPERTY, systemProperty);
            return load(Path.of(systemProperty));
        }
        String envPath = System.getenv(PATH_ENV);
        if (envPath != null && !envPath.isBlank()) {
            LOG.info("Loading rule settings from environment variable {}: {}", PATH_ENV, envPath);
            return load(Path.of(envPath));
        }
        try (InputStream stream = RuleSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream != null) {
                LOG.info("Loading rule settings from classpath resource {}", DEFAULT_RESOURCE);
                try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                    return fromJson(reader);
                }
            }
        } catch (IOException ex) {
            throw new GrammarException("Failed to read rule settings resource " + DEFAULT_RESOURCE, ex);
        }
        LOG.info("No rule settings found, using defaults");
        return DEFAULTS;
    }

    public static RuleSettings load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new GrammarException("Rule settings not found: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException ex) {
            throw new GrammarException("Failed to read rule settings from " + path.toAbsolutePath(), ex);
        }
    }

    public static RuleSettings fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        SettingsFile file;
        try {
            file = GSON.fromJson(new JsonReader(reader), SettingsFile.class);
        } catch (JsonParseException ex) {
            throw new GrammarException("Malformed rule settings: " + ex.getMessage(), ex);
        }
        if (file == null) {
            return DEFAULTS;
        }
        return of(file.enabled == null ? List.of() : file.enabled,
                file.disabled == null ? List.of() : file.disabled);
    }

    public Set<String> enabled() {
        return enabled;
    }

    public Set<String> disabled() {
        return disabled;
    }

    public boolean isDisabled(String name) {
        return disabled.contains(name);
    }

    /**
     * Whether a rule takes part in parsing under these settings.
     */
    public boolean isActive(Rule rule) {
        if (disabled.contains(rule.name())) {
            return false;
        }
        switch (rule.availability()) {
            case DEFAULT:
                return true;
            case OPT_IN:
                return enabled.contains(rule.name());
            default:
                return false;
        }
    }

    /**
     * Returns settings with the given names added to the enabled and disabled sets.
     */
    public RuleSettings with(Collection<String> moreEnabled, Collection<String> moreDisabled) {
        List<String> allEnabled = new ArrayList<>(enabled);
        allEnabled.addAll(moreEnabled);
        List<String> allDisabled = new ArrayList<>(disabled);
        allDisabled.addAll(moreDisabled);
        return of(allEnabled, allDisabled);
    }

    private static Set<String> validate(Collection<String> names) {
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String trimmed = name.trim();
            if (RuleBook.forName(trimmed) == null && !Syllabifier.RULE_NAMES.contains(trimmed)) {
                throw new GrammarException("Unknown rule: " + trimmed);
            }
            result.add(trimmed);
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        return "RuleSettings{enabled=" + enabled + ", disabled=" + disabled + '}';
    }

    /** Gson binding of the settings file. */
    static final class SettingsFile {
        List<String> enabled;
        List<String> disabled;
    }
}
