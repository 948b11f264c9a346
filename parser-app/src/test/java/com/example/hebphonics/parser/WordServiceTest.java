package com.example.hebphonics.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WordServiceTest {

    // mem patah tav
    private static final String MAT = "מַת";
    // bet dagesh sheva lamed hiriq yod
    private static final String BLI = "בְּלִי";

    private WordService service;

    @BeforeAll
    void setUp() {
        service = new WordService();
    }

    @AfterAll
    void tearDown() {
        service.close();
    }

    @Test
    void recordDescribesTheWord() {
        JsonObject record = service.record(MAT);
        Assertions.assertEquals(MAT, record.get("hebrew").getAsString());
        Assertions.assertFalse(record.get("shemot").getAsBoolean());
        Assertions.assertEquals(440, record.get("gematria").getAsInt());
        Assertions.assertEquals("mem patah sav", record.get("parsed").getAsString());
        Assertions.assertEquals(1, record.get("syllen").getAsInt());
        Assertions.assertEquals("dagesh-none-bgdkft", record.get("rules").getAsString());

        JsonArray syllables = record.getAsJsonArray("syllables");
        Assertions.assertEquals(1, syllables.size());
        Assertions.assertEquals("sav", syllables.get(0).getAsJsonArray().get(2).getAsString());
    }

    @Test
    void recordListsSyllablesInOrder() {
        JsonObject record = service.record(BLI);
        JsonArray syllables = record.getAsJsonArray("syllables");
        Assertions.assertEquals(2, record.get("syllen").getAsInt());
        Assertions.assertEquals("sheva-na", syllables.get(0).getAsJsonArray().get(2).getAsString());
        Assertions.assertEquals("lamed", syllables.get(1).getAsJsonArray().get(0).getAsString());
    }

    @Test
    void hebrewFieldDropsAccents() {
        // munah under the mem
        JsonObject record = service.record("מַ֣ת");
        Assertions.assertEquals(MAT, record.get("hebrew").getAsString());
        Assertions.assertEquals("mem patah sav", record.get("parsed").getAsString());
    }

    @Test
    void recordFlagsNamesOfGod() {
        // yod sheva he vav qamats he
        Assertions.assertTrue(service.record("יְהוָה").get("shemot").getAsBoolean());
    }

    @Test
    void recordsAreCopies() {
        JsonObject first = service.record(MAT);
        first.addProperty("parsed", "changed");
        first.getAsJsonArray("syllables").remove(0);

        JsonObject second = service.record(MAT);
        Assertions.assertEquals("mem patah sav", second.get("parsed").getAsString());
        Assertions.assertEquals(1, second.getAsJsonArray("syllables").size());
    }

    @Test
    void recordsSkipUnparseableAndUnpointedWords() {
        // a bare vav has no vowel
        List<JsonObject> records = service.records(MAT + " abc ו " + BLI);
        Assertions.assertEquals(2, records.size());
        Assertions.assertEquals(MAT, records.get(0).get("hebrew").getAsString());
        Assertions.assertEquals(BLI, records.get(1).get("hebrew").getAsString());
    }

    @Test
    void recordsMatchSingleWordRecords() {
        List<JsonObject> records = service.records(BLI + " " + MAT + " " + BLI);
        Assertions.assertEquals(3, records.size());
        Assertions.assertEquals(service.record(BLI), records.get(0));
        Assertions.assertEquals(service.record(MAT), records.get(1));
        Assertions.assertEquals(records.get(0), records.get(2));
        Assertions.assertNotSame(records.get(0), records.get(2));
    }

    @Test
    void cachedParseDoesNotMakeWordIndexable() {
        Assertions.assertFalse(service.isIndexable("ו"));
        Assertions.assertTrue(service.records("ו ו").isEmpty());
    }

    @Test
    void indexableWordsNeedAVowel() {
        Assertions.assertTrue(service.isIndexable(MAT));
        Assertions.assertFalse(service.isIndexable("ו"));
        Assertions.assertFalse(service.isIndexable(""));
    }

    @Test
    void splitWordsKeepsMaqafWithPrecedingWord() {
        Assertions.assertEquals(List.of("al־", "pnei", "hamayim"),
                WordService.splitWords("  al־pnei \t hamayim\n"));
        Assertions.assertTrue(WordService.splitWords(" ").isEmpty());
        Assertions.assertTrue(WordService.splitWords(null).isEmpty());
    }
}
