package com.example.hebphonics.parser.grammar;

import java.util.List;

/**
 * Pointed words from the rule regression tests, shared by the parser property tests.
 * Letters and vowel points are written as is; accents, meteg and maqaf are escaped.
 */
final class RegressionCorpus {

    static final List<String> WORDS = List.of(
            // dagesh
            "רֻאּ\u05BDוּ", "בָּהּ", "חֲמֹרֵיהֶּם", "אֶת", "שַׁבָּת",
            "בָּרָא", "פֶּה", "מִדְבָּר", "הַמַּיִם",
            // eim qria
            "מִצְוֺת", "וּבֶן", "תֹהוּ", "אוֹר", "בּוֹא",
            "עֲוֺן", "חַוָּה", "כִּי", "נָא", "צֵא",
            "בֹּא", "הוּא", "מָה", "מַה", "שֵׂה",
            "אֵין", "אֵלֶיךָ",
            // modern sheva
            "שָׁכְחוּ", "מָכְרוּ", "תְּאָרִים",
            // qamats
            "כׇּל", "הַגָּן", "בָהּ", "עָקֵב", "בָּ\u05BDם",
            "נָ\u05A4ע", "אָז\u05A9", "הָאָ\u05BDרֶץ", "הַ\u05A0גָּמָל", "וַיָּ\u05A5קָם",
            "רָחְבָּהּ", "בְעָזְּךָ", "מְלָךְ", "הָפְכִּי", "לַשָּׁוְא",
            // sheva ending
            "פָשְׂתָה", "גָדְלָה", "מָלְאָה", "יָרְאוּ", "יִירָשְׁךָ",
            "וַיְבָרְכֵם", "וְהָרְאָה", "אָזְנוֹ", "חָפְנָיו", "קָדְשֵׁי",
            "עָנְיִי",
            // sheva
            "זרְע", "נְ\u05BDסָה", "מַלְכֵי", "וְיִפְדְיָה", "וְאֵת",
            "לָ\u05BDךְ", "חֵטְא", "אַנְתְּ", "הַלְלוּ", "הִנְנִי",
            "יִמְשְׁלוּ", "הַבְּאֵר", "וּרְבוּ", "יִשְׁלַח", "וַיְהִי",
            "קֵ\u0591דְמָה", "יֵשְׁבוּ", "יֹאמְרוּ",
            // vowel
            "צֹר", "נֹחַ", "רֹעַ", "נֹהַּ", "הָרֵעַ",
            "אֵלָיו", "חָי", "חַי", "מַיִם", "אוֹי",
            "צִפּוּי", "וּמִי");

    private RegressionCorpus() {
    }
}
