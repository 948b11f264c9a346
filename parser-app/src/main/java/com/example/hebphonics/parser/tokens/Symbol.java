package com.example.hebphonics.parser.tokens;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Grammatical symbols assigned to letters, dageshes and vowels. Each symbol knows the Unicode
 * text it renders as and the spelling variants under which the name is accepted.
 */
public enum Symbol {
    // dagesh
    MAPIQ("mapiq", "\u05BC", V.MAPIQ),
    DAGESH("dagesh", "\u05BC", "dagesh"),
    DAGESH_QAL("dagesh-qal", "\u05BC", "dagesh-([kq]al|lene)"),
    DAGESH_HAZAQ("dagesh-hazaq", "\u05BC", "dagesh-(c?haza[kq]|forte)"),

    // sheva
    SHEVA("sheva", "\u05B0", V.SHEVA),
    SHEVA_NA("sheva-na", "\u05B0", V.SHEVA + "-na"),
    SHEVA_NA_MUTE("sheva-na-mute", "\u05B0", V.SHEVA + "-na-mute"),
    SHEVA_NAH("sheva-nah", "\u05B0", V.SHEVA + "-nac?h"),
    SHEVA_NAH_VOICED("sheva-nah-voiced", "\u05B0", V.SHEVA + "-nac?h-voiced"),
    SHEVA_GAYA("sheva-gaya", "\u05B0\u05BD", V.SHEVA + "-ga'?a?ya"),
    SHEVA_MERAHEF("sheva-merahef", "\u05B0", V.SHEVA + "-merac?hef"),

    // hiriq
    HIRIQ("hiriq", "\u05B4", V.HIRIQ),
    HIRIQ_MALE_YOD("hiriq-male-yod", "\u05B4", V.HIRIQ + V.MALE + "(-" + V.YOD + ")?"),

    // tsere
    TSERE("tsere", "\u05B5", V.TSERE),
    TSERE_MALE_ALEF("tsere-male-alef", "\u05B5", V.TSERE + V.MALE + "-" + V.ALEF),
    TSERE_MALE_HE("tsere-male-he", "\u05B5", V.TSERE + V.MALE + "-" + V.HE),
    TSERE_MALE_YOD("tsere-male-yod", "\u05B5", V.TSERE + V.MALE + "-" + V.YOD),

    // segol
    SEGOL("segol", "\u05B6", V.SEGOL),
    SEGOL_MALE_ALEF("segol-male-alef", "\u05B6", V.SEGOL + V.MALE + "-" + V.ALEF),
    SEGOL_MALE_HE("segol-male-he", "\u05B6", V.SEGOL + V.MALE + "-" + V.HE),
    SEGOL_MALE_YOD("segol-male-yod", "\u05B6", V.SEGOL + V.MALE + "-" + V.YOD),
    HATAF_SEGOL("hataf-segol", "\u05B1", V.HATAF + V.SEGOL),

    // patah
    PATAH("patah", "\u05B7", V.PATAH),
    PATAH_MALE_ALEF("patah-male-alef", "\u05B7", V.PATAH + V.MALE + "-" + V.ALEF),
    PATAH_MALE_HE("patah-male-he", "\u05B7", V.PATAH + V.MALE + "-" + V.HE),
    PATAH_YOD("patah-yod", "\u05B7", V.PATAH + "-" + V.YOD),
    PATAH_GENUVAH("patah-genuvah", "\u05B7",
            "furtive-" + V.PATAH + "(-g[ae]nuv(ah)?)?|" + V.PATAH + "-g[ae]nuv(ah)?"),
    HATAF_PATAH("hataf-patah", "\u05B2", V.HATAF + V.PATAH),

    // qamats
    QAMATS("qamats", "\u05B8", V.QAMATS),
    QAMATS_GADOL("qamats-gadol", "\u05B8", V.QAMATS + "-gadol"),
    QAMATS_MALE_ALEF("qamats-male-alef", "\u05B8", V.QAMATS + V.MALE + "-" + V.ALEF),
    QAMATS_MALE_HE("qamats-male-he", "\u05B8", V.QAMATS + V.MALE + "-" + V.HE),
    QAMATS_YOD("qamats-yod", "\u05B8", V.QAMATS + "-" + V.YOD),
    QAMATS_YOD_VAV("qamats-yod-vav", "\u05B8", V.QAMATS + "-" + V.YOD + "-" + V.VAV),
    HATAF_QAMATS("hataf-qamats", "\u05B3", V.HATAF + V.QAMATS),
    QAMATS_QATAN("qamats-qatan", "\u05C7", V.QAMATS + "-([kq]atan|c?hatuf)"),

    // holam
    HOLAM("holam", "\u05B9", V.HOLAM),
    HOLAM_HASER("holam-haser", "\u05B9", V.HOLAM + "-c?haser"),
    HOLAM_MALE_ALEF("holam-male-alef", "\u05B9", V.HOLAM + V.MALE + "-" + V.ALEF),
    HOLAM_MALE_HE("holam-male-he", "\u05B9", V.HOLAM + V.MALE + "-" + V.HE),
    HOLAM_MALE_VAV("holam-male-vav", "ו\u05B9", V.HOLAM + V.MALE + "(-" + V.VAV + ")?"),

    // qubuts / shuruq
    QUBUTS("qubuts", "\u05BB", "[kq]ubb?u[tc][sz]"),
    SHURUQ("shuruq", "ו\u05BC", "shuru[kq]"),

    // letters
    ALEF("alef", "א", V.ALEF),
    MAPIQ_ALEF("mapiq-alef", "א", V.MAPIQ + "-" + V.ALEF),
    BET("bet", "ב", "beth?"),
    VET("vet", "ב", "veth?"),
    GIMEL("gimel", "ג", "gimm?el"),
    DALET("dalet", "ד", "daleth?"),
    HE("he", "ה", V.HE),
    MAPIQ_HE("mapiq-he", "ה", V.MAPIQ + "-" + V.HE),
    VAV("vav", "ו", V.VAV),
    ZAYIN("zayin", "ז", "zayin"),
    HET("het", "ח", "c?heth?"),
    TET("tet", "ט", "teth?"),
    YOD("yod", "י", V.YOD),
    KAF("kaf", "כ", V.KAF),
    KAF_SOFIT("kaf-sofit", "ך", V.sofit(V.KAF)),
    KHAF("khaf", "כ", V.KHAF),
    KHAF_SOFIT("khaf-sofit", "ך", V.sofit(V.KHAF)),
    LAMED("lamed", "ל", "lamedh?"),
    MEM("mem", "מ", "mem"),
    MEM_SOFIT("mem-sofit", "ם", V.sofit("mem")),
    NUN("nun", "נ", "nun"),
    NUN_SOFIT("nun-sofit", "ן", V.sofit("nun")),
    SAMEKH("samekh", "ס", "same[ck]h"),
    AYIN("ayin", "ע", "ayin"),
    PE("pe", "פ", V.PE),
    PE_SOFIT("pe-sofit", "ף", V.sofit(V.PE)),
    FE("fe", "פ", V.FE),
    FE_SOFIT("fe-sofit", "ף", V.sofit(V.FE)),
    TSADI("tsadi", "צ", V.TSADI),
    TSADI_SOFIT("tsadi-sofit", "ץ", V.sofit(V.TSADI)),
    QOF("qof", "ק", "[kq](o|u)(f|ph)"),
    RESH("resh", "ר", "rei?sh"),
    SHIN("shin", "ש\u05C1", "shin"),
    SIN("sin", "ש\u05C2", "sin"),
    TAV("tav", "ת", "ta[fvw]"),
    SAV("sav", "ת", "sa[fvw]"),

    // letters that stand in for a vowel or a glide
    EIM_QRIA_ALEF("eim-qria-alef", "א", V.EIM_QRIA + V.ALEF),
    EIM_QRIA_HE("eim-qria-he", "ה", V.EIM_QRIA + V.HE),
    EIM_QRIA_YOD("eim-qria-yod", "י", V.EIM_QRIA + V.YOD),
    YOD_GLIDE("yod-glide", "י", V.YOD + "-glide"),

    // punctuation
    METEG("meteg", "\u05BD", "meteg|silu[kq]"),
    MAQAF("maqaf", "\u05BE", "ma[kq]a(ph|f)");

    private static final Map<String, Symbol> BY_NAME;

    static {
        Map<String, Symbol> byName = new LinkedHashMap<>();
        for (Symbol symbol : values()) {
            byName.put(symbol.name, symbol);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String name;
    private final String rendering;
    private final Pattern variants;

    Symbol(String name, String rendering, String variants) {
        this.name = name;
        this.rendering = rendering;
        this.variants = Pattern.compile("(?:" + variants + ")", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns the canonical hyphenated name, e.g. {@code qamats-gadol}.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the Unicode text this symbol is written with.
     */
    public String render() {
        return rendering;
    }

    /**
     * Returns {@code true} when this symbol's name starts with the name of {@code family},
     * e.g. {@code sheva-nah-voiced} belongs to {@code sheva-nah}.
     */
    public boolean belongsTo(Symbol family) {
        return family != null && name.startsWith(family.name);
    }

    boolean matchesVariant(String candidate) {
        return variants.matcher(candidate).matches();
    }

    /**
     * Exact lookup by canonical name.
     *
     * @return the symbol or {@code null} when the name is not part of the catalog
     */
    public static Symbol forName(String name) {
        Objects.requireNonNull(name, "name");
        return BY_NAME.get(name);
    }

    @Override
    public String toString() {
        return name;
    }

    /** Regular-expression fragments shared by several variant patterns. */
    private static final class V {
        static final String HATAF = "c?hataf-";
        static final String MALE = "-malei?";
        static final String MAPIQ = "mapp?i[kq]";
        static final String EIM_QRIA = "eim-[kq]ri?a-";
        static final String SHEVA = "s[hc]?h?e?va";
        static final String HIRIQ = "c?hiri[kq]";
        static final String TSERE = "t[sz]erei?";
        static final String SEGOL = "segg?ol";
        static final String PATAH = "patac?h";
        static final String QAMATS = "[kq]amat[sz]";
        static final String HOLAM = "c?hol[ao]m";
        static final String ALEF = "ale(f|ph)";
        static final String HE = "hey?";
        static final String VAV = "va[vw]";
        static final String YOD = "y[ou]dh?";
        static final String KAF = "[kc]a(f|ph)";
        static final String KHAF = "[kc]ha(f|ph)";
        static final String PE = "pey?";
        static final String FE = "fey?";
        static final String TSADI = "t[sz]add?ik?";

        private V() {
        }

        static String sofit(String letter) {
            return "final-(" + letter + ")|(" + letter + ")-sofit";
        }
    }
}
