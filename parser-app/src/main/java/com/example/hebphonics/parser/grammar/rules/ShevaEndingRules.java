package com.example.hebphonics.parser.grammar.rules;

import static com.example.hebphonics.parser.grammar.rules.ClusterPattern.slot;

import com.example.hebphonics.parser.grammar.Cluster;
import com.example.hebphonics.parser.tokens.Symbol;
import com.example.hebphonics.parser.tokens.SymbolTable;

import java.util.List;

/**
 * Word-ending exceptions for a sheva that the positional rules left undecided. Each pattern
 * starts at the sheva and was checked against the Pentateuch. A vocal sheva implies that a
 * preceding qamats is gadol, a silent one that it is qatan.
 */
final class ShevaEndingRules {

    private static final ClusterPattern ENDING_SAH = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().letter(Symbol.SAV).vowel(Symbol.QAMATS_GADOL),
            slot().letter(Symbol.EIM_QRIA_HE));

    private static final ClusterPattern ENDING_ALKHF_AH = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().letter(Symbol.ALEF, Symbol.KHAF, Symbol.LAMED, Symbol.FE).vowel(Symbol.QAMATS, Symbol.QAMATS_GADOL),
            slot().letter(Symbol.EIM_QRIA_HE));

    private static final ClusterPattern ENDING_U = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.SHURUQ));

    private static final ClusterPattern ENDING_LSHS_KHA = ClusterPattern.of(
            slot().letter(Symbol.LAMED, Symbol.SHIN, Symbol.TAV, Symbol.SAV).vowel(Symbol.SHEVA),
            slot().letter(Symbol.KHAF_SOFIT).vowel(Symbol.QAMATS_GADOL));

    private static final ClusterPattern ENDING_EIM = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.TSERE),
            slot().letter(Symbol.MEM_SOFIT));

    private static final ClusterPattern ENDING_IYAH = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.HIRIQ),
            slot().letter(Symbol.YOD).vowel(Symbol.QAMATS_GADOL),
            slot().letter(Symbol.EIM_QRIA_HE));

    private static final ClusterPattern ENDING_AH = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS_GADOL),
            slot().letter(Symbol.EIM_QRIA_HE));

    private static final ClusterPattern ENDING_O = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.HOLAM_MALE_VAV));

    private static final ClusterPattern ENDING_AV = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS_GADOL),
            slot().letter(Symbol.YOD_GLIDE),
            slot().letter(Symbol.VAV));

    private static final ClusterPattern ENDING_AEI_SN_UO = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS_GADOL, Symbol.TSERE),
            slot().letter(Symbol.SAV, Symbol.NUN).vowel(Symbol.HOLAM_MALE_VAV, Symbol.SHURUQ));

    private static final ClusterPattern ENDING_IY_EIY_AY = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.HIRIQ, Symbol.HIRIQ_MALE_YOD, Symbol.TSERE, Symbol.PATAH, Symbol.QAMATS,
                    Symbol.QAMATS_GADOL),
            slot().letter(Symbol.EIM_QRIA_YOD, Symbol.YOD_GLIDE, Symbol.YOD));

    private static final ClusterPattern ENDING_EI_I = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.TSERE),
            slot().vowel(Symbol.HIRIQ_MALE_YOD),
            slot().letter(Symbol.EIM_QRIA_YOD));

    private static final ClusterPattern ENDING_EIKH = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.TSERE),
            slot().letter(Symbol.KHAF_SOFIT));

    private static final ClusterPattern ENDING_EKHA = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.SEGOL),
            slot().letter(Symbol.KHAF_SOFIT).vowel(Symbol.QAMATS_GADOL));

    private static final ClusterPattern ENDING_EYKHA = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.SEGOL),
            slot().letter(Symbol.EIM_QRIA_YOD),
            slot().letter(Symbol.KHAF_SOFIT).vowel(Symbol.QAMATS_GADOL));

    private static final ClusterPattern ENDING_A_EKHA = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS_GADOL),
            slot().vowel(Symbol.SEGOL),
            slot().letter(Symbol.KHAF_SOFIT).vowel(Symbol.QAMATS_GADOL));

    /** Anchored two letters before the sheva. */
    private static final ClusterPattern KHA_AFTER_HATAF = ClusterPattern.of(
            slot().vowel(Symbol.HATAF_PATAH, Symbol.HATAF_QAMATS, Symbol.HATAF_SEGOL),
            slot().vowel(Symbol.QAMATS, Symbol.QAMATS_GADOL),
            slot().vowel(Symbol.SHEVA),
            slot().letter(Symbol.KHAF_SOFIT).vowel(Symbol.QAMATS_GADOL));

    private static final ClusterPattern ENDING_AE_HMN = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS, Symbol.QAMATS_GADOL, Symbol.SEGOL),
            slot().letter(Symbol.MAPIQ_HE, Symbol.MEM_SOFIT, Symbol.NUN_SOFIT));

    /** Anchored one letter before the sheva. */
    private static final ClusterPattern GUTTURAL_EIM = ClusterPattern.of(
            slot().letter(Symbol.ALEF, Symbol.HE, Symbol.HET, Symbol.AYIN),
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.TSERE),
            slot().letter(Symbol.MEM_SOFIT));

    private static final ClusterPattern ENDING_A_A_HMN = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS, Symbol.QAMATS_GADOL),
            slot().vowel(Symbol.QAMATS, Symbol.QAMATS_GADOL),
            slot().letter(Symbol.HE, Symbol.EIM_QRIA_HE, Symbol.MAPIQ_HE, Symbol.MEM_SOFIT, Symbol.NUN_SOFIT));

    private static final ClusterPattern ENDING_EIY_EM = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.TSERE),
            slot().letter(Symbol.EIM_QRIA_YOD),
            slot().vowel(Symbol.SEGOL),
            slot().letter(Symbol.MEM_SOFIT));

    private static final ClusterPattern ENDING_A_I_MKH = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.QAMATS, Symbol.QAMATS_GADOL, Symbol.PATAH),
            slot().vowel(Symbol.HIRIQ),
            slot().letter(Symbol.KHAF_SOFIT, Symbol.MEM_SOFIT));

    private static final ClusterPattern ENDING_IY_MS = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.HIRIQ, Symbol.HIRIQ_MALE_YOD),
            slot().letter(Symbol.YOD, Symbol.EIM_QRIA_YOD),
            slot().letter(Symbol.MEM_SOFIT, Symbol.SAV));

    // the third slot is the vav absorbed into the holam
    private static final ClusterPattern ENDING_OS = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.HOLAM_MALE_VAV),
            slot(),
            slot().letter(Symbol.SAV));

    private static final ClusterPattern ENDING_A_DNRS = ClusterPattern.of(
            slot().vowel(Symbol.SHEVA),
            slot().vowel(Symbol.PATAH, Symbol.QAMATS, Symbol.QAMATS_GADOL),
            slot().letter(Symbol.DALET, Symbol.NUN_SOFIT, Symbol.AYIN, Symbol.RESH, Symbol.SAV));

    private ShevaEndingRules() {
    }

    static List<Rule> rules() {
        return List.of(
                Rule.of(Stage.SHEVA, "sheva-na-ending-sah", context -> na(context, ENDING_SAH, 0)),
                Rule.of(Stage.SHEVA, "sheva-na-ending-a|kh|l|f-ah", ShevaEndingRules::naEndingAlkhfAh),
                Rule.of(Stage.SHEVA, "sheva-na-ending-u", context -> na(context, ENDING_U, 1)),
                Rule.of(Stage.SHEVA, "sheva-na-ending-l|sh|s-kha", ShevaEndingRules::naEndingLshsKha),
                Rule.of(Stage.SHEVA, "sheva-na-ending-eim", ShevaEndingRules::naEndingEim),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-iyah", context -> nah(context, ENDING_IYAH, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-ah", context -> nah(context, ENDING_AH, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-o", context -> nah(context, ENDING_O, 1)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-av", context -> nah(context, ENDING_AV, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-a|ei-s|n-u|o", context -> nah(context, ENDING_AEI_SN_UO, 1)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-iy|eiy|ay", context -> nah(context, ENDING_IY_EIY_AY, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-ei-i", context -> nah(context, ENDING_EI_I, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-eikh", context -> nah(context, ENDING_EIKH, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-ekha", context -> nah(context, ENDING_EKHA, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-eykha", context -> nah(context, ENDING_EYKHA, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-a-ekha", context -> nah(context, ENDING_A_EKHA, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-kha-after-hataf", ShevaEndingRules::nahKhaAfterHataf),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-a|e-h|m|n", ShevaEndingRules::nahEndingAeHmn),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-guttural-eim", ShevaEndingRules::nahGutturalEim),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-a-a-h|m|n", ShevaEndingRules::nahEndingAaHmn),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-eiy-em", context -> nah(context, ENDING_EIY_EM, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-a-i-m|kh", context -> nah(context, ENDING_A_I_MKH, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-iy-m|s", context -> nah(context, ENDING_IY_MS, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-os", context -> nah(context, ENDING_OS, 0)),
                Rule.of(Stage.SHEVA, "sheva-nah-ending-a-d|n|r|s", ShevaEndingRules::nahEndingADnrs));
    }

    private static Cluster na(RuleContext context, ClusterPattern ending, int extra) {
        return context.endsWith(ending, extra) ? context.guess().setVowel(Symbol.SHEVA_NA) : null;
    }

    private static Cluster nah(RuleContext context, ClusterPattern ending, int extra) {
        return context.endsWith(ending, extra) ? context.guess().setVowel(Symbol.SHEVA_NAH) : null;
    }

    /** Exceptions to the -ah ending after gimel, yod or mem. */
    private static Cluster naEndingAlkhfAh(RuleContext context) {
        if (context.prev().letterIn(Symbol.GIMEL, Symbol.YOD, Symbol.MEM)) {
            return na(context, ENDING_ALKHF_AH, 0);
        }
        return null;
    }

    private static Cluster naEndingLshsKha(RuleContext context) {
        return context.index() > 2 ? na(context, ENDING_LSHS_KHA, 0) : null;
    }

    private static Cluster naEndingEim(RuleContext context) {
        return SymbolTable.isGuttural(context.prev().letter()) ? null : na(context, ENDING_EIM, 0);
    }

    private static Cluster nahKhaAfterHataf(RuleContext context) {
        if (context.index() >= 2 && context.matchesAt(context.index() - 2, KHA_AFTER_HATAF)) {
            return context.guess().setVowel(Symbol.SHEVA_NAH);
        }
        return null;
    }

    private static Cluster nahEndingAeHmn(RuleContext context) {
        if (!context.endsWith(ENDING_AE_HMN)) {
            return null;
        }
        promoteQamats(context.clusterAt(context.size() - 2));
        return context.guess().setVowel(Symbol.SHEVA_NAH);
    }

    private static Cluster nahGutturalEim(RuleContext context) {
        if (context.index() >= 1 && context.matchesAt(context.index() - 1, GUTTURAL_EIM)) {
            return context.guess().setVowel(Symbol.SHEVA_NAH);
        }
        return null;
    }

    private static Cluster nahEndingAaHmn(RuleContext context) {
        if (!context.endsWith(ENDING_A_A_HMN)) {
            return null;
        }
        context.clusterAt(context.size() - 2).setVowel(Symbol.QAMATS_GADOL);
        context.clusterAt(context.size() - 3).setVowel(Symbol.QAMATS_GADOL);
        return context.guess().setVowel(Symbol.SHEVA_NAH);
    }

    private static Cluster nahEndingADnrs(RuleContext context) {
        if (!context.endsWith(ENDING_A_DNRS)) {
            return null;
        }
        promoteQamats(context.clusterAt(context.size() - 2));
        return context.guess().setVowel(Symbol.SHEVA_NAH);
    }

    private static void promoteQamats(Cluster cluster) {
        if (cluster.vowel() == Symbol.QAMATS) {
            cluster.setVowel(Symbol.QAMATS_GADOL);
        }
    }
}
