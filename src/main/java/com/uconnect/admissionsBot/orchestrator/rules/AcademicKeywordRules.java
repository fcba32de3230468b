package com.uconnect.admissionsBot.orchestrator.rules;

import java.util.List;
import java.util.Optional;

/**
 * Ordered lookup tables that map Spanish phrasings to canonical catalog names.
 * Canonical names are upper case without accents, as in the institutional datasets.
 */
public final class AcademicKeywordRules {

    /**
     * Program tiers, most specific first: full phrases, then abbreviated or partial
     * forms, then bare keywords.
     */
    static final List<KeywordRule> PROGRAM_FULL_PHRASES = List.of(
            KeywordRule.of("ingenieria\\s+industrial", "INGENIERIA INDUSTRIAL"),
            KeywordRule.of("ingenieria\\s+de\\s+sistemas", "INGENIERIA DE SISTEMAS"),
            KeywordRule.of("ingenieria\\s+mecanica", "INGENIERIA MECANICA"),
            KeywordRule.of("ingenieria\\s+ambiental", "INGENIERIA AMBIENTAL"),
            KeywordRule.of("ingenieria\\s+de\\s+alimentos", "INGENIERIA DE ALIMENTOS"),
            KeywordRule.of("ingenieria\\s+agronomica", "INGENIERIA AGRONOMICA")
    );

    static final List<KeywordRule> PROGRAM_PARTIAL_FORMS = List.of(
            KeywordRule.of("ingenieria\\s+industri", "INGENIERIA INDUSTRIAL"),
            KeywordRule.of("ingenieria\\s+sistem", "INGENIERIA DE SISTEMAS"),
            KeywordRule.of("\\bing\\.?\\s+industri", "INGENIERIA INDUSTRIAL"),
            KeywordRule.of("\\bing\\.?\\s+(de\\s+)?sistem", "INGENIERIA DE SISTEMAS"),
            KeywordRule.of("\\bing\\.?\\s+mecanic", "INGENIERIA MECANICA"),
            KeywordRule.of("\\bing\\.?\\s+ambient", "INGENIERIA AMBIENTAL"),
            KeywordRule.of("\\bing\\.?\\s+(de\\s+)?alimento", "INGENIERIA DE ALIMENTOS"),
            KeywordRule.of("\\bing\\.?\\s+agronom", "INGENIERIA AGRONOMICA")
    );

    static final List<KeywordRule> PROGRAM_BARE_KEYWORDS = List.of(
            KeywordRule.of("industri(a|al)", "INGENIERIA INDUSTRIAL"),
            KeywordRule.of("\\bsistemas\\b", "INGENIERIA DE SISTEMAS"),
            KeywordRule.of("\\bmecanica\\b", "INGENIERIA MECANICA"),
            KeywordRule.of("\\bambiental\\b", "INGENIERIA AMBIENTAL"),
            KeywordRule.of("\\balimentos\\b", "INGENIERIA DE ALIMENTOS"),
            KeywordRule.of("agronomica|agronomia", "INGENIERIA AGRONOMICA"),
            KeywordRule.of("veterinaria|zootecnia", "MEDICINA VETERINARIA Y ZOOTECNIA"),
            KeywordRule.of("enfermeria", "ENFERMERIA"),
            KeywordRule.of("\\bderecho\\b", "DERECHO"),
            KeywordRule.of("finanzas|negocios\\s+internacionales", "ADMINISTRACION EN FINANZAS Y NEGOCIOS INTERNACIONALES"),
            KeywordRule.of("administracion.*salud|salud.*administracion", "ADMINISTRACION EN SALUD"),
            KeywordRule.of("acuicultura", "ACUICULTURA"),
            KeywordRule.of("\\bbiologia\\b", "BIOLOGIA"),
            KeywordRule.of("\\bquimica\\b", "QUIMICA"),
            KeywordRule.of("\\bfisica\\b", "FISICA"),
            KeywordRule.of("estadistica", "ESTADISTICA"),
            KeywordRule.of("geografia", "GEOGRAFIA"),
            KeywordRule.of("matematicas", "MATEMATICAS"),
            KeywordRule.of("bacteriolog", "BACTERIOLOGIA"),
            KeywordRule.of("regencia|farmacia", "TECNOLOGIA EN REGENCIA DE FARMACIA"),
            KeywordRule.of("desarrollo.*software|software", "TECNOLOGIA EN DESARROLLO DE SOFTWARE"),
            KeywordRule.of("programacion.*web", "TECNICO PROFESIONAL EN PROGRAMACION WEB"),
            KeywordRule.of("lic.*ciencias.*naturales|ciencias.*naturales.*educ", "LICENCIATURA EN CIENCIAS NATURALES Y EDUCACION AMBIENTAL"),
            KeywordRule.of("lic.*ciencias.*sociales|ciencias.*sociales", "LICENCIATURA EN CIENCIAS SOCIALES"),
            KeywordRule.of("lic.*artistica|educacion.*artistica", "LICENCIATURA EN EDUCACION ARTISTICA"),
            KeywordRule.of("lic.*infantil|educacion.*infantil", "LICENCIATURA EN EDUCACION INFANTIL"),
            KeywordRule.of("lic.*fisica.*deporte|educacion.*fisica", "LICENCIATURA EN EDUCACION FISICA RECREACION Y DEPORTE"),
            KeywordRule.of("lic.*informatica|informatica.*medios", "LICENCIATURA EN INFORMATICA Y MEDIOS AUDIOVISUALES"),
            KeywordRule.of("lic.*ingles|lenguas.*extranjeras", "LICENCIATURA EN LENGUAS EXTRANJERAS CON ENFASIS EN INGLES"),
            KeywordRule.of("lic.*literatura|lengua.*castellana", "LICENCIATURA EN LITERATURA Y LENGUA CASTELLANA")
    );

    static final List<List<KeywordRule>> PROGRAM_TIERS = List.of(
            PROGRAM_FULL_PHRASES, PROGRAM_PARTIAL_FORMS, PROGRAM_BARE_KEYWORDS);

    /**
     * First match wins.
     */
    static final List<KeywordRule> FACULTIES = List.of(
            KeywordRule.of("ingenieria|ingenierias|\\bing\\b", "FACULTAD DE INGENIERIAS"),
            KeywordRule.of("agricola|agricolas|agronomia|\\bagro\\b", "FACULTAD DE CIENCIAS AGRICOLAS"),
            KeywordRule.of("ciencias\\s*basicas|basicas|fisica|quimica|biologia|estadistica|matematica|geografia", "FACULTAD DE CIENCIAS BASICAS"),
            KeywordRule.of("salud|enfermeria|medicina(?!\\s*veterinaria)|bacteriologia", "FACULTAD DE CIENCIAS DE LA SALUD"),
            KeywordRule.of("economica|juridica|administrativa|derecho|administracion|finanzas|comercio", "FACULTAD DE CIENCIAS ECONOMICAS, JURIDICAS Y ADMINISTRATIVAS"),
            KeywordRule.of("educacion|humanas|pedagogia|licenciatura|sociales", "FACULTAD DE EDUCACION Y CIENCIAS HUMANAS"),
            KeywordRule.of("veterinaria|zootecnia|animal", "FACULTAD DE MEDICINA VETERINARIA Y ZOOTECNIA")
    );

    /**
     * All matching tracks are kept.
     */
    static final List<KeywordRule> SCHEDULE_TRACKS = List.of(
            KeywordRule.of("diurna", "DIURNA"),
            KeywordRule.of("nocturna", "NOCTURNA"),
            KeywordRule.of("distancia", "DISTANCIA"),
            KeywordRule.of("sabatina", "SABATINA")
    );

    private static final String WORD_START = "(?<![a-z0-9])";
    private static final String WORD_END = "(?![a-z0-9])";

    /**
     * Spanish ordinals and their abbreviations, tried in order.
     */
    static final List<KeywordRule> SEMESTER_ORDINALS = List.of(
            ordinal("primer|primero|1er|1[°º]", "1"),
            ordinal("segundo|2do|2[°º]", "2"),
            ordinal("tercer|tercero|3er|3[°º]", "3"),
            ordinal("cuarto|4to|4[°º]", "4"),
            ordinal("quinto|5to|5[°º]", "5"),
            ordinal("sexto|6to|6[°º]", "6"),
            ordinal("septimo|7mo|7[°º]", "7"),
            ordinal("octavo|8vo|8[°º]", "8"),
            ordinal("noveno|9no|9[°º]", "9"),
            ordinal("decimo|10mo|10[°º]", "10")
    );

    static final KeywordRule SEMESTER_NUMBER = KeywordRule.of("semestre\\s*(\\d{1,2})", "");

    private AcademicKeywordRules() {
        // Constants class
    }

    /**
     * Resolves at most one program. The first tier with any match wins, and within a tier
     * the first matching rule.
     */
    public static Optional<String> resolveProgram(String normalizedText) {
        for (List<KeywordRule> tier : PROGRAM_TIERS) {
            Optional<String> program = KeywordRule.firstMatch(tier, normalizedText);
            if (program.isPresent()) {
                return program;
            }
        }
        return Optional.empty();
    }

    public static Optional<String> resolveFaculty(String normalizedText) {
        return KeywordRule.firstMatch(FACULTIES, normalizedText);
    }

    public static List<String> resolveScheduleTracks(String normalizedText) {
        return SCHEDULE_TRACKS.stream()
                .filter(rule -> rule.matches(normalizedText))
                .map(KeywordRule::value)
                .toList();
    }

    /**
     * Ordinal words first, then "semestre N". Only semesters 1 to 10 exist.
     */
    public static Optional<String> resolveSemester(String normalizedText) {
        Optional<String> ordinal = KeywordRule.firstMatch(SEMESTER_ORDINALS, normalizedText);
        if (ordinal.isPresent()) {
            return ordinal;
        }
        var matcher = SEMESTER_NUMBER.pattern().matcher(normalizedText);
        if (matcher.find()) {
            int semester = Integer.parseInt(matcher.group(1));
            if (semester >= 1 && semester <= 10) {
                return Optional.of(String.valueOf(semester));
            }
        }
        return Optional.empty();
    }

    private static KeywordRule ordinal(String alternatives, String semester) {
        return KeywordRule.of(WORD_START + "(" + alternatives + ")" + WORD_END, semester);
    }
}
