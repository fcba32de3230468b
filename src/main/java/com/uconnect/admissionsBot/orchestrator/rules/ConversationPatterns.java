package com.uconnect.admissionsBot.orchestrator.rules;

import java.util.regex.Pattern;

/**
 * Patterns over normalized utterances that classify the kind of turn rather than a catalog entity.
 */
public final class ConversationPatterns {

    /**
     * Whole utterance made only of greeting words, e.g. "hola buenos dias!".
     */
    public static final Pattern GREETING = Pattern.compile(
            "^[¡¿]?\\s*(?:(?:hola|buen[oa]s?\\s*(?:dias?|tardes?|noches?)|hey|saludos?|que\\s*tal)[\\s,!?.¡]*)+$");

    public static final Pattern FAREWELL = Pattern.compile(
            "^[¡¿]?\\s*(?:adios|chao|hasta\\s*luego|bye|gracias|nos\\s*vemos)");

    public static final Pattern ADMISSIONS = Pattern.compile(
            "admision|inscripcion|inscribirme"
                    + "|proceso\\s*(de)?\\s*(admision|inscripcion|entrada|ingreso|seleccion)"
                    + "|requisitos?\\s*(de)?\\s*ingreso"
                    + "|como\\s*(entro|ingreso|me\\s*inscribo)"
                    + "|puedo\\s*(entrar|ingresar|aspirar)"
                    + "|puntaje|icfes|saber\\s*11|aspirante|aspirar|simulador|ponderado"
                    + "|nota\\s*de\\s*corte|corte\\s*(de)?\\s*(admision)?"
                    + "|calcular\\s*(mi)?\\s*puntaje");

    public static final Pattern CURRICULUM = Pattern.compile("materias?|asignaturas?|pensum");

    public static final Pattern CREDITS = Pattern.compile("creditos?");

    public static final Pattern FACULTY = Pattern.compile("facultad");

    public static final Pattern PROGRAM = Pattern.compile("programa|carrera");

    public static final Pattern COURSE = Pattern.compile("\\b(materia|asignatura|clase|curso)\\s+de\\b");

    public static final Pattern LIST_FACULTIES = Pattern.compile(
            "cuantas?\\s*facultades?|listar?\\s*(las\\s*)?facultades?|todas?\\s*las?\\s*facultades?|que\\s*facultades");

    public static final Pattern LIST_PROGRAMS = Pattern.compile(
            "cuantos?\\s*programas?|listar?\\s*(los\\s*)?programas?|carreras?\\s*ofrece|que\\s*carreras?"
                    + "|programas?\\s*tiene|que\\s+programas|todos\\s+los\\s+programas|todas\\s+las\\s+carreras");

    public static final Pattern LIST_COURSES = Pattern.compile(
            "cuantas?\\s*materias?|listar?\\s*(las\\s*)?materias?|todas?\\s*las?\\s*materias?");

    /**
     * Listing cue without a category noun of its own.
     */
    public static final Pattern GENERIC_LISTING = Pattern.compile(
            "\\b(listar?|cuales|todos|todas)\\b|que\\s+(programas|carreras)\\s+(hay|ofrece|tiene)");

    /**
     * Turn that leans on the previous one: "y de ...", "que tal ...", "como es ...", "cuales ...".
     */
    public static final Pattern FOLLOW_UP = Pattern.compile(
            "^[¡¿]?\\s*(y\\s+(de|el|la|los|las)?|que\\s+tal|como\\s+es|cual(es)?)");

    public static final Pattern SEMESTER_MENTION = Pattern.compile(
            "semestre|primer|segund|tercer|cuart|quint|sext|septim|octav|noven|decim");

    private ConversationPatterns() {
        // Constants class
    }
}
