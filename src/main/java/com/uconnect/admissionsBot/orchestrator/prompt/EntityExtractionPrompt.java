package com.uconnect.admissionsBot.orchestrator.prompt;

/**
 * Prompt asking the language model to read entities out of a student's message.
 * Used only when the keyword rules found nothing specific.
 */
public class EntityExtractionPrompt {

    private EntityExtractionPrompt() {}

    public static final String SYSTEM_PROMPT = """
            Eres un analizador de consultas academicas de la Universidad de Cordoba.
            Respondes SOLO con JSON valido, sin explicaciones adicionales.
            """;

    private static final String USER_PROMPT_TEMPLATE = """
            Analiza el siguiente mensaje de un estudiante y extrae las entidades relevantes para buscar informacion academica.

            MENSAJE: "%s"

            Extrae en formato JSON:
            {
              "facultades": ["nombres de facultades mencionadas o relacionadas"],
              "programas": ["nombres de programas/carreras mencionados"],
              "materias": ["nombres de materias mencionadas"],
              "semestres": ["numeros de semestre mencionados"],
              "jornadas": ["diurna", "nocturna", "sabatina" si se mencionan],
              "intenciones": ["INFO_FACULTAD, INFO_PROGRAMA, INFO_MATERIA, INFO_PENSUM, LISTAR_FACULTADES, LISTAR_PROGRAMAS, LISTAR_MATERIAS, CREDITOS, JORNADA, GENERAL"],
              "rawQuery": "terminos de busqueda optimizados"
            }

            REGLAS:
            - Si menciona "ingenieria de sistemas" -> programas: ["ingenieria de sistemas"]
            - Si menciona "cuantas materias" -> intenciones: ["INFO_PENSUM", "LISTAR_MATERIAS"]
            - Normaliza acentos y mayusculas
            - Si no hay entidades claras, usa arrays vacios
            """;

    public static String userPrompt(String utterance) {
        return String.format(USER_PROMPT_TEMPLATE, utterance.replace("\"", "'"));
    }
}
