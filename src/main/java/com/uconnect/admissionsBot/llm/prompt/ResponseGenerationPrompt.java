package com.uconnect.admissionsBot.llm.prompt;

/**
 * Prompts for grounded answer generation.
 */
public class ResponseGenerationPrompt {

    private ResponseGenerationPrompt() {}

    public static final String SYSTEM_PROMPT = """
            Eres UConnect, el asistente virtual de admisiones de la Universidad de Cordoba (Colombia).

            Tu funcion:
            1. Responder preguntas sobre facultades, programas academicos, pensum y proceso de admision
            2. Usar SOLO la informacion del contexto academico proporcionado
            3. Ser preciso con nombres, codigos, creditos y semestres
            4. Responder en espanol, de forma clara y amable
            5. Si el contexto no tiene la informacion, decir que no la tienes disponible
            6. Organizar listas largas por semestre o por facultad
            7. Para preguntas fuera de tu alcance, sugerir contactar a admisiones@unicordoba.edu.co
            """;

    private static final String USER_PROMPT_TEMPLATE = """
            Basandote en el siguiente contexto academico de la Universidad de Cordoba, responde la pregunta del estudiante.

            CONTEXTO ACADEMICO:
            %s

            PREGUNTA DEL ESTUDIANTE:
            %s

            INSTRUCCIONES:
            1. Usa SOLO la informacion del contexto proporcionado
            2. Si el contexto no tiene la informacion, indica que no la tienes disponible
            3. Se especifico con numeros, codigos y nombres exactos
            4. Si hay multiples resultados, organizalos claramente
            5. Sugiere preguntas de seguimiento si es relevante
            """;

    public static String userPrompt(String context, String question) {
        String groundedContext = context == null || context.isBlank()
                ? "(sin datos academicos para esta consulta)"
                : context;
        return String.format(USER_PROMPT_TEMPLATE, groundedContext, question);
    }
}
