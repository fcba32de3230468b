package com.uconnect.admissionsBot.orchestrator.prompt;

/**
 * Prompt asking the language model for a lookup plan over the three academic endpoints.
 */
public class QueryPlanPrompt {

    private QueryPlanPrompt() {}

    public static final String SYSTEM_PROMPT = """
            Eres un planificador de consultas para las APIs academicas de la Universidad de Cordoba.
            Respondes SOLO con JSON valido.
            """;

    private static final String USER_PROMPT_TEMPLATE = """
            Dado el mensaje del usuario, genera los parametros optimos para consultar las APIs academicas.

            MENSAJE: "%s"

            ENTIDADES EXTRAIDAS:
            %s

            APIs DISPONIBLES:
            1. facultades - params: nombre
            2. programas - params: programa_nombre, facultad_nombre
            3. pensum - params: programa_nombre, semestre, materia_nombre, lugar_desarrollo

            Genera un plan de consulta en JSON:
            {
              "apis": [
                { "endpoint": "facultades|programas|pensum", "params": { "param_name": "valor" }, "priority": 1 }
              ],
              "strategy": "sequential|parallel",
              "maxResults": %d
            }

            REGLAS:
            - Usa busquedas parciales (ej: "siste" en lugar de "ingenieria de sistemas")
            - Prioriza APIs mas especificas primero
            - Maximo %d llamadas a APIs por consulta
            """;

    public static String userPrompt(String utterance, String entitiesJson, int maxResults, int maxCalls) {
        return String.format(USER_PROMPT_TEMPLATE, utterance.replace("\"", "'"), entitiesJson, maxResults, maxCalls);
    }
}
