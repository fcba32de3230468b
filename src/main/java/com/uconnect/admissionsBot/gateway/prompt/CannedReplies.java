package com.uconnect.admissionsBot.gateway.prompt;

/**
 * Fixed replies for turns that need no academic data.
 */
public class CannedReplies {

    private CannedReplies() {}

    public static final String GREETING = """
            ¡Hola! Soy UConnect, tu asistente virtual de la Universidad de Córdoba. Puedo ayudarte con información sobre:

            - Programas académicos: carreras disponibles
            - Pensum: materias por semestre
            - Facultades: información de facultades
            - Proceso de admisión: puntajes y simulador

            ¿En qué puedo ayudarte hoy?""";

    public static final String FAREWELL = """
            ¡Hasta pronto! Fue un gusto ayudarte. Si tienes más preguntas sobre la Universidad de Córdoba, \
            no dudes en volver. ¡Éxitos en tu camino académico!""";
}
