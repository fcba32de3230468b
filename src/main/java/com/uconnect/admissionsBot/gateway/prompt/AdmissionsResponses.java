package com.uconnect.admissionsBot.gateway.prompt;

/**
 * Admissions texts built around the configured simulator and reference-score links.
 */
public class AdmissionsResponses {

    private AdmissionsResponses() {}

    private static final String GENERAL_ANSWER_TEMPLATE = """
            ## Proceso de Admisión - Universidad de Córdoba

            El ingreso a la Universidad de Córdoba se realiza a través de un **proceso de selección basado en los \
            resultados de las Pruebas Saber 11 (ICFES)**. Cada programa académico asigna **pesos diferentes** a las \
            áreas evaluadas (Lectura Crítica, Matemáticas, Ciencias Naturales, Sociales y Ciudadanas, Inglés), por lo \
            que el **promedio ponderado** varía según la carrera a la que aspires.

            ### ¿Cómo calcular tu puntaje?
            Usa el simulador oficial para estimar tu puntaje de admisión con tus resultados del Saber 11:
            - [Simulador de Promedio Ponderado por Programa](%1$s)

            ### ¿Cuáles son los puntajes de referencia?
            Consulta los puntajes mínimos y máximos de referencia por programa y jornada del período actual:
            - [Puntajes de Referencia](%2$s)

            ### Recomendación
            1. Descarga el simulador e ingresa tus puntajes del ICFES
            2. Compara tu resultado con los puntajes de referencia del programa que te interesa
            3. Así tendrás una orientación clara sobre tus posibilidades de ingreso
            """;

    private static final String CONTEXT_NOTES_TEMPLATE = """
            RESUMEN: Información de admisión para el programa %3$s

            PROCESO DE ADMISION:
            - La selección se basa en los resultados de las Pruebas Saber 11 (ICFES).
            - Cada programa pondera de forma distinta las áreas evaluadas; el puntaje de admisión es un promedio ponderado.
            - Simulador de promedio ponderado por programa: %1$s
            - Puntajes de referencia por programa y jornada: %2$s
            - Incluye siempre ambos enlaces en la respuesta.
            """;

    private static final String LINKS_FOOTER_TEMPLATE = """


            ---
            [Simulador de Promedio Ponderado](%1$s)
            [Puntajes de Referencia](%2$s)""";

    public static String generalAnswer(String simulatorUrl, String referenceScoresUrl) {
        return String.format(GENERAL_ANSWER_TEMPLATE, simulatorUrl, referenceScoresUrl);
    }

    /**
     * Admissions facts placed ahead of the academic context when the question names a program.
     */
    public static String contextNotes(String simulatorUrl, String referenceScoresUrl, String program) {
        return String.format(CONTEXT_NOTES_TEMPLATE, simulatorUrl, referenceScoresUrl, program);
    }

    public static String linksFooter(String simulatorUrl, String referenceScoresUrl) {
        return String.format(LINKS_FOOTER_TEMPLATE, simulatorUrl, referenceScoresUrl);
    }
}
