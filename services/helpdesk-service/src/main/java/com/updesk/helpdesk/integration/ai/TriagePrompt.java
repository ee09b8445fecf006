package com.updesk.helpdesk.integration.ai;

/**
 * Prompt sent to the model for every new ticket. The answer shape it asks for is what
 * {@link TriageResponseParser} understands.
 */
final class TriagePrompt {

    private static final String TEMPLATE = """
        Aja como um especialista de suporte técnico de TI (Nível 1). Um usuário está relatando o seguinte problema:
        - Título do Chamado: "%s"
        - Descrição do Problema: "%s"

        Primeiro, classifique a urgência deste chamado como 'Baixa', 'Média' ou 'Alta' com base na descrição.
        Em seguida, forneça uma solução clara e em formato de passo a passo para um usuário final.
        A resposta deve ser direta e fácil de entender. Se não tiver certeza, sugira coletar mais informações que poderiam ajudar no diagnóstico.

        Formato da resposta:
        Urgência: [Classificação da Urgência]
        Solução: [Solução detalhada em passos]
        """;

    private TriagePrompt() {
    }

    static String render(String title, String description) {
        return TEMPLATE.formatted(nullToEmpty(title), nullToEmpty(description));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
