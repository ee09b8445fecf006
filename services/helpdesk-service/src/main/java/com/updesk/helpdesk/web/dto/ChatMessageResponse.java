package com.updesk.helpdesk.web.dto;

/**
 * Result of a chat post. {@code status} is {@code ok} when everything went through and
 * {@code partial} when the message was stored but support could not be notified.
 */
public record ChatMessageResponse(String status, String message, Long interactionId, boolean saved) {

    public static ChatMessageResponse ok(Long interactionId) {
        return new ChatMessageResponse("ok", "Mensagem enviada com sucesso.", interactionId, true);
    }

    public static ChatMessageResponse partial(Long interactionId) {
        return new ChatMessageResponse("partial",
            "Mensagem salva, mas houve falha ao notificar o suporte.", interactionId, true);
    }
}
