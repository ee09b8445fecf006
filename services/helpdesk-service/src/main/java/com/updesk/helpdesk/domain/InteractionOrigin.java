package com.updesk.helpdesk.domain;

/**
 * Channel an interaction was authored on. Set once when the interaction is written.
 */
public enum InteractionOrigin {
    PANEL("painel"),
    TELEGRAM("telegram"),
    EMAIL("email");

    private final String wireValue;

    InteractionOrigin(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
