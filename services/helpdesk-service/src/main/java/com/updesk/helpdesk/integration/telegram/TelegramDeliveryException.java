package com.updesk.helpdesk.integration.telegram;

public class TelegramDeliveryException extends RuntimeException {

    public TelegramDeliveryException(String message) {
        super(message);
    }
}
