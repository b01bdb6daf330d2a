package com.example.notification.shared.exception;

import lombok.Getter;

/**
 * Thrown when configured notification defaults cannot be turned into descriptor values.
 * Keeps the offending property name so startup failures point at the right setting.
 */
@Getter
public class NotificationConfigurationException extends RuntimeException {

    private final String propertyName;

    public NotificationConfigurationException(String propertyName, String message, Throwable cause) {
        super(message, cause);
        this.propertyName = propertyName;
    }
}
