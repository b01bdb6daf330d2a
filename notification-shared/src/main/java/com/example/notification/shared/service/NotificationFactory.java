package com.example.notification.shared.service;

import com.example.notification.shared.config.AppProperties;
import com.example.notification.shared.dto.NotificationPayload;
import com.example.notification.shared.exception.NotificationConfigurationException;
import com.example.notification.shared.mapper.NotificationPayloadMapper;
import com.example.notification.shared.model.NotificationColor;
import com.example.notification.shared.model.NotificationDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Builds notification descriptors with the application's configured defaults and converts them
 * to the raw payload handed to the platform scheduler.
 * <p>
 * Defaults only fill fields that are still at their "unset" value. Nothing is rejected: a repeat
 * interval below the platform minimum is logged and passed through.
 */
@Service
@Slf4j
public class NotificationFactory {

    private final AppProperties appProperties;
    private final NotificationPayloadMapper payloadMapper;
    private final NotificationColor defaultColor;

    public NotificationFactory(AppProperties appProperties, NotificationPayloadMapper payloadMapper) {
        this.appProperties = appProperties;
        this.payloadMapper = payloadMapper;
        this.defaultColor = resolveDefaultColor(appProperties.getDefaults().getColor());
    }

    public NotificationDescriptor create(String title, String text, LocalDateTime fireTime) {
        return applyDefaults(new NotificationDescriptor(title, text, fireTime));
    }

    public NotificationDescriptor createRepeating(String title, String text, LocalDateTime fireTime,
                                                  Duration repeatInterval) {
        warnIfBelowMinimum(title, repeatInterval);
        return applyDefaults(new NotificationDescriptor(title, text, fireTime, repeatInterval));
    }

    public NotificationDescriptor createRepeating(String title, String text, LocalDateTime fireTime,
                                                  Duration repeatInterval, String smallIcon) {
        warnIfBelowMinimum(title, repeatInterval);
        return applyDefaults(new NotificationDescriptor(title, text, fireTime, repeatInterval, smallIcon));
    }

    /**
     * Fills unset icons, color and group from configuration. Boolean flags are only ever switched on.
     *
     * @return the same descriptor, for chaining
     */
    public NotificationDescriptor applyDefaults(NotificationDescriptor descriptor) {
        AppProperties.Defaults defaults = appProperties.getDefaults();
        if (descriptor.getSmallIcon().isEmpty()) {
            descriptor.setSmallIcon(defaults.getSmallIcon());
        }
        if (descriptor.getLargeIcon().isEmpty()) {
            descriptor.setLargeIcon(defaults.getLargeIcon());
        }
        if (!descriptor.hasColor() && defaultColor != null) {
            descriptor.setColor(defaultColor);
        }
        if (descriptor.getGroup().isEmpty()) {
            descriptor.setGroup(defaults.getGroup());
        }
        if (defaults.isAutoCancel()) {
            descriptor.setShouldAutoCancel(true);
        }
        if (defaults.isShowTimestamp()) {
            descriptor.setShowTimestamp(true);
        }
        return descriptor;
    }

    public boolean isBelowMinimumRepeat(Duration repeatInterval) {
        return repeatInterval != null
                && repeatInterval.compareTo(appProperties.getRepeat().getMinimumInterval()) < 0;
    }

    public NotificationPayload toPayload(NotificationDescriptor descriptor) {
        NotificationPayload payload = payloadMapper.toPayload(descriptor);
        log.debug("Prepared payload for notification '{}' firing at epoch {}",
                payload.getTitle(), payload.getFireTimeEpochMilli());
        return payload;
    }

    public NotificationDescriptor fromPayload(NotificationPayload payload) {
        return payloadMapper.toDescriptor(payload);
    }

    private void warnIfBelowMinimum(String title, Duration repeatInterval) {
        if (isBelowMinimumRepeat(repeatInterval)) {
            log.warn("Repeat interval {} for notification '{}' is below the platform minimum of {}",
                    repeatInterval, title, appProperties.getRepeat().getMinimumInterval());
        }
    }

    private static NotificationColor resolveDefaultColor(String color) {
        if (color == null || color.isEmpty()) {
            return null;
        }
        try {
            return NotificationColor.parse(color);
        } catch (IllegalArgumentException e) {
            log.error("Invalid default notification color '{}'", color, e);
            throw new NotificationConfigurationException("notification.defaults.color",
                    "Invalid default notification color: " + color, e);
        }
    }
}
