package com.example.notification.shared.mapper;

import com.example.notification.shared.dto.NotificationPayload;
import com.example.notification.shared.model.NotificationDescriptor;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ObjectFactory;

/**
 * Copies raw fields between a descriptor and its payload. No unit conversion happens here,
 * so sentinel encodings survive in both directions.
 */
@Mapper(componentModel = "spring")
public abstract class NotificationPayloadMapper {

    public abstract NotificationPayload toPayload(NotificationDescriptor descriptor);

    // Typed views over the raw fields; the raw fields are mapped by name
    @Mapping(target = "fireTime", ignore = true)
    @Mapping(target = "repeatInterval", ignore = true)
    @Mapping(target = "style", ignore = true)
    @Mapping(target = "color", ignore = true)
    @Mapping(target = "groupAlertBehaviour", ignore = true)
    @Mapping(target = "customTimestamp", ignore = true)
    public abstract NotificationDescriptor toDescriptor(NotificationPayload payload);

    @ObjectFactory
    protected NotificationDescriptor newDescriptor(NotificationPayload payload) {
        // Raw fields, the fire time included, are copied over by the generated mapping
        return new NotificationDescriptor(payload.getTitle(), payload.getText(), null);
    }
}
