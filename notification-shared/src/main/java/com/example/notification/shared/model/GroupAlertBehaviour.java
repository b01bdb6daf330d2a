package com.example.notification.shared.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Which notifications of a group keep their sound and vibration.
 */
@Getter
@RequiredArgsConstructor
public enum GroupAlertBehaviour {
    /** Every notification in the group alerts. */
    GROUP_ALERT_ALL(0),
    /** The group summary is muted. */
    GROUP_ALERT_SUMMARY(1),
    /** Children of the group are muted; must be set on each child. */
    GROUP_ALERT_CHILDREN(2);

    private final int code;

    public static GroupAlertBehaviour fromCode(int code) {
        for (GroupAlertBehaviour behaviour : values()) {
            if (behaviour.code == code) {
                return behaviour;
            }
        }
        return null;
    }
}
