package com.example.notification.shared.model;

import com.example.notification.shared.util.Constants;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Rich style applied to a notification. The code is what the platform layer reads.
 * Code 1 is reserved for a big picture style and has no constant.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationStyle {
    NONE(Constants.StyleCodes.NONE),
    BIG_TEXT(Constants.StyleCodes.BIG_TEXT);

    private final int code;

    /**
     * @return the style for {@code code}, or {@code null} when no style uses that code
     */
    public static NotificationStyle fromCode(int code) {
        for (NotificationStyle style : values()) {
            if (style.code == code) {
                return style;
            }
        }
        return null;
    }
}
