package com.example.notification.shared.model;

import com.example.notification.shared.util.Constants;
import com.example.notification.shared.util.EpochTimeUtils;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Content and delivery metadata of one scheduled local notification, before it is handed to the scheduler.
 * <p>
 * Fields hold the raw encoding the platform layer reads (epoch milliseconds, packed ARGB, integer codes,
 * sentinels for "unset"). The typed accessors ({@link #getFireTime()}, {@link #getRepeatInterval()},
 * {@link #getStyle()}, {@link #getColor()}, {@link #getGroupAlertBehaviour()}, {@link #getCustomTimestamp()})
 * convert at the boundary and use {@code null} where the raw field carries a sentinel.
 * <p>
 * Nothing is validated here. Unknown codes, negative counts and icon names that do not resolve are passed
 * through as-is. Instances are not thread-safe.
 */
@Data
public class NotificationDescriptor {

    /** First line of the notification. */
    private String title;
    /** Second line of the notification. */
    private String text;

    /** Drawable resource name without extension, shown in the status bar. Empty when unset. */
    private String smallIcon;
    /** Drawable resource name without extension, shown in the content view. Empty when unset. */
    private String largeIcon;

    private long fireTimeEpochMilli;
    private long repeatIntervalMillis;

    private int styleCode;
    private int colorArgb;

    /** Badge count, -1 for none. */
    private int number;
    private boolean shouldAutoCancel;
    private boolean usesStopwatch;

    private String group;
    private boolean groupSummary;
    private int groupAlertBehaviourCode;

    /** Notifications of the same package are ordered lexicographically by this key. */
    private String sortKey;

    private String intentData;

    private boolean showTimestamp;
    private long customTimestampEpochMilli;
    private boolean showCustomTimestamp;

    /**
     * Creates a one-time notification with every optional field at its default.
     */
    public NotificationDescriptor(String title, String text, LocalDateTime fireTime) {
        this.title = title;
        this.text = text;

        this.smallIcon = Constants.EMPTY;
        this.largeIcon = Constants.EMPTY;
        this.fireTimeEpochMilli = Constants.Sentinels.UNSET_TIMESTAMP;
        this.repeatIntervalMillis = Constants.Sentinels.NO_REPEAT;
        this.styleCode = NotificationStyle.NONE.getCode();
        this.colorArgb = Constants.Sentinels.NO_COLOR;
        this.number = Constants.Sentinels.NO_NUMBER;
        this.shouldAutoCancel = false;
        this.usesStopwatch = false;
        this.group = Constants.EMPTY;
        this.groupSummary = false;
        this.groupAlertBehaviourCode = Constants.Sentinels.GROUP_ALERT_UNSET;
        this.sortKey = Constants.EMPTY;
        this.intentData = Constants.EMPTY;
        this.showTimestamp = false;
        this.customTimestampEpochMilli = Constants.Sentinels.UNSET_TIMESTAMP;
        this.showCustomTimestamp = false;

        setFireTime(fireTime);
    }

    /**
     * Creates a repeating notification. The platform does not repeat more often than once a minute.
     */
    public NotificationDescriptor(String title, String text, LocalDateTime fireTime, Duration repeatInterval) {
        this(title, text, fireTime);
        setRepeatInterval(repeatInterval);
    }

    public NotificationDescriptor(String title, String text, LocalDateTime fireTime, Duration repeatInterval,
                                  String smallIcon) {
        this(title, text, fireTime, repeatInterval);
        setSmallIcon(smallIcon);
    }

    public NotificationDescriptor(NotificationDescriptor other) {
        this.title = other.title;
        this.text = other.text;
        this.smallIcon = other.smallIcon;
        this.largeIcon = other.largeIcon;
        this.fireTimeEpochMilli = other.fireTimeEpochMilli;
        this.repeatIntervalMillis = other.repeatIntervalMillis;
        this.styleCode = other.styleCode;
        this.colorArgb = other.colorArgb;
        this.number = other.number;
        this.shouldAutoCancel = other.shouldAutoCancel;
        this.usesStopwatch = other.usesStopwatch;
        this.group = other.group;
        this.groupSummary = other.groupSummary;
        this.groupAlertBehaviourCode = other.groupAlertBehaviourCode;
        this.sortKey = other.sortKey;
        this.intentData = other.intentData;
        this.showTimestamp = other.showTimestamp;
        this.customTimestampEpochMilli = other.customTimestampEpochMilli;
        this.showCustomTimestamp = other.showCustomTimestamp;
    }

    /**
     * @return the delivery time in the system zone, or {@code null} if it was never set
     */
    public LocalDateTime getFireTime() {
        if (fireTimeEpochMilli == Constants.Sentinels.UNSET_TIMESTAMP) {
            return null;
        }
        return EpochTimeUtils.fromEpochMilli(fireTimeEpochMilli);
    }

    public void setFireTime(LocalDateTime fireTime) {
        this.fireTimeEpochMilli = fireTime == null
                ? Constants.Sentinels.UNSET_TIMESTAMP
                : EpochTimeUtils.toEpochMilli(fireTime);
    }

    /**
     * @return the repeat interval, or {@code null} for a one-time notification
     */
    public Duration getRepeatInterval() {
        if (repeatIntervalMillis == Constants.Sentinels.NO_REPEAT) {
            return null;
        }
        return Duration.ofMillis(repeatIntervalMillis);
    }

    /**
     * @param repeatInterval the interval, or {@code null} to deliver only once
     */
    public void setRepeatInterval(Duration repeatInterval) {
        this.repeatIntervalMillis = repeatInterval == null
                ? Constants.Sentinels.NO_REPEAT
                : EpochTimeUtils.toMillis(repeatInterval);
    }

    public boolean hasRepeat() {
        return repeatIntervalMillis != Constants.Sentinels.NO_REPEAT;
    }

    /**
     * @return the style, or {@code null} if the raw code belongs to no known style
     */
    public NotificationStyle getStyle() {
        return NotificationStyle.fromCode(styleCode);
    }

    /**
     * Stores the style's code. {@code null} leaves the raw code untouched, so writing back what
     * {@link #getStyle()} returned keeps an unknown code; use {@link NotificationStyle#NONE} to clear.
     */
    public void setStyle(NotificationStyle style) {
        if (style == null) {
            return;
        }
        this.styleCode = style.getCode();
    }

    /**
     * Accent color the standard templates paint behind the icon. The platform ignores alpha.
     *
     * @return the color, or {@code null} when none is set
     */
    public NotificationColor getColor() {
        if (colorArgb == Constants.Sentinels.NO_COLOR) {
            return null;
        }
        return NotificationColor.fromArgb(colorArgb);
    }

    /**
     * Stores the packed color. Fully transparent black packs to the "no color" value and reads back as {@code null}.
     */
    public void setColor(NotificationColor color) {
        this.colorArgb = color == null ? Constants.Sentinels.NO_COLOR : color.toArgb();
    }

    public boolean hasColor() {
        return colorArgb != Constants.Sentinels.NO_COLOR;
    }

    /**
     * @return the group alert behaviour, or {@code null} when unset and the platform default applies
     */
    public GroupAlertBehaviour getGroupAlertBehaviour() {
        return GroupAlertBehaviour.fromCode(groupAlertBehaviourCode);
    }

    public void setGroupAlertBehaviour(GroupAlertBehaviour behaviour) {
        this.groupAlertBehaviourCode = behaviour == null
                ? Constants.Sentinels.GROUP_ALERT_UNSET
                : behaviour.getCode();
    }

    /**
     * @return the time shown instead of the fire time, or {@code null} if none was set
     */
    public LocalDateTime getCustomTimestamp() {
        if (!showCustomTimestamp) {
            return null;
        }
        return EpochTimeUtils.fromEpochMilli(customTimestampEpochMilli);
    }

    /**
     * Sets the time displayed on the notification and marks it to be shown.
     * Passing {@code null} falls back to showing the fire time.
     */
    public void setCustomTimestamp(LocalDateTime customTimestamp) {
        if (customTimestamp == null) {
            this.showCustomTimestamp = false;
            this.customTimestampEpochMilli = Constants.Sentinels.UNSET_TIMESTAMP;
            return;
        }
        this.showCustomTimestamp = true;
        this.customTimestampEpochMilli = EpochTimeUtils.toEpochMilli(customTimestamp);
    }
}
