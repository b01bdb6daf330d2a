package com.example.notification.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Raw form of a notification descriptor as the platform scheduler reads it.
 * Timestamps are epoch milliseconds, the color is packed ARGB and enums are integer codes; -1 means unset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload implements Serializable {
    private String title;
    private String text;
    private String smallIcon;
    private String largeIcon;
    private long fireTimeEpochMilli;
    private long repeatIntervalMillis; // -1 = no repeat
    private int styleCode; // 0 = none, 2 = big text
    private int colorArgb; // 0 = no color
    private int number;
    private boolean shouldAutoCancel;
    private boolean usesStopwatch;
    private String group;
    private boolean groupSummary;
    private int groupAlertBehaviourCode;
    private String sortKey;
    private String intentData;
    private boolean showTimestamp;
    private long customTimestampEpochMilli;
    private boolean showCustomTimestamp;
}
