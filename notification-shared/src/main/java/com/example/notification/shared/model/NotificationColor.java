package com.example.notification.shared.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * An accent color with one byte per channel. Packs into a single ARGB int, alpha in the top byte.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NotificationColor {
    int alpha;
    int red;
    int green;
    int blue;

    public static NotificationColor of(int alpha, int red, int green, int blue) {
        return new NotificationColor(alpha & 0xff, red & 0xff, green & 0xff, blue & 0xff);
    }

    public static NotificationColor opaque(int red, int green, int blue) {
        return of(0xff, red, green, blue);
    }

    public static NotificationColor fromArgb(int argb) {
        return of((argb >> 24) & 0xff, (argb >> 16) & 0xff, (argb >> 8) & 0xff, argb & 0xff);
    }

    /**
     * Parses {@code #RRGGBB} (opaque) or {@code #AARRGGBB}. The leading {@code #} is optional.
     *
     * @throws IllegalArgumentException if the value is not in one of those forms
     */
    public static NotificationColor parse(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Color must not be null");
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if ((digits.length() != 6 && digits.length() != 8) || !digits.matches("[0-9A-Fa-f]+")) {
            throw new IllegalArgumentException("Color must be #RRGGBB or #AARRGGBB but was '" + hex + "'");
        }
        int value = (int) Long.parseLong(digits, 16);
        return digits.length() == 6 ? fromArgb(0xff000000 | value) : fromArgb(value);
    }

    public int toArgb() {
        return (alpha & 0xff) << 24 | (red & 0xff) << 16 | (green & 0xff) << 8 | (blue & 0xff);
    }

    public String toHexString() {
        return String.format(Locale.ROOT, "#%08X", toArgb());
    }
}
