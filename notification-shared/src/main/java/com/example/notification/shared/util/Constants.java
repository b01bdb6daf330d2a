package com.example.notification.shared.util;

import java.time.Duration;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String EMPTY = "";

    /**
     * Sentinel values stored in the raw fields of a notification descriptor.
     * The platform layer reads these encodings directly, so they must not change.
     */
    public static final class Sentinels {
        private Sentinels() {}
        public static final long UNSET_TIMESTAMP = -1L;
        public static final long NO_REPEAT = -1L;
        public static final int NO_COLOR = 0;
        public static final int NO_NUMBER = -1;
        public static final int GROUP_ALERT_UNSET = -1;
    }

    public static final class StyleCodes {
        private StyleCodes() {}
        public static final int NONE = 0;
        // Reserved for BigPicture, which needs extra image loading before it can be supported
        public static final int BIG_PICTURE_RESERVED = 1;
        public static final int BIG_TEXT = 2;
    }

    public static final Duration MINIMUM_REPEAT_INTERVAL = Duration.ofMinutes(1);
}
