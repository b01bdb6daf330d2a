package com.example.notification.shared.config;

import com.example.notification.shared.util.Constants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    public static final String HEX_COLOR_PATTERN = "^$|^#?([0-9A-Fa-f]{6}|[0-9A-Fa-f]{8})$";

    @Valid
    private final Defaults defaults = new Defaults();
    @Valid
    private final Repeat repeat = new Repeat();

    /**
     * Values applied by the notification factory to fields the caller left unset.
     */
    @Data
    public static class Defaults {
        @NotNull
        private String smallIcon = "";
        @NotNull
        private String largeIcon = "";
        @NotNull
        @Pattern(regexp = HEX_COLOR_PATTERN, message = "must be #RRGGBB or #AARRGGBB")
        private String color = "";
        private boolean autoCancel = false;
        private boolean showTimestamp = false;
        @NotNull
        private String group = "";
    }

    @Data
    public static class Repeat {
        @NotNull
        private Duration minimumInterval = Constants.MINIMUM_REPEAT_INTERVAL;
    }
}
