package com.example.notification.shared.service;

import com.example.notification.shared.config.AppProperties;
import com.example.notification.shared.config.NotificationConfig;
import com.example.notification.shared.dto.NotificationPayload;
import com.example.notification.shared.exception.NotificationConfigurationException;
import com.example.notification.shared.mapper.NotificationPayloadMapper;
import com.example.notification.shared.model.NotificationColor;
import com.example.notification.shared.model.NotificationDescriptor;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationFactoryTest {

    private static final LocalDateTime FIRE_TIME = LocalDateTime.of(2031, 6, 15, 9, 45);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(NotificationConfig.class);

    @Test
    void withoutConfiguredDefaultsDescriptorsKeepTheirSentinels() {
        contextRunner.run(context -> {
            NotificationFactory factory = context.getBean(NotificationFactory.class);

            NotificationDescriptor descriptor = factory.create("Hi", "There", FIRE_TIME);

            assertThat(descriptor).isEqualTo(new NotificationDescriptor("Hi", "There", FIRE_TIME));
        });
    }

    @Test
    void configuredDefaultsFillUnsetFields() {
        contextRunner
                .withPropertyValues(
                        "notification.defaults.small-icon=ic_stat_default",
                        "notification.defaults.large-icon=ic_large_default",
                        "notification.defaults.color=#2196F3",
                        "notification.defaults.group=general",
                        "notification.defaults.auto-cancel=true",
                        "notification.defaults.show-timestamp=true")
                .run(context -> {
                    NotificationFactory factory = context.getBean(NotificationFactory.class);

                    NotificationDescriptor descriptor = factory.create("Hi", "There", FIRE_TIME);

                    assertThat(descriptor.getSmallIcon()).isEqualTo("ic_stat_default");
                    assertThat(descriptor.getLargeIcon()).isEqualTo("ic_large_default");
                    assertThat(descriptor.getColorArgb()).isEqualTo(0xFF2196F3);
                    assertThat(descriptor.getGroup()).isEqualTo("general");
                    assertThat(descriptor.isShouldAutoCancel()).isTrue();
                    assertThat(descriptor.isShowTimestamp()).isTrue();
                });
    }

    @Test
    void explicitValuesWinOverDefaults() {
        contextRunner
                .withPropertyValues(
                        "notification.defaults.small-icon=ic_stat_default",
                        "notification.defaults.color=#2196F3")
                .run(context -> {
                    NotificationFactory factory = context.getBean(NotificationFactory.class);
                    NotificationDescriptor descriptor = new NotificationDescriptor(
                            "Hi", "There", FIRE_TIME, Duration.ofMinutes(10), "ic_stat");
                    descriptor.setColor(NotificationColor.opaque(0xFF, 0, 0));

                    factory.applyDefaults(descriptor);

                    assertThat(descriptor.getSmallIcon()).isEqualTo("ic_stat");
                    assertThat(descriptor.getColorArgb()).isEqualTo(0xFFFF0000);
                });
    }

    @Test
    void repeatingFactoryMethodsMirrorConstructors() {
        contextRunner.run(context -> {
            NotificationFactory factory = context.getBean(NotificationFactory.class);

            NotificationDescriptor repeating =
                    factory.createRepeating("Hi", "There", FIRE_TIME, Duration.ofMinutes(30));
            NotificationDescriptor withIcon =
                    factory.createRepeating("Hi", "There", FIRE_TIME, Duration.ofMinutes(30), "ic_stat");

            assertThat(repeating.getRepeatInterval()).isEqualTo(Duration.ofMinutes(30));
            assertThat(withIcon.getSmallIcon()).isEqualTo("ic_stat");
        });
    }

    @Test
    void shortRepeatIntervalsAreFlaggedButKept() {
        contextRunner
                .withPropertyValues("notification.repeat.minimum-interval=5m")
                .run(context -> {
                    NotificationFactory factory = context.getBean(NotificationFactory.class);

                    NotificationDescriptor descriptor =
                            factory.createRepeating("Hi", "There", FIRE_TIME, Duration.ofMinutes(2));

                    assertThat(factory.isBelowMinimumRepeat(Duration.ofMinutes(2))).isTrue();
                    assertThat(factory.isBelowMinimumRepeat(Duration.ofMinutes(5))).isFalse();
                    assertThat(factory.isBelowMinimumRepeat(null)).isFalse();
                    assertThat(descriptor.getRepeatInterval()).isEqualTo(Duration.ofMinutes(2));
                });
    }

    @Test
    void payloadConversionGoesThroughMapper() {
        contextRunner.run(context -> {
            NotificationFactory factory = context.getBean(NotificationFactory.class);
            NotificationDescriptor descriptor = factory.createRepeating("Hi", "There", FIRE_TIME, Duration.ofHours(1));

            NotificationPayload payload = factory.toPayload(descriptor);

            assertThat(payload.getRepeatIntervalMillis()).isEqualTo(3_600_000L);
            assertThat(factory.fromPayload(payload)).isEqualTo(descriptor);
        });
    }

    @Test
    void malformedDefaultColorFailsStartup() {
        contextRunner
                .withPropertyValues("notification.defaults.color=blue")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void malformedDefaultColorIsReportedWithPropertyName() {
        AppProperties properties = new AppProperties();
        properties.getDefaults().setColor("#123");
        NotificationPayloadMapper mapper = Mappers.getMapper(NotificationPayloadMapper.class);

        assertThatThrownBy(() -> new NotificationFactory(properties, mapper))
                .isInstanceOf(NotificationConfigurationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .extracting("propertyName")
                .isEqualTo("notification.defaults.color");
    }
}
