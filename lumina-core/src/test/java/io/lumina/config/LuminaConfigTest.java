/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.lumina.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LuminaConfigTest {

    @Test
    public void defaultsMatchDocumentedLayout() {
        LuminaConfig config = LuminaConfig.defaults();
        Instant instant = Instant.parse("2026-10-19T23:59:59.999Z");

        assertThat(config.getName()).isEqualTo("Lumina");
        assertThat(config.periodKey(instant)).isEqualTo("19.10.2026");
        assertThat(config.formatTime(instant)).isEqualTo("23:59:59.999");
        assertThat(config.fileFor("19.10.2026", "info")).isEqualTo(Path.of("logs", "19.10.2026", "info.log"));
        assertThat(config.getRotation()).isEqualTo(RotationPolicy.DEFAULT);
        assertThat(config.getQueueCapacity()).isEqualTo(LuminaConfig.UNBOUNDED);
        assertThat(config.getOverflowPolicy()).isEqualTo(OverflowPolicy.BLOCK);
        assertThat(config.getExecutor()).isEmpty();
        assertThat(config.getSinkCache()).isEmpty();
    }

    @Test
    public void periodKeyFollowsConfiguredZone() {
        LuminaConfig berlin = LuminaConfig.builder().withZone(ZoneId.of("Europe/Berlin")).build();
        assertThat(berlin.periodKey(Instant.parse("2026-10-19T23:30:00Z"))).isEqualTo("20.10.2026");
    }

    @Test
    public void parsePeriodKeyReturnsStartOfDay() {
        LuminaConfig config = LuminaConfig.defaults();
        assertThat(config.parsePeriodKey("19.10.2026")).isEqualTo(Instant.parse("2026-10-19T00:00:00Z"));
        assertThatThrownBy(() -> config.parsePeriodKey("not-a-date")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    public void blankNameIsRejected() {
        assertThatThrownBy(() -> LuminaConfig.builder().withName("  ").build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
    }

    @Test
    public void nonPositiveQueueCapacityIsRejected() {
        assertThatThrownBy(() -> LuminaConfig.builder().withQueueCapacity(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LuminaConfig.builder().withQueueCapacity(-5).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void nonPositiveRotationDurationsAreRejected() {
        assertThatThrownBy(() -> LuminaConfig.builder().withRotation(true, Duration.ZERO, Duration.ofDays(1)).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LuminaConfig.builder().withRotation(true, Duration.ofDays(1), Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void sweepIntervalIsNotCheckedWhenRotationIsDisabled() {
        LuminaConfig config = LuminaConfig.builder().withRotation(false, Duration.ofDays(1), Duration.ZERO).build();
        assertThat(config.getRotation().enabled()).isFalse();
    }

    @Test
    public void nullCollaboratorsAreRejected() {
        assertThatThrownBy(() -> LuminaConfig.builder().withFileSystem(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> LuminaConfig.builder().withClock(null)).isInstanceOf(NullPointerException.class);
    }
}
