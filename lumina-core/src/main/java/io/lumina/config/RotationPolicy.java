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

import java.time.Duration;
import java.util.Objects;

/// Retention settings for the rotation clock.
///
/// @param enabled
///     whether old period directories are swept at all
/// @param retention
///     directories whose period started before {@code now - retention} are deleted
/// @param sweepInterval
///     the delay between two sweeps
public record RotationPolicy(boolean enabled, Duration retention, Duration sweepInterval) {

    public static final RotationPolicy DEFAULT = new RotationPolicy(true, Duration.ofDays(30), Duration.ofDays(1));

    public RotationPolicy {
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
    }

    /// @return a policy that never deletes anything
    public static RotationPolicy disabled() {
        return new RotationPolicy(false, DEFAULT.retention, DEFAULT.sweepInterval);
    }
}
