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

/// Asynchronous per-severity file logging.
///
/// ## Key Components
///
/// - {@link io.lumina.Lumina}: the engine; submit, synchronous write, shutdown
/// - {@link io.lumina.Message}: one immutable log entry
/// - {@link io.lumina.MessageBuilder}: assembles multi-line entries
///
/// The dispatch pipeline, rotation clock and shutdown coordinator are package-private parts of
/// the engine.
///
/// ## Usage Example
///
/// ```java
/// Lumina lumina = new Lumina(LuminaConfig.builder().withName("ServiceA").build());
/// lumina.info("Listening on", port);
/// lumina.shutdown(Duration.ofSeconds(5));
/// ```
package io.lumina;
