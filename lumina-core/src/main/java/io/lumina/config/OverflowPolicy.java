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

/**
 * What {@code submit} does when a bounded dispatch queue is full. Irrelevant for the default
 * unbounded queue.
 *
 * @since 4.0.0
 */
public enum OverflowPolicy {

    /**
     * The submitting thread waits for free capacity.
     */
    BLOCK,

    /**
     * The message is discarded and a warning with the running drop count is logged.
     */
    DROP
}
