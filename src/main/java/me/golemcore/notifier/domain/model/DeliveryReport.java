/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.notifier.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of delivering one rendered notification to every channel.
 *
 * @param delivered
 *            channels that received every line
 * @param failed
 *            channels that did not, mapped to the error description
 */
public record DeliveryReport(List<String> delivered, Map<String, String> failed) {

    public DeliveryReport {
        delivered = List.copyOf(delivered);
        failed = Map.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty() && !delivered.isEmpty();
    }

    /**
     * No channel was addressed at all, e.g. none are configured.
     */
    public boolean isEmpty() {
        return failed.isEmpty() && delivered.isEmpty();
    }

    public boolean isPartial() {
        return !failed.isEmpty() && !delivered.isEmpty();
    }
}
