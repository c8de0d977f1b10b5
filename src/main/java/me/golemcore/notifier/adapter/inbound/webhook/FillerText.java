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

package me.golemcore.notifier.adapter.inbound.webhook;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Non-informative response bodies for rejected requests. Error details stay in
 * the log.
 */
final class FillerText {

    static final List<String> PHRASES = List.of(
            "The kettle is on, but nobody is home.",
            "A golem stares back at you, unmoved.",
            "Nothing to see here, move along.",
            "The clay has not dried yet.",
            "Somewhere a bell rang. It was not for you.",
            "Try whispering instead.",
            "The scroll you brought is blank on both sides.",
            "Patience is a virtue. So is reading the manual.");

    private FillerText() {
    }

    static String random() {
        return PHRASES.get(ThreadLocalRandom.current().nextInt(PHRASES.size()));
    }
}
