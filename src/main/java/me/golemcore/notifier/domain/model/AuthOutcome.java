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

/**
 * Result of checking a webhook signature against the configured secret.
 */
public enum AuthOutcome {

    /**
     * Signature present and matching.
     */
    ALLOWED_VERIFIED,

    /**
     * No secret configured and no signature sent. Accepted, but the caller
     * should warn.
     */
    ALLOWED_UNVERIFIED,

    /**
     * Signature missing while a secret is configured, or signature mismatch.
     */
    FORBIDDEN,

    /**
     * A signature arrived but there is no secret to check it against.
     */
    INTERNAL_ERROR
}
