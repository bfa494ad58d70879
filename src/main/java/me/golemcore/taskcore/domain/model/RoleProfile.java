package me.golemcore.taskcore.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Named bundle of system instructions and an optional capability whitelist.
 *
 * <p>
 * A {@code null} whitelist means unrestricted; an empty whitelist allows no
 * capability at all. The builder stores an unmodifiable copy of the
 * whitelist.
 */
@Value
@Builder(toBuilder = true)
public class RoleProfile {

    String name;
    String displayName;
    String systemInstructions;
    Set<String> capabilityWhitelist;
    @Builder.Default
    int maxReplyTokens = 4096;

    public boolean isRestricted() {
        return capabilityWhitelist != null;
    }

    public boolean permits(String capabilityName) {
        return capabilityWhitelist == null || capabilityWhitelist.contains(capabilityName);
    }

    public String resolveDisplayName() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }

    public static class RoleProfileBuilder {

        private Set<String> capabilityWhitelist;

        public RoleProfileBuilder capabilityWhitelist(Set<String> capabilityWhitelist) {
            this.capabilityWhitelist = capabilityWhitelist != null
                    ? Collections.unmodifiableSet(new LinkedHashSet<>(capabilityWhitelist))
                    : null;
            return this;
        }
    }
}
