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

package me.golemcore.relay.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime map from alternate identity formats to canonical chat
 * identities. Filled by channels when they connect; lookups of unknown aliases
 * return the input unchanged.
 */
@Component
@Slf4j
public class AliasTable {

    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    public void register(String alias, String canonical) {
        if (alias == null || canonical == null || alias.equals(canonical)) {
            return;
        }
        aliases.put(alias, canonical);
        log.debug("[Alias] {} -> {}", alias, canonical);
    }

    public String resolve(String identity) {
        if (identity == null) {
            return null;
        }
        return aliases.getOrDefault(identity, identity);
    }

    public int size() {
        return aliases.size();
    }
}
