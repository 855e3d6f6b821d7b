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

package me.golemcore.relay.adapter.outbound.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves configured directory strings into absolute paths.
 */
public final class PathSupport {

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    private PathSupport() {
    }

    public static Path resolveHome(String configured) {
        String expanded = configured.replace(USER_HOME_PLACEHOLDER, System.getProperty("user.home"));
        return Paths.get(expanded).toAbsolutePath().normalize();
    }

    /**
     * Resolve {@code name} under {@code base}, refusing anything that escapes
     * it.
     */
    public static Path resolveWithin(Path base, String... names) {
        Path resolved = base;
        for (String name : names) {
            resolved = resolved.resolve(name);
        }
        resolved = resolved.normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Path traversal blocked: " + String.join("/", names));
        }
        return resolved;
    }
}
