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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits outbound text to fit a channel's payload limit.
 */
public final class MessageChunker {

    private MessageChunker() {
    }

    /**
     * Split at the last newline within the limit, else at the last space, else
     * hard at the limit. The newline or space used as a boundary is dropped. A
     * hard split never separates a surrogate pair.
     */
    public static List<String> split(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (!remaining.isEmpty()) {
            if (remaining.length() <= maxLength) {
                chunks.add(remaining);
                break;
            }

            int splitAt = remaining.lastIndexOf('\n', maxLength);
            if (splitAt <= 0) {
                splitAt = remaining.lastIndexOf(' ', maxLength);
            }
            boolean boundary = splitAt > 0;
            if (!boundary) {
                splitAt = maxLength;
                if (splitAt > 1 && Character.isHighSurrogate(remaining.charAt(splitAt - 1))) {
                    splitAt--;
                }
            }

            chunks.add(remaining.substring(0, splitAt));
            remaining = remaining.substring(boundary ? splitAt + 1 : splitAt);
        }
        return chunks;
    }
}
