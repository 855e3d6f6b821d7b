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

import java.util.Locale;

/**
 * Chat identity scheme. Socket identities are platform addresses as-is; the
 * other channels prefix their native ids.
 */
public final class ChatIdentities {

    public static final String SOCKET = "socket";
    public static final String TELEGRAM = "telegram";
    public static final String EMAIL = "email";

    private static final String TELEGRAM_PREFIX = TELEGRAM + ":";
    private static final String EMAIL_PREFIX = EMAIL + ":";

    private ChatIdentities() {
    }

    public static String telegram(String chatId) {
        return TELEGRAM_PREFIX + chatId;
    }

    public static String email(String address) {
        return EMAIL_PREFIX + address.toLowerCase(Locale.ROOT);
    }

    /**
     * Channel type that owns {@code chatIdentity}.
     */
    public static String channelOf(String chatIdentity) {
        if (chatIdentity.startsWith(TELEGRAM_PREFIX)) {
            return TELEGRAM;
        }
        if (chatIdentity.startsWith(EMAIL_PREFIX)) {
            return EMAIL;
        }
        return SOCKET;
    }

    /**
     * Platform-native id with the channel prefix removed.
     */
    public static String nativeId(String chatIdentity) {
        if (chatIdentity.startsWith(TELEGRAM_PREFIX)) {
            return chatIdentity.substring(TELEGRAM_PREFIX.length());
        }
        if (chatIdentity.startsWith(EMAIL_PREFIX)) {
            return chatIdentity.substring(EMAIL_PREFIX.length());
        }
        return chatIdentity;
    }
}
