package me.relaygate.gateway.infrastructure.i18n;

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

import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized texts for command replies and task notifications.
 *
 * <p>
 * Bundles are loaded from {@code messages_<lang>.properties}; English is the
 * fallback. Parameters use {@link MessageFormat} syntax, so a literal
 * apostrophe in a parameterized message is written as {@code ''}. A key that
 * is missing everywhere resolves to the key itself.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private volatile String language = DEFAULT_LANG;

    public MessageService(GatewayProperties properties) {
        for (String lang : SUPPORTED_LANGUAGES) {
            loadBundle(lang);
        }
        setLanguage(properties.getLanguage());
    }

    private void loadBundle(String lang) {
        try {
            bundles.put(lang, ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang)));
            log.debug("[I18n] Loaded message bundle: {}", lang);
        } catch (MissingResourceException e) {
            log.warn("[I18n] Failed to load message bundle: {}", lang);
        }
    }

    /**
     * Message in the configured language.
     */
    public String getMessage(String key, Object... args) {
        return getMessage(key, language, args);
    }

    /**
     * Message in {@code lang}, falling back to English for unknown languages
     * and missing keys.
     */
    public String getMessage(String key, String lang, Object... args) {
        String pattern = lookup(bundles.get(lang), key);
        if (pattern == null && !DEFAULT_LANG.equals(lang)) {
            pattern = lookup(bundles.get(DEFAULT_LANG), key);
        }
        if (pattern == null) {
            log.warn("[I18n] Missing message key: {} for language: {}", key, lang);
            return key;
        }
        if (args != null && args.length > 0) {
            return MessageFormat.format(pattern, args);
        }
        return pattern;
    }

    public String getLanguage() {
        return language;
    }

    /**
     * Switches the reply language; unsupported values select English.
     */
    public void setLanguage(String lang) {
        if (lang != null && SUPPORTED_LANGUAGES.contains(lang)) {
            language = lang;
        } else {
            log.warn("[I18n] Unsupported language: {}, using {}", lang, DEFAULT_LANG);
            language = DEFAULT_LANG;
        }
    }

    private static String lookup(ResourceBundle bundle, String key) {
        if (bundle == null || !bundle.containsKey(key)) {
            return null;
        }
        return bundle.getString(key);
    }
}
