////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.chunkfmt.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Parses formatter settings from the JSON object an LSP client sends in
 * {@code initializationOptions} or {@code workspace/didChangeConfiguration}.
 *
 * <p>Unknown keys are ignored. Values of the wrong shape are logged and the
 * corresponding option keeps the value of the base options.
 */
public final class FormatterOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(FormatterOptionsParser.class);

    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String ALIGN_SAME_FUNC_CALL_PARAMS = "alignSameFuncCallParams";
    static final String ALIGN_SAME_FUNC_CALL_PARAMS_SPAN = "alignSameFuncCallParamsSpan";
    static final String ALIGN_SAME_FUNC_CALL_PARAMS_THRESH = "alignSameFuncCallParamsThresh";
    static final String ALIGN_NUMBER_RIGHT = "alignNumberRight";
    static final String ALIGN_ON_TABSTOP = "alignOnTabstop";
    static final String MOD_FULL_PAREN_IF_BOOL = "modFullParenIfBool";
    static final String MOD_FULL_PAREN_ASSIGN_BOOL = "modFullParenAssignBool";
    static final String MOD_FULL_PAREN_RETURN_BOOL = "modFullParenReturnBool";
    static final String LANGUAGE = "language";
    static final String PAREN_EXCLUDED_LANGUAGES = "parenExcludedLanguages";
    static final String INPUT_TAB_SIZE = "inputTabSize";
    static final String INDENT_WITH_TABS = "indentWithTabs";

    /**
     * Parse options on top of the defaults.
     *
     * @param rawSettings usually a {@link JsonObject}; anything else yields
     *                    the defaults
     */
    public static FormatterOptions parse(Object rawSettings) {
        return parse(rawSettings, FormatterOptions.defaults());
    }

    /**
     * Parse options on top of {@code base}, so a partial settings object only
     * changes the keys it carries.
     */
    public static FormatterOptions parse(Object rawSettings, FormatterOptions base) {
        if (!(rawSettings instanceof JsonObject)) {
            return base;
        }
        JsonObject opts = (JsonObject) rawSettings;
        applyLogLevelOption(opts);

        FormatterOptions.Builder builder = base.toBuilder();
        Boolean flag;
        if ((flag = readBoolean(opts, ALIGN_SAME_FUNC_CALL_PARAMS)) != null) {
            builder.alignSameFuncCallParams(flag);
        }
        if ((flag = readBoolean(opts, ALIGN_NUMBER_RIGHT)) != null) {
            builder.alignNumberRight(flag);
        }
        if ((flag = readBoolean(opts, ALIGN_ON_TABSTOP)) != null) {
            builder.alignOnTabstop(flag);
        }
        if ((flag = readBoolean(opts, MOD_FULL_PAREN_IF_BOOL)) != null) {
            builder.modFullParenIfBool(flag);
        }
        if ((flag = readBoolean(opts, MOD_FULL_PAREN_ASSIGN_BOOL)) != null) {
            builder.modFullParenAssignBool(flag);
        }
        if ((flag = readBoolean(opts, MOD_FULL_PAREN_RETURN_BOOL)) != null) {
            builder.modFullParenReturnBool(flag);
        }
        if ((flag = readBoolean(opts, INDENT_WITH_TABS)) != null) {
            builder.indentWithTabs(flag);
        }

        Integer number;
        if ((number = readInt(opts, ALIGN_SAME_FUNC_CALL_PARAMS_SPAN)) != null) {
            builder.alignSameFuncCallParamsSpan(number);
        }
        if ((number = readInt(opts, ALIGN_SAME_FUNC_CALL_PARAMS_THRESH)) != null) {
            if (number < 0) {
                logger.warn("Ignoring negative {}: {}", ALIGN_SAME_FUNC_CALL_PARAMS_THRESH, number);
            } else {
                builder.alignSameFuncCallParamsThresh(number);
            }
        }
        if ((number = readInt(opts, INPUT_TAB_SIZE)) != null) {
            if (number <= 0) {
                logger.warn("Ignoring non-positive {}: {}", INPUT_TAB_SIZE, number);
            } else {
                builder.inputTabSize(number);
            }
        }

        parseLanguageOption(opts, builder);
        parseExcludedLanguagesOption(opts, builder);

        FormatterOptions result = builder.build();
        logger.debug("Parsed formatter options: {}", result);
        return result;
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logback is not the active SLF4J binding, ignoring log level '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private static void parseLanguageOption(JsonObject opts, FormatterOptions.Builder builder) {
        if (!opts.has(LANGUAGE)) {
            return;
        }
        JsonElement el = opts.get(LANGUAGE);
        Language lang = el.isJsonPrimitive() ? Language.fromName(el.getAsString()) : null;
        if (lang == null) {
            logger.warn("Unknown {} value {}, keeping current language", LANGUAGE, el);
            return;
        }
        builder.language(lang);
    }

    private static void parseExcludedLanguagesOption(JsonObject opts, FormatterOptions.Builder builder) {
        if (!opts.has(PAREN_EXCLUDED_LANGUAGES)) {
            return;
        }
        if (!opts.get(PAREN_EXCLUDED_LANGUAGES).isJsonArray()) {
            logger.warn("{} must be an array, ignoring {}", PAREN_EXCLUDED_LANGUAGES, opts.get(PAREN_EXCLUDED_LANGUAGES));
            return;
        }
        JsonArray arr = opts.getAsJsonArray(PAREN_EXCLUDED_LANGUAGES);
        Set<Language> excluded = EnumSet.noneOf(Language.class);
        for (JsonElement el : arr) {
            Language lang = el.isJsonPrimitive() ? Language.fromName(el.getAsString()) : null;
            if (lang == null) {
                logger.warn("Unknown language {} in {}", el, PAREN_EXCLUDED_LANGUAGES);
                continue;
            }
            excluded.add(lang);
        }
        builder.parenExcludedLanguages(excluded);
    }

    private static Boolean readBoolean(JsonObject opts, String key) {
        if (!opts.has(key)) {
            return null;
        }
        JsonElement el = opts.get(key);
        if (el.isJsonPrimitive() && el.getAsJsonPrimitive().isBoolean()) {
            return el.getAsBoolean();
        }
        logger.warn("Option {} expects a boolean, ignoring {}", key, el);
        return null;
    }

    private static Integer readInt(JsonObject opts, String key) {
        if (!opts.has(key)) {
            return null;
        }
        JsonElement el = opts.get(key);
        if (el.isJsonPrimitive() && el.getAsJsonPrimitive().isNumber()) {
            return el.getAsInt();
        }
        logger.warn("Option {} expects a number, ignoring {}", key, el);
        return null;
    }

    private FormatterOptionsParser() {
        // utility class
    }
}
