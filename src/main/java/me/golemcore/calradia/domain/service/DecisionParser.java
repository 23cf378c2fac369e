package me.golemcore.calradia.domain.service;

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

import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.AgentDecision;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-text reasoning output into an {@link AgentDecision}.
 *
 * <p>
 * Recognized line grammar (case-insensitive, leading whitespace allowed):
 *
 * <pre>
 * THOUGHT: text   | DUSUNCE: text
 * ACTION: type    | AKSIYON: type
 * DETAIL: text    | DETAY: text
 * </pre>
 *
 * The first line of each kind wins; later duplicates are ignored. The action
 * type is cut at the first comma or whitespace, so {@code "ACTION: Attack,
 * then retreat"} yields {@code Attack}. A missing or blank action falls back to
 * {@code Wait} with a default duration.
 *
 * @since 1.0
 */
@Component
public class DecisionParser {

    public static final String WAIT_ACTION = "Wait";
    public static final int DEFAULT_WAIT_SECONDS = 60;

    private static final Pattern LINE_PATTERN = Pattern.compile(
            "^\\s*(THOUGHT|DUSUNCE|ACTION|AKSIYON|DETAIL|DETAY)\\s*:(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern ACTION_TYPE_END = Pattern.compile("[,\\s]");

    private enum Field {
        THOUGHT, ACTION, DETAIL
    }

    public AgentDecision parse(String agentId, String rawText) {
        String text = rawText == null ? "" : rawText;
        Map<Field, String> fields = readFields(text);

        String actionType = normalizeActionType(fields.get(Field.ACTION));
        AgentAction action;
        if (actionType.isEmpty() || WAIT_ACTION.equalsIgnoreCase(actionType)) {
            action = AgentAction.of(WAIT_ACTION, Map.of(AgentAction.PARAM_DURATION, DEFAULT_WAIT_SECONDS));
        } else {
            String detail = fields.get(Field.DETAIL);
            action = detail != null && !detail.isEmpty()
                    ? AgentAction.of(actionType, Map.of(AgentAction.PARAM_DETAIL, detail))
                    : AgentAction.of(actionType);
        }
        return new AgentDecision(agentId, text, List.of(action));
    }

    /**
     * Short human-readable summary of a reasoning text: the THOUGHT line when
     * present, otherwise the beginning of the text. Results longer than
     * {@code maxLength} are cut and end with "...".
     */
    public String extractThought(String rawText, int maxLength) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }
        String thought = readFields(rawText).get(Field.THOUGHT);
        if (thought == null || thought.isEmpty()) {
            thought = rawText.strip().replaceAll("\\s+", " ");
        }
        if (thought.length() <= maxLength) {
            return thought;
        }
        return thought.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    private Map<Field, String> readFields(String text) {
        Map<Field, String> fields = new EnumMap<>(Field.class);
        Matcher matcher = LINE_PATTERN.matcher(text);
        while (matcher.find()) {
            Field field = toField(matcher.group(1));
            fields.putIfAbsent(field, matcher.group(2).strip());
        }
        return fields;
    }

    private static Field toField(String prefix) {
        switch (prefix.toUpperCase(Locale.ROOT)) {
        case "THOUGHT":
        case "DUSUNCE":
            return Field.THOUGHT;
        case "ACTION":
        case "AKSIYON":
            return Field.ACTION;
        default:
            return Field.DETAIL;
        }
    }

    static String normalizeActionType(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.strip();
        Matcher end = ACTION_TYPE_END.matcher(trimmed);
        return end.find() ? trimmed.substring(0, end.start()) : trimmed;
    }
}
