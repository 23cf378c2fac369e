package me.golemcore.calradia.domain.model;

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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single action decided by an agent: a type tag (e.g. "Attack", "Wait") plus
 * free-form parameters. Instances are immutable; use
 * {@link #withParameterIfAbsent(String, Object)} to derive an enriched copy.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AgentAction {

    public static final String PARAM_AGENT_ID = "agentId";
    public static final String PARAM_DETAIL = "detail";
    public static final String PARAM_DURATION = "duration";

    private final String type;
    private final Map<String, Object> parameters;

    public AgentAction(String type, Map<String, Object> parameters) {
        this.type = Objects.requireNonNull(type, "type");
        this.parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static AgentAction of(String type) {
        return new AgentAction(type, Map.of());
    }

    public static AgentAction of(String type, Map<String, Object> parameters) {
        return new AgentAction(type, parameters);
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    public AgentAction withParameterIfAbsent(String name, Object value) {
        if (parameters.containsKey(name)) {
            return this;
        }
        Map<String, Object> enriched = new LinkedHashMap<>(parameters);
        enriched.put(name, value);
        return new AgentAction(type, enriched);
    }
}
