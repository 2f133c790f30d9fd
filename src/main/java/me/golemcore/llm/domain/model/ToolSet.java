package me.golemcore.llm.domain.model;

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

import me.golemcore.llm.domain.component.ToolApprovalCheck;
import me.golemcore.llm.domain.component.ToolComponent;
import me.golemcore.llm.domain.component.ToolHandler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of tools for one loop: definitions in registration order, handlers
 * and per-tool approval checks keyed by tool name.
 */
public final class ToolSet {

    private final List<ToolDefinition> definitions;
    private final Map<String, ToolHandler> handlers;
    private final Map<String, ToolApprovalCheck> approvalChecks;

    private ToolSet(List<ToolDefinition> definitions, Map<String, ToolHandler> handlers,
            Map<String, ToolApprovalCheck> approvalChecks) {
        this.definitions = Collections.unmodifiableList(definitions);
        this.handlers = Collections.unmodifiableMap(handlers);
        this.approvalChecks = Collections.unmodifiableMap(approvalChecks);
    }

    public static ToolSet of(Collection<? extends ToolComponent> components) {
        Builder builder = builder();
        for (ToolComponent component : components) {
            builder.component(component);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ToolDefinition> getDefinitions() {
        return definitions;
    }

    public Map<String, ToolHandler> getHandlers() {
        return handlers;
    }

    public Map<String, ToolApprovalCheck> getApprovalChecks() {
        return approvalChecks;
    }

    public static final class Builder {

        private final Map<String, ToolDefinition> definitions = new LinkedHashMap<>();
        private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();
        private final Map<String, ToolApprovalCheck> approvalChecks = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder tool(ToolDefinition definition, ToolHandler handler) {
            return tool(definition, handler, null);
        }

        public Builder tool(ToolDefinition definition, ToolHandler handler, ToolApprovalCheck approvalCheck) {
            String name = definition.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Tool definition must have a name");
            }
            if (definitions.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate tool: " + name);
            }
            definitions.put(name, definition);
            handlers.put(name, handler);
            if (approvalCheck != null) {
                approvalChecks.put(name, approvalCheck);
            }
            return this;
        }

        public Builder component(ToolComponent component) {
            return tool(component.getDefinition(), component, component.getApprovalCheck());
        }

        public ToolSet build() {
            return new ToolSet(new ArrayList<>(definitions.values()), new LinkedHashMap<>(handlers),
                    new LinkedHashMap<>(approvalChecks));
        }
    }
}
