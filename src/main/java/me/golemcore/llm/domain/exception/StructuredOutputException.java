package me.golemcore.llm.domain.exception;

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

import java.util.List;

/**
 * Parsed JSON did not satisfy the output schema. Lists every violation found,
 * each prefixed with its JSON path.
 */
public class StructuredOutputException extends LlmException {

    private static final long serialVersionUID = 1L;

    private final String schemaName;
    private final List<String> violations;
    private final String rawText;

    public StructuredOutputException(String schemaName, List<String> violations, String rawText) {
        super("Structured output does not match schema " + schemaName + ": " + String.join("; ", violations));
        this.schemaName = schemaName;
        this.violations = List.copyOf(violations);
        this.rawText = rawText;
    }

    public StructuredOutputException(String schemaName, String message, String rawText, Throwable cause) {
        super(message, cause);
        this.schemaName = schemaName;
        this.violations = List.of(message);
        this.rawText = rawText;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public List<String> getViolations() {
        return violations;
    }

    public String getRawText() {
        return rawText;
    }
}
