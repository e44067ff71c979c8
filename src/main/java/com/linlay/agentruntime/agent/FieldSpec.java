package com.linlay.agentruntime.agent;

import org.springframework.util.StringUtils;

/**
 * One declared input field of an agent type.
 */
public record FieldSpec(
        String name,
        String type,
        boolean required
) {

    public FieldSpec {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        name = name.trim();
        type = StringUtils.hasText(type) ? type.trim() : "str";
    }

    public static FieldSpec required(String name, String type) {
        return new FieldSpec(name, type, true);
    }

    public static FieldSpec optional(String name, String type) {
        return new FieldSpec(name, type, false);
    }

    String signature() {
        return name + ":" + type + ":" + (required ? "True" : "False");
    }
}
