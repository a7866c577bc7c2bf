package com.measure.compiler.extraction;

import java.util.Objects;

public final class OracleMessage {
    private final String role;
    private final String content;

    public OracleMessage(String role, String content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static OracleMessage user(String content) {
        return new OracleMessage("user", content);
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return role + ": " + (content.length() > 60 ? content.substring(0, 60) + "..." : content);
    }
}
