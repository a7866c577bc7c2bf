package com.measure.compiler.generator;

import java.time.Instant;
import java.util.Objects;

/**
 * Reviewer note attached to a manual code override.
 */
public final class EditNote {
    private final Instant timestamp;
    private final String author;
    private final String content;
    private final String changeType;

    public EditNote(Instant timestamp, String author, String content, String changeType) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.author = author;
        this.content = Objects.requireNonNull(content, "content");
        this.changeType = changeType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getAuthor() {
        return author;
    }

    public String getContent() {
        return content;
    }

    public String getChangeType() {
        return changeType;
    }

    /**
     * Render as a single line comment in the target syntax.
     * @param format Target language
     * @return e.g. {@code // EDIT NOTE [timing] (2025-01-01T00:00:00Z): widened lookback}
     */
    public String toComment(CodeOutputFormat format) {
        StringBuilder sb = new StringBuilder(format.getLineComment()).append(" EDIT NOTE");
        if (changeType != null && !changeType.isBlank()) {
            sb.append(" [").append(changeType).append(']');
        }
        sb.append(" (").append(timestamp).append(')');
        if (author != null && !author.isBlank()) {
            sb.append(" by ").append(author);
        }
        sb.append(": ").append(content.replace('\n', ' '));
        return sb.toString();
    }
}
