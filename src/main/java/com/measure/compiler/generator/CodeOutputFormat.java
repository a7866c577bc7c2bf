package com.measure.compiler.generator;

public enum CodeOutputFormat {
    CQL("//"),
    SQL("--");

    private final String lineComment;

    CodeOutputFormat(String lineComment) {
        this.lineComment = lineComment;
    }

    public String getLineComment() {
        return lineComment;
    }
}
