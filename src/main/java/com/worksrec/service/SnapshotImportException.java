package com.worksrec.service;

import com.worksrec.parser.ParserDtos.ParseError;

import java.util.List;

public class SnapshotImportException extends RuntimeException {
    private final List<ParseError> errors;

    public SnapshotImportException(List<ParseError> errors) {
        super("Snapshot rejected with " + errors.size() + " error(s); first: " + (errors.isEmpty() ? "none" : describe(errors.get(0))));
        this.errors = List.copyOf(errors);
    }

    public List<ParseError> errors() {
        return errors;
    }

    private static String describe(ParseError error) {
        return error.code() + " at line " + error.line() + ": " + error.message();
    }
}
