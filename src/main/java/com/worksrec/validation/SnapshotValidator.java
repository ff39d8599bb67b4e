package com.worksrec.validation;

import com.worksrec.parser.ParserDtos.ParseError;
import com.worksrec.parser.ParserDtos.SnapshotDoc;
import com.worksrec.parser.ParserDtos.TagDoc;
import com.worksrec.parser.ParserDtos.WorkDoc;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class SnapshotValidator {
    // Weights are not range-checked and liked ids need not be in the catalog.
    public List<ParseError> validate(SnapshotDoc doc) {
        List<ParseError> errors = new ArrayList<>();

        duplicate(doc.works().stream().map(w -> new Row(w.id(), w.line(), "WORKS")).toList(), "DUPLICATE_WORK", "work", errors);
        duplicate(doc.similarUsers().stream().map(u -> new Row(u.id(), u.line(), "SIMILAR_USERS")).toList(), "DUPLICATE_SIMILAR_USER", "similar user", errors);

        if (doc.profile() != null) {
            duplicateTags(doc.profile().tags(), "USER_PROFILE", null, errors);
        }
        for (WorkDoc work : doc.works()) {
            duplicateTags(work.tags(), "WORKS", work.id(), errors);
            if (work.viewCount() < 0) {
                errors.add(new ParseError("NEGATIVE_METRIC", "View count must not be negative: " + work.id(), work.line(), "WORKS", work.id()));
            }
            if (work.interactionTime() < 0) {
                errors.add(new ParseError("NEGATIVE_METRIC", "Interaction time must not be negative: " + work.id(), work.line(), "WORKS", work.id()));
            }
        }
        return errors;
    }

    private void duplicateTags(List<TagDoc> tags, String section, String owner, List<ParseError> errors) {
        Set<String> seen = new HashSet<>();
        for (TagDoc tag : tags) {
            if (!seen.add(tag.name())) {
                String where = owner == null ? "user profile" : "work " + owner;
                errors.add(new ParseError("DUPLICATE_TAG", "Duplicate tag '" + tag.name() + "' in " + where, tag.line(), section, owner));
            }
        }
    }

    private void duplicate(List<Row> rows, String code, String label, List<ParseError> errors) {
        Map<String, Long> counts = rows.stream().collect(Collectors.groupingBy(Row::id, Collectors.counting()));
        rows.forEach(r -> {
            if (counts.getOrDefault(r.id(), 0L) > 1) {
                errors.add(new ParseError(code, "Duplicate " + label + " id: " + r.id(), r.line(), r.section(), r.id()));
            }
        });
    }

    private record Row(String id, int line, String section) {}
}
