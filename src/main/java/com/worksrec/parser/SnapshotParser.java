package com.worksrec.parser;

import org.springframework.stereotype.Component;

import java.util.*;

import static com.worksrec.parser.ParserDtos.*;

/**
 * Reads the section-tagged snapshot format. A section starts at a line holding only its name;
 * inside a section line breaks are not significant and content is read as whitespace-separated
 * tokens. Problems are collected as {@link ParseError}s instead of being thrown.
 */
@Component
public class SnapshotParser {
    public static final String USER_PROFILE = "USER_PROFILE";
    public static final String WORKS = "WORKS";
    public static final String SIMILAR_USERS = "SIMILAR_USERS";
    public static final String PARAMS = "PARAMS";
    public static final String METRICS_CONFIG = "METRICS_CONFIG";
    public static final String FUSION = "FUSION";

    private static final List<String> REQUIRED_SECTIONS = List.of(USER_PROFILE, WORKS, SIMILAR_USERS, PARAMS, METRICS_CONFIG);
    private static final Set<String> KNOWN_SECTIONS = Set.of(USER_PROFILE, WORKS, SIMILAR_USERS, PARAMS, METRICS_CONFIG, FUSION);

    public ParseResult parse(String content) {
        List<ParseError> errors = new ArrayList<>();
        Map<String, Section> sections = new LinkedHashMap<>();
        List<String> lines = Arrays.asList(content.split("\\R", -1));

        Section current = null;
        for (int i = 0; i < lines.size(); i++) {
            int lineNo = i + 1;
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty()) continue;
            // tag names and ids may start with '#', so comments are only allowed before the first section
            if (current == null && trimmed.startsWith("#")) continue;

            if (KNOWN_SECTIONS.contains(trimmed)) {
                if (sections.containsKey(trimmed)) {
                    errors.add(new ParseError("DUPLICATE_SECTION", "Section " + trimmed + " appears more than once", lineNo, trimmed, null));
                    current = new Section(trimmed, lineNo);
                } else {
                    current = new Section(trimmed, lineNo);
                    sections.put(trimmed, current);
                }
                continue;
            }

            if (current == null) {
                errors.add(new ParseError("UNEXPECTED_CONTENT", "Content before the first section: " + trimmed, lineNo, null, null));
                continue;
            }
            for (String token : trimmed.split("\\s+")) {
                current.tokens.add(new Token(token, lineNo));
            }
        }

        for (String name : REQUIRED_SECTIONS) {
            if (!sections.containsKey(name)) {
                errors.add(new ParseError("MISSING_SECTION", "Section " + name + " is required", 1, name, null));
            }
        }

        UserProfileDoc profile = read(sections.get(USER_PROFILE), errors, this::readProfile);
        List<WorkDoc> works = read(sections.get(WORKS), errors, this::readWorks);
        List<SimilarUserDoc> similarUsers = read(sections.get(SIMILAR_USERS), errors, this::readSimilarUsers);
        ParamsDoc params = read(sections.get(PARAMS), errors, this::readParams);
        MetricsDoc metrics = read(sections.get(METRICS_CONFIG), errors, this::readMetrics);
        FusionDoc fusion = read(sections.get(FUSION), errors, this::readFusion);

        SnapshotDoc doc = new SnapshotDoc(profile,
                works == null ? List.of() : works,
                similarUsers == null ? List.of() : similarUsers,
                params, metrics, fusion);
        return new ParseResult(doc, errors);
    }

    private <T> T read(Section section, List<ParseError> errors, SectionReader<T> reader) {
        if (section == null) return null;
        Cursor cursor = new Cursor(section);
        try {
            T value = reader.read(cursor);
            if (cursor.hasNext()) {
                Token extra = cursor.peek();
                errors.add(new ParseError("TRAILING_TOKENS", "Unexpected token '" + extra.text() + "' at the end of " + section.name,
                        extra.line(), section.name, null));
            }
            return value;
        } catch (SectionException e) {
            errors.add(e.error);
            return null;
        }
    }

    private UserProfileDoc readProfile(Cursor cursor) {
        return new UserProfileDoc(readTags(cursor, null), cursor.section.headerLine);
    }

    private List<WorkDoc> readWorks(Cursor cursor) {
        int count = cursor.nextCount("work count", null);
        List<WorkDoc> works = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Token idToken = cursor.next("work id", null);
            String id = idToken.text();
            List<TagDoc> tags = readTags(cursor, id);
            double views = cursor.nextDouble("view count", id);
            double time = cursor.nextDouble("interaction time", id);
            works.add(new WorkDoc(id, tags, views, time, idToken.line()));
        }
        return works;
    }

    private List<SimilarUserDoc> readSimilarUsers(Cursor cursor) {
        int count = cursor.nextCount("similar user count", null);
        List<SimilarUserDoc> users = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Token idToken = cursor.next("similar user id", null);
            String id = idToken.text();
            double similarity = cursor.nextDouble("similarity", id);
            int liked = cursor.nextCount("liked work count", id);
            List<String> likedIds = new ArrayList<>();
            for (int j = 0; j < liked; j++) {
                likedIds.add(cursor.next("liked work id", id).text());
            }
            users.add(new SimilarUserDoc(id, similarity, likedIds, idToken.line()));
        }
        return users;
    }

    private ParamsDoc readParams(Cursor cursor) {
        int numRecommendations = cursor.nextInt("number of recommendations", null);
        double randomFactor = cursor.nextDouble("random factor", null);
        return new ParamsDoc(numRecommendations, randomFactor, cursor.section.headerLine);
    }

    private MetricsDoc readMetrics(Cursor cursor) {
        boolean useMetrics = cursor.nextInt("use metrics flag", null) != 0;
        double weightViews = cursor.nextDouble("views weight", null);
        double weightTime = cursor.nextDouble("time weight", null);
        double weightTags = cursor.nextDouble("tags weight", null);
        return new MetricsDoc(useMetrics, weightViews, weightTime, weightTags, cursor.section.headerLine);
    }

    private FusionDoc readFusion(Cursor cursor) {
        double contentWeight = cursor.nextDouble("content weight", null);
        double collabWeight = cursor.nextDouble("collaborative weight", null);
        return new FusionDoc(contentWeight, collabWeight, cursor.section.headerLine);
    }

    private List<TagDoc> readTags(Cursor cursor, String owner) {
        int count = cursor.nextCount("tag count", owner);
        List<TagDoc> tags = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Token name = cursor.next("tag name", owner);
            double value = cursor.nextDouble("tag value", owner);
            tags.add(new TagDoc(name.text(), value, name.line()));
        }
        return tags;
    }

    public record ParseResult(SnapshotDoc doc, List<ParseError> errors) {}

    private record Token(String text, int line) {}

    @FunctionalInterface
    private interface SectionReader<T> {
        T read(Cursor cursor);
    }

    private static final class Section {
        private final String name;
        private final int headerLine;
        private final List<Token> tokens = new ArrayList<>();

        private Section(String name, int headerLine) {
            this.name = name;
            this.headerLine = headerLine;
        }
    }

    private static final class Cursor {
        private final Section section;
        private int position;

        private Cursor(Section section) {
            this.section = section;
        }

        boolean hasNext() {
            return position < section.tokens.size();
        }

        Token peek() {
            return section.tokens.get(position);
        }

        Token next(String what, String entityId) {
            if (!hasNext()) {
                int line = section.tokens.isEmpty() ? section.headerLine : section.tokens.get(section.tokens.size() - 1).line();
                throw new SectionException(new ParseError("UNEXPECTED_END",
                        section.name + " ended while reading " + what, line, section.name, entityId));
            }
            return section.tokens.get(position++);
        }

        int nextInt(String what, String entityId) {
            Token token = next(what, entityId);
            try {
                return Integer.parseInt(token.text());
            } catch (NumberFormatException e) {
                throw new SectionException(new ParseError("INVALID_NUMBER",
                        what + " must be an integer, got '" + token.text() + "'", token.line(), section.name, entityId));
            }
        }

        int nextCount(String what, String entityId) {
            int value = nextInt(what, entityId);
            if (value < 0) {
                throw new SectionException(new ParseError("INVALID_COUNT",
                        what + " must not be negative, got " + value, section.tokens.get(position - 1).line(), section.name, entityId));
            }
            return value;
        }

        double nextDouble(String what, String entityId) {
            Token token = next(what, entityId);
            double value;
            try {
                value = Double.parseDouble(token.text());
            } catch (NumberFormatException e) {
                value = Double.NaN;
            }
            if (!Double.isFinite(value)) {
                throw new SectionException(new ParseError("INVALID_NUMBER",
                        what + " must be a finite number, got '" + token.text() + "'", token.line(), section.name, entityId));
            }
            return value;
        }
    }

    private static final class SectionException extends RuntimeException {
        private final ParseError error;

        private SectionException(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
