package com.worksrec;

import com.worksrec.parser.ParserDtos;
import com.worksrec.parser.SnapshotParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotParserTest {
    private final SnapshotParser parser = new SnapshotParser();

    private static final String SNAPSHOT = """
            USER_PROFILE
            2
            scifi 1.0
            drama 0.5
            WORKS
            2
            A
            1
            scifi 1.0
            10 5
            B 1 drama 1.0 0 0
            SIMILAR_USERS
            1
            u1
            0.8
            1
            B
            PARAMS
            5 0.2
            METRICS_CONFIG
            1 0.3 0.2 1.0
            """;

    @Test
    void readsAllSectionsRegardlessOfLineBreaks() {
        var result = parser.parse(SNAPSHOT);

        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        ParserDtos.SnapshotDoc doc = result.doc();
        assertEquals(2, doc.profile().tags().size());
        assertEquals("drama", doc.profile().tags().get(1).name());
        assertEquals(List.of("A", "B"), doc.works().stream().map(ParserDtos.WorkDoc::id).toList());
        assertEquals(10.0, doc.works().get(0).viewCount());
        assertEquals(5.0, doc.works().get(0).interactionTime());
        assertEquals(11, doc.works().get(1).line());
        assertEquals(List.of("B"), doc.similarUsers().get(0).likedWorkIds());
        assertEquals(0.8, doc.similarUsers().get(0).similarity());
        assertEquals(5, doc.params().numRecommendations());
        assertEquals(0.2, doc.params().randomFactor());
        assertTrue(doc.metrics().useMetrics());
        assertEquals(0.3, doc.metrics().weightViews());
        assertNull(doc.fusion());
    }

    @Test
    void acceptsSectionsInAnyOrderWithCommentsAndOptionalFusion() {
        String content = """
                # weights first
                FUSION
                0.7 0.3
                METRICS_CONFIG
                0 0 0 1
                PARAMS
                1 0
                SIMILAR_USERS
                0
                WORKS
                0
                USER_PROFILE
                0
                """;
        var result = parser.parse(content);

        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        assertEquals(0.7, result.doc().fusion().contentWeight());
        assertEquals(0.3, result.doc().fusion().collabWeight());
        assertTrue(result.doc().works().isEmpty());
        assertTrue(result.doc().profile().tags().isEmpty());
    }

    @Test
    void reportsEveryMissingRequiredSection() {
        var result = parser.parse("""
                USER_PROFILE
                0
                """);

        List<String> missing = result.errors().stream()
                .filter(e -> e.code().equals("MISSING_SECTION"))
                .map(ParserDtos.ParseError::section)
                .toList();
        assertEquals(List.of("WORKS", "SIMILAR_USERS", "PARAMS", "METRICS_CONFIG"), missing);
    }

    @Test
    void reportsInvalidNumbersWithLineAndEntity() {
        String content = SNAPSHOT.replace("10 5", "ten 5");
        var result = parser.parse(content);

        var error = result.errors().stream().filter(e -> e.code().equals("INVALID_NUMBER")).findFirst().orElseThrow();
        assertEquals(10, error.line());
        assertEquals("WORKS", error.section());
        assertEquals("A", error.entityId());
        assertTrue(result.doc().works().isEmpty());
    }

    @Test
    void reportsTruncatedSectionAndTrailingTokens() {
        String truncated = SNAPSHOT.replace("5 0.2", "5");
        assertTrue(parser.parse(truncated).errors().stream()
                .anyMatch(e -> e.code().equals("UNEXPECTED_END") && e.section().equals("PARAMS")));

        String trailing = SNAPSHOT.replace("5 0.2", "5 0.2 9");
        assertTrue(parser.parse(trailing).errors().stream()
                .anyMatch(e -> e.code().equals("TRAILING_TOKENS") && e.section().equals("PARAMS")));
    }

    @Test
    void rejectsNegativeCountsNonFiniteValuesAndStrayContent() {
        String content = "stray\n" + SNAPSHOT.replace("SIMILAR_USERS\n1", "SIMILAR_USERS\n-1").replace("0.2", "NaN");
        var codes = parser.parse(content).errors().stream().map(ParserDtos.ParseError::code).toList();

        assertTrue(codes.contains("UNEXPECTED_CONTENT"));
        assertTrue(codes.contains("INVALID_COUNT"));
        assertTrue(codes.contains("INVALID_NUMBER"));
    }

    @Test
    void hashPrefixedTokensInsideSectionsAreData() {
        String content = """
                # leading comment
                USER_PROFILE
                1
                #fluff 1.0
                WORKS
                1
                #1
                1
                #fluff 2.0
                3 4
                SIMILAR_USERS
                1 u1 0.5 1 #1
                PARAMS
                1 0
                METRICS_CONFIG
                0 0 0 1
                """;
        var result = parser.parse(content);

        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        assertEquals("#fluff", result.doc().profile().tags().get(0).name());
        assertEquals("#1", result.doc().works().get(0).id());
        assertEquals("#fluff", result.doc().works().get(0).tags().get(0).name());
        assertEquals(List.of("#1"), result.doc().similarUsers().get(0).likedWorkIds());
    }

    @Test
    void reportsDuplicateSection() {
        var result = parser.parse(SNAPSHOT + "PARAMS\n1 0\n");
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("DUPLICATE_SECTION")));
        assertEquals(5, result.doc().params().numRecommendations());
    }
}
