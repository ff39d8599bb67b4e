package com.worksrec.parser;

import java.util.List;

public class ParserDtos {
    public record SnapshotDoc(UserProfileDoc profile,
                              List<WorkDoc> works,
                              List<SimilarUserDoc> similarUsers,
                              ParamsDoc params,
                              MetricsDoc metrics,
                              FusionDoc fusion) {}

    public record TagDoc(String name, double value, int line) {}
    public record UserProfileDoc(List<TagDoc> tags, int line) {}
    public record WorkDoc(String id, List<TagDoc> tags, double viewCount, double interactionTime, int line) {}
    public record SimilarUserDoc(String id, double similarity, List<String> likedWorkIds, int line) {}
    public record ParamsDoc(int numRecommendations, double randomFactor, int line) {}
    public record MetricsDoc(boolean useMetrics, double weightViews, double weightTime, double weightTags, int line) {}
    public record FusionDoc(double contentWeight, double collabWeight, int line) {}

    public record ParseError(String code, String message, int line, String section, String entityId) {}
}
