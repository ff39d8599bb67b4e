package com.worksrec.domain;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class DomainModels {
    public record Tag(String name, double value) {
        public Tag {
            Objects.requireNonNull(name, "tag name");
        }
    }

    public record UserProfile(List<Tag> tags) {
        public UserProfile {
            tags = List.copyOf(tags);
            requireUniqueNames(tags, "user profile");
        }
    }

    public record Work(String id, List<Tag> tags, double viewCount, double interactionTime) {
        public Work {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("work id required");
            tags = List.copyOf(tags);
            requireUniqueNames(tags, "work " + id);
        }
    }

    public record SimilarUser(String id, double similarity, List<String> likedWorkIds) {
        public SimilarUser {
            Objects.requireNonNull(id, "similar user id");
            likedWorkIds = List.copyOf(likedWorkIds);
        }
    }

    public record MetricsConfig(boolean useMetrics, double weightViews, double weightTime, double weightTags) {
        public static final MetricsConfig TAGS_ONLY = new MetricsConfig(false, 0.0, 0.0, 1.0);
    }

    public record ScoredItem(String workId, double score) {
        public ScoredItem {
            Objects.requireNonNull(workId, "work id");
            // -0.0 becomes 0.0 so numerically equal scores compare as ties
            score = score + 0.0;
        }
    }

    public record RecommendationParams(int numRecommendations, double randomFactor) {}

    public record FusionWeights(double contentWeight, double collabWeight) {
        public static final FusionWeights DEFAULT = new FusionWeights(0.5, 0.5);
    }

    // weights is null when the input did not set them.
    public record Snapshot(UserProfile profile,
                           List<Work> catalog,
                           List<SimilarUser> similarUsers,
                           RecommendationParams params,
                           MetricsConfig metrics,
                           FusionWeights weights) {
        public Snapshot {
            Objects.requireNonNull(profile, "profile");
            catalog = List.copyOf(catalog);
            similarUsers = List.copyOf(similarUsers);
            Objects.requireNonNull(params, "params");
            Objects.requireNonNull(metrics, "metrics");
        }
    }

    private static void requireUniqueNames(List<Tag> tags, String owner) {
        Set<String> seen = new HashSet<>();
        for (Tag tag : tags) {
            if (!seen.add(tag.name())) {
                throw new IllegalArgumentException("Duplicate tag '" + tag.name() + "' in " + owner);
            }
        }
    }
}
