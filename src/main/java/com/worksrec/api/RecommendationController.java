package com.worksrec.api;

import com.worksrec.output.RecommendationJsonWriter;
import com.worksrec.output.RecommendationJsonWriter.RecommendationEntry;
import com.worksrec.recommendation.RecommendationModels;
import com.worksrec.recommendation.SamplingPolicy;
import com.worksrec.service.SnapshotImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private final SnapshotImportService importService;

    public RecommendationController(SnapshotImportService importService) {
        this.importService = importService;
    }

    @PostMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestBody SnapshotRequest request) {
        RecommendationModels.RecommendationResult result = importService.recommend(request.content(), request.seed());
        return ResponseEntity.ok(new RecommendationResponse(
                RecommendationJsonWriter.toDocument(result.recommendations()).recommendations(),
                result.contentCandidates(),
                result.collaborativeCandidates(),
                result.fusedCandidates(),
                result.samplingPolicy(),
                result.seed()));
    }

    @PostMapping("/validate")
    public ResponseEntity<SnapshotImportService.ImportResult> validate(@RequestBody SnapshotRequest request) {
        return ResponseEntity.ok(importService.importSnapshot(request.content()));
    }

    public record SnapshotRequest(String content, Long seed) {}

    public record RecommendationResponse(List<RecommendationEntry> recommendations,
                                         int contentCandidates,
                                         int collaborativeCandidates,
                                         int fusedCandidates,
                                         SamplingPolicy samplingPolicy,
                                         Long seed) {}
}
