package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.ScoredItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Picks the final recommendations from a fused ranking: a guaranteed top slice plus a random share,
 * shuffled together. The caller owns the {@link Random}; instances must not be shared between
 * concurrent calls.
 */
@Component
public class DiversitySampler {

    public List<ScoredItem> sample(List<ScoredItem> fused, int count, double randomFactor, Random random) {
        return sample(fused, count, randomFactor, SamplingPolicy.TOP_SLICE, random);
    }

    public List<ScoredItem> sample(List<ScoredItem> fused, int count, double randomFactor,
                                   SamplingPolicy policy, Random random) {
        if (count <= 0) return List.of();

        int numRandom = randomShare(count, randomFactor);
        int numTop = count - numRandom;
        int topEnd = Math.min(numTop, fused.size());

        List<ScoredItem> result = new ArrayList<>(fused.subList(0, topEnd));

        List<ScoredItem> pool = policy == SamplingPolicy.TAIL
                ? new ArrayList<>(fused.subList(topEnd, fused.size()))
                : new ArrayList<>(fused.subList(0, topEnd));
        Collections.shuffle(pool, random);
        result.addAll(pool.subList(0, Math.min(numRandom, pool.size())));

        Collections.shuffle(result, random);
        return result;
    }

    // floor(count * factor), kept within [0, count] so the output never exceeds count.
    static int randomShare(int count, double randomFactor) {
        double raw = Math.floor(count * randomFactor);
        if (Double.isNaN(raw) || raw <= 0) return 0;
        return (int) Math.min(count, raw);
    }
}
