package com.worksrec.recommendation;

import com.worksrec.domain.DomainModels.Tag;
import com.worksrec.domain.DomainModels.UserProfile;
import com.worksrec.domain.DomainModels.Work;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class TagSimilarity {

    public double similarity(UserProfile user, Work work) {
        Map<String, Double> userValues = new HashMap<>();
        for (Tag tag : user.tags()) {
            userValues.put(tag.name(), tag.value());
        }

        double dot = 0.0;
        for (Tag tag : work.tags()) {
            Double userValue = userValues.get(tag.name());
            if (userValue != null) {
                dot += userValue * tag.value();
            }
        }

        double normUser = norm(user.tags());
        double normWork = norm(work.tags());
        if (normUser == 0 || normWork == 0) return 0.0;
        return dot / (normUser * normWork);
    }

    private double norm(List<Tag> tags) {
        double sum = 0.0;
        for (Tag tag : tags) {
            sum += tag.value() * tag.value();
        }
        return Math.sqrt(sum);
    }
}
