package com.example.contentops.flowguard.quality;

import com.example.contentops.flowguard.model.StageResult;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/** Everything business validation looks at for one session. */
@Builder(toBuilder = true)
public record QualityInput(
        String sessionId,
        String request,
        String serviceType,
        Map<String, Object> profile,
        String knowledgeText,
        String generatedText,
        List<StageResult> stageResults,
        long totalDurationMs
) {

    public QualityInput {
        request = request == null ? "" : request;
        knowledgeText = knowledgeText == null ? "" : knowledgeText;
        generatedText = generatedText == null ? "" : generatedText;
        profile = profile == null ? Map.of() : profile;
        stageResults = stageResults == null ? List.of() : List.copyOf(stageResults);
    }

    ScoringInput scoringInput() {
        return new ScoringInput(request, generatedText, knowledgeText, profile, serviceType);
    }
}
