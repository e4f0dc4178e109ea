package com.aigw.gateway.dto.gemini;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import lombok.Data;

import java.util.List;

/**
 * Vertex AI generateContent 响应，流式时每一帧也是同样的结构
 */
@Data
public class GenerateContentResponse {

    public static final String FINISH_STOP = "STOP";
    public static final String FINISH_MAX_TOKENS = "MAX_TOKENS";

    private List<Candidate> candidates;
    private UsageMetadata usageMetadata;
    private String modelVersion;
    private String responseId;
    private JSONObject promptFeedback;

    @Data
    public static class Candidate {
        private Integer index;
        private Content content;
        private String finishReason;
        private JSONArray safetyRatings;
        private LogprobsResult logprobsResult;
    }

    @Data
    public static class UsageMetadata {
        private int promptTokenCount;
        private int candidatesTokenCount;
        private int totalTokenCount;
        private int cachedContentTokenCount;
        private int thoughtsTokenCount;
    }

    @Data
    public static class LogprobsResult {
        private List<LogprobsCandidate> chosenCandidates;
        private List<TopCandidates> topCandidates;
    }

    @Data
    public static class LogprobsCandidate {
        private String token;
        private Integer tokenId;
        private float logProbability;
    }

    @Data
    public static class TopCandidates {
        private List<LogprobsCandidate> candidates;
    }
}
