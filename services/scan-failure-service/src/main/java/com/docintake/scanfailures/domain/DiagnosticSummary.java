package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DiagnosticSummary(
    @JsonProperty("path_length") int pathLength,
    @JsonProperty("directory_depth") int directoryDepth,
    @JsonProperty("estimated_item_count") Integer estimatedItemCount,
    @JsonProperty("response_time_ms") Integer responseTimeMs,
    @JsonProperty("response_size_mb") Double responseSizeMb,
    @JsonProperty("server_type") String serverType,
    @JsonProperty("recommended_action") String recommendedAction,
    @JsonProperty("can_retry") boolean canRetry,
    @JsonProperty("user_action_required") boolean userActionRequired
) {
}
