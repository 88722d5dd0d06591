package io.mhm.core.welcome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WelcomeRecord(
    @JsonProperty("welcomed_at") String welcomedAt,
    @JsonProperty("welcomed_at_iso") String welcomedAtIso,
    @JsonProperty("channel_type") String channelType,
    @JsonProperty("welcomed") boolean welcomed
) {
}
