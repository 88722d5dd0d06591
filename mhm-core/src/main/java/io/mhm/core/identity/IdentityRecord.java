package io.mhm.core.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityRecord(
    @JsonProperty("channel_type") String channelType,
    @JsonProperty("external_id") String externalId,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("linked_user_id") String linkedUserId,
    @JsonProperty("updated_at") Instant updatedAt
) {
    public boolean linked() {
        return linkedUserId != null && !linkedUserId.isBlank();
    }
}
