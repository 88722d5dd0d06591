package io.mhm.core.model;

public record ExternalUser(String externalId, String displayName, String channelType) {

    public ExternalUser {
        externalId = externalId == null ? "" : externalId.trim();
        displayName = displayName == null ? "" : displayName;
        channelType = channelType == null ? "" : channelType;
    }

    public boolean hasId() {
        return !externalId.isBlank();
    }
}
