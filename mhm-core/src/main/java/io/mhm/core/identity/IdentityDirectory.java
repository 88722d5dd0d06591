package io.mhm.core.identity;

import io.mhm.core.model.ExternalUser;
import java.io.IOException;
import java.util.Optional;

/**
 * Identity bookkeeping for external chat users, kept apart from notification dispatch.
 */
public interface IdentityDirectory {
    /**
     * The MHM account the external id is linked to, if any.
     */
    Optional<String> linkedUserId(String channelType, String externalId);

    void recordDisplayName(ExternalUser user) throws IOException;
}
