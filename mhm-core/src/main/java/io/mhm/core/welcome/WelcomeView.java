package io.mhm.core.welcome;

import java.util.List;

public record WelcomeView(String externalId, List<Button> buttons) {
    public static final String CREATE_ACCOUNT_PREFIX = "welcome_create_account:";
    public static final String LINK_ACCOUNT_PREFIX = "welcome_link_account:";

    public WelcomeView {
        buttons = List.copyOf(buttons);
    }

    public static WelcomeView accountChoices(String externalId) {
        return new WelcomeView(externalId, List.of(
            new Button("Create a New Account", CREATE_ACCOUNT_PREFIX + externalId),
            new Button("Link Existing Account", LINK_ACCOUNT_PREFIX + externalId)
        ));
    }

    public record Button(String label, String customId) {
    }
}
