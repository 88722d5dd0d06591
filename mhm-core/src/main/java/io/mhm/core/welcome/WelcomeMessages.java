package io.mhm.core.welcome;

public final class WelcomeMessages {

    private WelcomeMessages() {
    }

    public static String forAuthorization(String displayName) {
        return "**Welcome to MHM" + greetingSuffix(displayName) + "!**\n\n"
            + "Thanks for connecting MHM to your Discord account. "
            + "I can help you keep track of tasks, check-ins and reminders right here in your DMs.\n\n"
            + "To get started, create a new MHM account or link the one you already have using the buttons below.\n\n"
            + "Type `/help` at any time to see what I can do.";
    }

    private static String greetingSuffix(String displayName) {
        return displayName == null || displayName.isBlank() ? "" : ", " + displayName.trim();
    }
}
