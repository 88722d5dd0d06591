package io.mhm.core.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mhm.core.dispatch.BotHandle;
import io.mhm.core.dispatch.EventLoop;
import io.mhm.core.dispatch.RecipientUnreachableException;
import io.mhm.core.dispatch.UserHandle;
import io.mhm.core.welcome.WelcomeView;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Minimal Discord REST client covering what a welcome DM needs: look up the user, open a DM
 * channel and post one message with buttons. Responses complete on OkHttp threads; callers
 * hop back to the event loop themselves.
 */
public final class DiscordRestBotHandle implements BotHandle {
    public static final String DEFAULT_API_BASE = "https://discord.com/api/v10";
    static final int CANNOT_SEND_MESSAGES_TO_USER = 50007;
    private static final MediaType JSON = MediaType.get("application/json");
    private static final int ACTION_ROW = 1;
    private static final int BUTTON = 2;
    private static final int BUTTON_STYLE_PRIMARY = 1;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiBase;
    private final String botToken;
    private final EventLoop loop;

    public DiscordRestBotHandle(OkHttpClient client, ObjectMapper mapper, String apiBase, String botToken, EventLoop loop) {
        this.client = client;
        this.mapper = mapper;
        this.apiBase = apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase.replaceAll("/+$", "");
        this.botToken = botToken;
        this.loop = loop;
    }

    @Override
    public EventLoop eventLoop() {
        return loop;
    }

    @Override
    public CompletionStage<UserHandle> fetchUser(String externalId) {
        Request request = newRequest("/users/" + externalId).get().build();
        return call(request).thenApply(user -> new DiscordUser(
            user.path("id").asText(externalId),
            user.path("username").asText("")
        ));
    }

    private CompletableFuture<JsonNode> call(Request request) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    ResponseBody body = response.body();
                    String raw = body == null ? "" : body.string();
                    JsonNode payload = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
                    if (response.isSuccessful()) {
                        result.complete(payload);
                    } else {
                        result.completeExceptionally(toError(response.code(), payload));
                    }
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    private RuntimeException toError(int status, JsonNode payload) {
        int code = payload.path("code").asInt(0);
        String message = payload.path("message").asText("");
        if (code == CANNOT_SEND_MESSAGES_TO_USER) {
            return new RecipientUnreachableException("Cannot send messages to this user (" + code + ")");
        }
        return new DiscordApiException(status, code, message);
    }

    private Request.Builder newRequest(String path) {
        HttpUrl url = HttpUrl.parse(apiBase + path);
        if (url == null) {
            throw new IllegalArgumentException("Invalid Discord API URL: " + apiBase + path);
        }
        return new Request.Builder()
            .url(url)
            .header("Authorization", "Bot " + botToken)
            .header("User-Agent", "DiscordBot (https://github.com/mhm, 0.1)");
    }

    private RequestBody jsonBody(Map<String, Object> body) {
        try {
            return RequestBody.create(mapper.writeValueAsString(body), JSON);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize Discord request", e);
        }
    }

    private List<Map<String, Object>> components(WelcomeView view) {
        if (view == null || view.buttons().isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> buttons = new ArrayList<>();
        for (WelcomeView.Button button : view.buttons()) {
            buttons.add(Map.of(
                "type", BUTTON,
                "style", BUTTON_STYLE_PRIMARY,
                "label", button.label(),
                "custom_id", button.customId()
            ));
        }
        return List.of(Map.of("type", ACTION_ROW, "components", buttons));
    }

    private final class DiscordUser implements UserHandle {
        private final String id;
        private final String username;

        private DiscordUser(String id, String username) {
            this.id = id;
            this.username = username;
        }

        @Override
        public String externalId() {
            return id;
        }

        @Override
        public CompletionStage<Void> send(String text, WelcomeView view) {
            Request openDm = newRequest("/users/@me/channels")
                .post(jsonBody(Map.of("recipient_id", id)))
                .build();
            return call(openDm).thenCompose(channel -> {
                String channelId = channel.path("id").asText("");
                if (channelId.isBlank()) {
                    throw new DiscordApiException(200, 0, "DM channel for " + username + " has no id");
                }
                Map<String, Object> message = new LinkedHashMap<>();
                message.put("content", text);
                List<Map<String, Object>> components = components(view);
                if (!components.isEmpty()) {
                    message.put("components", components);
                }
                Request post = newRequest("/channels/" + channelId + "/messages")
                    .post(jsonBody(message))
                    .build();
                return call(post);
            }).thenApply(ignored -> null);
        }
    }
}
