package com.programmersdiary.moltby.bot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * Minimal Telegram Bot API client bound to a single bot token.
 */
public class TelegramClient {

    private static final ParameterizedTypeReference<ApiResponse<BotUser>> USER_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiResponse<ChatInfo>> CHAT_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiResponse<SentMessage>> MESSAGE_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final String token;

    public TelegramClient(RestClient restClient, String token) {
        this.restClient = restClient;
        this.token = token;
    }

    public BotUser getMe() throws TransportException {
        return call("getMe", Map.of(), USER_RESPONSE);
    }

    public ChatInfo getChat(String chatId) throws TransportException {
        return call("getChat", Map.of("chat_id", chatId), CHAT_RESPONSE);
    }

    public SentMessage sendMessage(String chatId, String text) throws TransportException {
        return call("sendMessage", Map.of("chat_id", chatId, "text", text), MESSAGE_RESPONSE);
    }

    private <T> T call(String method, Map<String, ?> body,
                       ParameterizedTypeReference<ApiResponse<T>> type) throws TransportException {
        ApiResponse<T> response;
        try {
            response = restClient.post()
                    .uri("/bot" + token + "/" + method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(type);
        } catch (RestClientResponseException e) {
            throw new TransportException("Telegram " + method + " failed with HTTP "
                    + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new TransportException("Telegram " + method + " failed: " + e.getMessage(), e);
        }
        if (response == null || !response.ok() || response.result() == null) {
            var description = response != null ? response.description() : "empty response";
            throw new TransportException("Telegram " + method + " rejected: " + description);
        }
        return response.result();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiResponse<T>(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("result") T result,
            @JsonProperty("description") String description,
            @JsonProperty("error_code") Integer errorCode) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BotUser(
            @JsonProperty("id") long id,
            @JsonProperty("is_bot") boolean isBot,
            @JsonProperty("first_name") String firstName,
            @JsonProperty("username") String username) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatInfo(
            @JsonProperty("id") long id,
            @JsonProperty("type") String type,
            @JsonProperty("title") String title) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SentMessage(
            @JsonProperty("message_id") long messageId,
            @JsonProperty("date") long date) {}
}
