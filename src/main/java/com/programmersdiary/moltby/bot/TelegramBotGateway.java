package com.programmersdiary.moltby.bot;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single active Telegram bot. Attaching a bot with a different token
 * replaces the previous one atomically.
 */
@Component
public class TelegramBotGateway implements TransportGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotGateway.class);

    public enum AttachResult {
        STARTED,
        ALREADY_RUNNING
    }

    private final RestClient.Builder restClientBuilder;
    private final String apiUrl;
    private final String configuredToken;
    private final String welcomeMessage;
    private final Clock clock;
    private final AtomicReference<ActiveBot> activeBot = new AtomicReference<>();

    public TelegramBotGateway(RestClient.Builder restClientBuilder,
                              Clock clock,
                              @Value("${moltby.telegram.api-url:https://api.telegram.org}") String apiUrl,
                              @Value("${moltby.telegram.token:}") String configuredToken,
                              @Value("${moltby.telegram.welcome-message:Moltby Agent connected successfully! I am now online.}")
                              String welcomeMessage) {
        this.restClientBuilder = restClientBuilder;
        this.clock = clock;
        this.apiUrl = apiUrl;
        this.configuredToken = configuredToken;
        this.welcomeMessage = welcomeMessage;
    }

    @PostConstruct
    void attachConfiguredBot() {
        if (configuredToken == null || configuredToken.isBlank()) {
            return;
        }
        try {
            attach(configuredToken, null);
        } catch (TransportException e) {
            log.error("Could not start configured Telegram bot: {}", e.getMessage());
        }
    }

    public synchronized AttachResult attach(String token, String chatId) throws TransportException {
        var current = activeBot.get();
        if (current != null && current.token().equals(token)) {
            return AttachResult.ALREADY_RUNNING;
        }
        var client = newClient(token);
        var me = client.getMe();
        var previous = activeBot.getAndSet(new ActiveBot(token, client, me.username(), clock.instant()));
        if (previous != null) {
            log.info("Replaced Telegram bot @{} with @{}", previous.username(), me.username());
        } else {
            log.info("Telegram bot @{} started", me.username());
        }

        if (chatId != null && !chatId.isBlank()) {
            try {
                client.sendMessage(chatId, welcomeMessage);
            } catch (TransportException e) {
                log.error("Failed to send welcome message to chat {}: {}", chatId, e.getMessage());
            }
        }
        return AttachResult.STARTED;
    }

    public boolean detach() {
        var previous = activeBot.getAndSet(null);
        if (previous == null) {
            return false;
        }
        log.info("Telegram bot @{} stopped", previous.username());
        return true;
    }

    public BotStatus status() {
        var bot = activeBot.get();
        if (bot == null) {
            return BotStatus.stopped();
        }
        var uptime = Duration.between(bot.startTime(), clock.instant()).toSeconds();
        return new BotStatus("running", bot.username(), bot.startTime(), uptime);
    }

    public TelegramClient.BotUser validateToken(String token) throws TransportException {
        return newClient(token).getMe();
    }

    public TelegramClient.ChatInfo validateChat(String token, String chatId) throws TransportException {
        return newClient(token).getChat(chatId);
    }

    @Override
    public boolean isAttached() {
        return activeBot.get() != null;
    }

    @Override
    public void sendMessage(String target, String text) throws TransportException {
        var bot = activeBot.get();
        if (bot == null) {
            throw new TransportException("Bot is not active");
        }
        bot.client().sendMessage(target, text);
    }

    private TelegramClient newClient(String token) {
        return new TelegramClient(restClientBuilder.clone().baseUrl(apiUrl).build(), token);
    }

    private record ActiveBot(String token, TelegramClient client, String username, Instant startTime) {
    }
}
