package com.programmersdiary.moltby.web;

import com.programmersdiary.moltby.bot.BotStatus;
import com.programmersdiary.moltby.bot.TelegramBotGateway;
import com.programmersdiary.moltby.bot.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/bot")
public class BotController {

    private static final Logger log = LoggerFactory.getLogger(BotController.class);

    private final TelegramBotGateway gateway;

    public BotController(TelegramBotGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/status")
    public BotStatus status() {
        return gateway.status();
    }

    @PostMapping("/start")
    public Map<String, String> start(@RequestBody StartBotRequest request) {
        if (isBlank(request.token())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Token is required");
        }
        try {
            return switch (gateway.attach(request.token(), request.chatId())) {
                case ALREADY_RUNNING -> Map.of("status", "running", "message", "Bot is already running");
                case STARTED -> Map.of("status", "started", "message", "Bot started successfully");
            };
        } catch (TransportException e) {
            log.error("Error starting bot: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Failed to start bot", e);
        }
    }

    @PostMapping("/stop")
    public Map<String, String> stop() {
        if (gateway.detach()) {
            return Map.of("status", "stopped", "message", "Bot stopped successfully");
        }
        return Map.of("status", "stopped", "message", "No bot was running");
    }

    @PostMapping("/validate-token")
    public TokenValidation validateToken(@RequestBody ValidateTokenRequest request) {
        if (isBlank(request.token())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Token is required");
        }
        try {
            var me = gateway.validateToken(request.token());
            return new TokenValidation(true, me.username(), me.id());
        } catch (TransportException e) {
            log.error("Token validation failed: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid token or network error", e);
        }
    }

    @PostMapping("/validate-chatid")
    public ChatValidation validateChatId(@RequestBody ValidateChatRequest request) {
        if (isBlank(request.token()) || isBlank(request.chatId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Token and Chat ID are required");
        }
        try {
            var chat = gateway.validateChat(request.token(), request.chatId());
            return new ChatValidation(true, chat.type(), chat.title());
        } catch (TransportException e) {
            log.error("Chat ID validation failed: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Invalid Chat ID or bot hasn't started conversation with this user.", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record StartBotRequest(String token, String chatId) {
    }

    public record ValidateTokenRequest(String token) {
    }

    public record ValidateChatRequest(String token, String chatId) {
    }

    public record TokenValidation(boolean valid, String username, long id) {
    }

    public record ChatValidation(boolean valid, String type, String title) {
    }
}
