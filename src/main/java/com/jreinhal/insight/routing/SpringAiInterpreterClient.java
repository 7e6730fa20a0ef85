package com.jreinhal.insight.routing;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

@Component
public class SpringAiInterpreterClient
implements InterpreterClient {
    private static final Logger log = LoggerFactory.getLogger(SpringAiInterpreterClient.class);
    private static final List<String> TRANSIENT_MARKERS = List.of(
            "429", "resource_exhausted", "rate limit", "too many requests", "quota",
            "503", "unavailable", "deadline", "timeout", "timed out", "connection reset");

    private final ChatClient chatClient;
    @Value(value="${insight.router.max-output-tokens:300}")
    private int maxOutputTokens = 300;

    public SpringAiInterpreterClient(ChatClient.Builder chatClientBuilder) {
        this.chatClient = chatClientBuilder.build();
    }

    @Override
    public String propose(InterpreterRequest request) {
        ChatOptions options = ChatOptions.builder().temperature(0.0).maxTokens(this.maxOutputTokens).build();
        try {
            String content = this.chatClient.prompt()
                    .system(request.systemPrompt())
                    .user(request.userPayload())
                    .options(options)
                    .call()
                    .content();
            return content == null ? "" : content;
        }
        catch (TransientAiException e) {
            throw new InterpreterTransientException("Interpreter temporarily unavailable: " + e.getMessage(), e);
        }
        catch (NonTransientAiException e) {
            if (isTransientMessage(e.getMessage())) {
                throw new InterpreterTransientException("Interpreter rate limited: " + e.getMessage(), e);
            }
            throw new InterpreterException("Interpreter rejected request: " + e.getMessage(), e);
        }
        catch (ResourceAccessException e) {
            throw new InterpreterTransientException("Interpreter unreachable: " + e.getMessage(), e);
        }
        catch (RuntimeException e) {
            if (e.getCause() instanceof IOException || isTransientMessage(e.getMessage())) {
                throw new InterpreterTransientException("Interpreter call failed: " + e.getMessage(), e);
            }
            log.debug("Non-transient interpreter failure: {}", e.getClass().getSimpleName());
            throw new InterpreterException("Interpreter call failed: " + e.getMessage(), e);
        }
    }

    public static boolean isTransientMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : TRANSIENT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
