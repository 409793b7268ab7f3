package com.example.honeypot.llm;

import com.example.honeypot.config.HoneypotProperties;
import com.example.honeypot.model.Message;
import com.example.honeypot.model.Sender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin bounded wrapper around the Spring AI {@link ChatClient}. Every call is capped by
 * {@code honeypot.llm.timeout}; failures come back as an empty result, never as an exception.
 */
@Component
public class LanguageModelClient {

    private static final Logger logger = LoggerFactory.getLogger(LanguageModelClient.class);

    private final ChatClient chatClient;
    private final ExecutorService modelExecutor;
    private final Duration timeout;

    public LanguageModelClient(ObjectProvider<ChatClient.Builder> chatClientBuilder,
                               @Qualifier("modelExecutor") ExecutorService modelExecutor,
                               HoneypotProperties properties) {
        ChatClient.Builder builder = properties.getLlm().isEnabled() ? chatClientBuilder.getIfAvailable() : null;
        this.chatClient = builder != null ? builder.build() : null;
        this.modelExecutor = modelExecutor;
        this.timeout = properties.getLlm().getTimeout();
        if (properties.getLlm().isEnabled() && chatClient == null) {
            logger.warn("honeypot.llm.enabled is set but no chat model is configured; model calls are disabled");
        }
    }

    public boolean isEnabled() {
        return chatClient != null;
    }

    public Optional<String> complete(String system, String user) {
        return complete(system, List.of(), user);
    }

    /**
     * @param history earlier messages, replayed as user / assistant turns before {@code user}
     */
    public Optional<String> complete(String system, List<Message> history, String user) {
        if (chatClient == null) {
            return Optional.empty();
        }
        List<org.springframework.ai.chat.messages.Message> conversation = new ArrayList<>();
        for (Message message : history) {
            if (message.getText() == null) continue;
            conversation.add(message.getSender() == Sender.AGENT
                    ? new AssistantMessage(message.getText())
                    : new UserMessage(message.getText()));
        }
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> chatClient.prompt()
                .system(system)
                .messages(conversation)
                .user(user)
                .call()
                .content(), modelExecutor);
        try {
            String content = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return content == null || content.isBlank() ? Optional.empty() : Optional.of(content.trim());
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Model call timed out after {}ms", timeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Model call failed: {}", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Model call interrupted");
        }
        return Optional.empty();
    }
}
