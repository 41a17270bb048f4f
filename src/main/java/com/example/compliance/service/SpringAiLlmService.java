package com.example.compliance.service;

import com.example.compliance.model.RetryPolicy;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * {@link LlmService} over Spring AI ChatClients. Claude models go to Anthropic, the rest to OpenAI.
 */
@Service
public class SpringAiLlmService implements LlmService {

    private final ChatClient openAiChatClient;
    private final ChatClient anthropicChatClient;

    public SpringAiLlmService(@Qualifier("openAiChatClient") ChatClient openAiChatClient,
                              @Qualifier("anthropicChatClient") ChatClient anthropicChatClient) {
        this.openAiChatClient = openAiChatClient;
        this.anthropicChatClient = anthropicChatClient;
    }

    @Override
    public <T> T complete(String systemPrompt, String userPrompt, String model, Class<T> responseType,
                          RetryPolicy retry) {
        return ResilientLlmCaller.callEntity(clientFor(model), systemPrompt, userPrompt, model,
                responseType, retry.maxRetries(), retry.backoff());
    }

    ChatClient clientFor(String model) {
        return model.toLowerCase(Locale.ROOT).contains("claude") ? anthropicChatClient : openAiChatClient;
    }
}
