package com.purchasingpower.concierge.client;

import com.purchasingpower.concierge.exception.GenerativeServiceException;
import com.purchasingpower.concierge.model.CallContext;
import com.purchasingpower.concierge.model.ServiceType;
import com.purchasingpower.concierge.util.ExternalCallLogger;
import com.purchasingpower.concierge.workflow.state.ChatMessage;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GenerativeTextService} backed by a langchain4j chat model.
 */
@Slf4j
public class LangChain4jTextService implements GenerativeTextService {

    private final ChatLanguageModel model;
    private final String tier;

    public LangChain4jTextService(ChatLanguageModel model, String tier) {
        this.model = model;
        this.tier = tier;
    }

    @Override
    public String generate(String systemPrompt, List<ChatMessage> messages, String caller) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.LLM, caller + " (" + tier + ")", log);
        call.logRequest(ExternalCallLogger.truncate(systemPrompt, 200),
                "messages", messages != null ? messages.size() : 0);

        List<dev.langchain4j.data.message.ChatMessage> chat = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            chat.add(SystemMessage.from(systemPrompt));
        }
        if (messages != null) {
            for (ChatMessage message : messages) {
                chat.add(toLangChain(message));
            }
        }

        Response<AiMessage> response;
        try {
            response = model.generate(chat);
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new GenerativeServiceException(caller, "Generation failed: " + e.getMessage(), e);
        }

        String text = response != null && response.content() != null ? response.content().text() : null;
        if (text == null || text.isBlank()) {
            call.logError("Empty response", null);
            throw new GenerativeServiceException(caller, "Model returned an empty response", null);
        }

        call.logResponse(ExternalCallLogger.truncate(text, 200));
        return text;
    }

    private dev.langchain4j.data.message.ChatMessage toLangChain(ChatMessage message) {
        String content = message.getContent() != null ? message.getContent() : "";
        return switch (message.getRole() != null ? message.getRole() : "user") {
            case "assistant" -> AiMessage.from(content);
            case "system" -> SystemMessage.from(content);
            default -> UserMessage.from(content);
        };
    }
}
