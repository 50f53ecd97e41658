package com.architecture.memory.flowgrade.service.llm;

import com.architecture.memory.flowgrade.exception.InferenceTransportException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Thin wrapper over the chat model. Returns the raw reply text; decoding is the caller's job.
 * Any failure of the call surfaces as {@link InferenceTransportException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InferenceClient {

    private final ChatLanguageModel chatLanguageModel;

    public String invoke(String prompt) {
        return send(UserMessage.from(prompt), "text");
    }

    public String invoke(String prompt, ImageAttachment image) {
        UserMessage message = UserMessage.from(
                TextContent.from(prompt),
                ImageContent.from(image.getBase64Data(), image.getMimeType()));
        return send(message, "text+image");
    }

    private String send(UserMessage message, String kind) {
        long startTime = System.currentTimeMillis();
        try {
            List<ChatMessage> messages = List.of(message);
            Response<AiMessage> response = chatLanguageModel.generate(messages);
            String text = response.content().text();
            log.info("[Inference] {} call completed in {}ms ({} chars)",
                    kind, System.currentTimeMillis() - startTime, text != null ? text.length() : 0);
            return text;
        } catch (Exception e) {
            log.error("[Inference] {} call failed after {}ms: {}",
                    kind, System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw new InferenceTransportException("Inference call failed: " + e.getMessage(), e);
        }
    }
}
