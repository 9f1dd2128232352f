package com.nevis.dossier.inference;

import com.nevis.dossier.exception.InferenceException;
import com.nevis.dossier.infra.RateLimiter;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.PdfFileContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

@Component
@Slf4j
public class GeminiInferenceClient implements InferenceClient {

    public static final String DIRECT_LIMIT = "gemini_direct";
    public static final String REASONING_LIMIT = "gemini_reasoning";

    private static final int CHARS_PER_TOKEN = 4;
    // flat estimate for an attached PDF or image
    private static final int BINARY_TOKEN_ESTIMATE = 2_000;

    private final ChatModel directChatModel;
    private final ChatModel reasoningChatModel;
    private final RateLimiter classificationLimiter;
    private final RateLimiter extractionLimiter;

    public GeminiInferenceClient(
        @Qualifier("directChatModel") ChatModel directChatModel,
        @Qualifier("reasoningChatModel") ChatModel reasoningChatModel,
        @Qualifier("classificationLimiter") RateLimiter classificationLimiter,
        @Qualifier("extractionLimiter") RateLimiter extractionLimiter
    ) {
        this.directChatModel = directChatModel;
        this.reasoningChatModel = reasoningChatModel;
        this.classificationLimiter = classificationLimiter;
        this.extractionLimiter = extractionLimiter;
    }

    @Override
    public String infer(InferenceContent content, String instructions, int maxTokens, boolean extendedReasoning) {
        ChatRequest request = ChatRequest.builder()
            .messages(List.<ChatMessage>of(
                SystemMessage.from(instructions),
                UserMessage.from(toContents(content))
            ))
            .maxOutputTokens(maxTokens)
            .build();

        ChatResponse response;
        try {
            if (extendedReasoning) {
                int estimatedTokens = estimateTokens(content, instructions) + maxTokens;
                response = extractionLimiter.execute(REASONING_LIMIT, estimatedTokens,
                    () -> reasoningChatModel.chat(request));
            } else {
                response = classificationLimiter.execute(DIRECT_LIMIT, 1,
                    () -> directChatModel.chat(request));
            }
        } catch (InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceException("Inference call failed: " + e.getMessage(), e);
        }

        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new InferenceException("Model returned no text");
        }
        String text = response.aiMessage().text();
        log.debug("Inference returned {} chars (reasoning={})", text.length(), extendedReasoning);
        return text;
    }

    private List<Content> toContents(InferenceContent content) {
        if (content.isText()) {
            return List.of(TextContent.from(content.text()));
        }

        String mimeType = content.mimeType() != null ? content.mimeType() : "application/octet-stream";
        if (mimeType.startsWith("text/")) {
            return List.of(TextContent.from(new String(content.data(), StandardCharsets.UTF_8)));
        }

        String base64 = Base64.getEncoder().encodeToString(content.data());
        if ("application/pdf".equals(mimeType)) {
            return List.of(PdfFileContent.from(base64, mimeType));
        }
        if (mimeType.startsWith("image/")) {
            return List.of(ImageContent.from(base64, mimeType));
        }
        throw new InferenceException("Unsupported content type for inference: " + mimeType);
    }

    private static int estimateTokens(InferenceContent content, String instructions) {
        int contentTokens = content.isText() ? content.length() / CHARS_PER_TOKEN : BINARY_TOKEN_ESTIMATE;
        return contentTokens + instructions.length() / CHARS_PER_TOKEN;
    }
}
