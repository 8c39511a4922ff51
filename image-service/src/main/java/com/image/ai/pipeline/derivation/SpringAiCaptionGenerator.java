package com.image.ai.pipeline.derivation;

import com.image.ai.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Semaphore;

/**
 * Captions images with the configured multimodal {@link ChatModel}. The model
 * bean is created once at startup and shared; calls into it are bounded by a
 * fair semaphore.
 */
@Slf4j
@Component
public class SpringAiCaptionGenerator implements CaptionGenerator {

    private static final String TRIM_CHARS = " .:";

    private final ChatModel chatModel;
    private final String prompt;
    private final int maxTokens;
    private final Semaphore permits;

    public SpringAiCaptionGenerator(
            ChatModel chatModel,
            @Value(AppConstants.PROP_CAPTION_PROMPT) String prompt,
            @Value(AppConstants.PROP_CAPTION_MAX_CONCURRENCY) int maxConcurrency,
            @Value(AppConstants.PROP_CAPTION_MAX_TOKENS) int maxTokens) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("app.caption.max-concurrency must be at least 1");
        }
        log.info("Initializing caption generator with max concurrency: {}", maxConcurrency);
        this.chatModel = chatModel;
        this.prompt = prompt;
        this.maxTokens = maxTokens;
        this.permits = new Semaphore(maxConcurrency, true);
    }

    @Override
    public String describe(DecodedImage image) {
        Media media = new Media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(encodePng(image)));
        UserMessage message = UserMessage.builder()
                .text(prompt)
                .media(List.of(media))
                .build();
        // temperature 0 + topK 1: greedy decoding, identical input gives identical output
        ChatOptions options = ChatOptions.builder()
                .temperature(0.0)
                .topK(1)
                .maxTokens(maxTokens)
                .build();

        String raw;
        acquire();
        try {
            raw = extractText(chatModel.call(new Prompt(message, options)));
        } catch (RuntimeException e) {
            throw new StageFailureException(PipelineStage.CAPTION,
                    "caption model call failed: " + StageFailureException.reasonOf(e), e);
        } finally {
            permits.release();
        }
        return clean(raw);
    }

    String clean(String raw) {
        String caption = raw == null ? "" : raw.strip();
        if (caption.toLowerCase(Locale.ROOT).startsWith(prompt.toLowerCase(Locale.ROOT))) {
            caption = strip(caption.substring(prompt.length()));
        }
        return caption.isEmpty() ? AppConstants.DEFAULT_CAPTION_FALLBACK : caption;
    }

    private void acquire() {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageFailureException(PipelineStage.CAPTION, "interrupted while waiting for the caption model", e);
        }
    }

    private static String extractText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        return response.getResult().getOutput().getText();
    }

    private static String strip(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && TRIM_CHARS.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIM_CHARS.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    private static byte[] encodePng(DecodedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image.image(), "png", out)) {
                throw new StageFailureException(PipelineStage.CAPTION, "no PNG encoder for caption input");
            }
        } catch (IOException e) {
            throw new StageFailureException(PipelineStage.CAPTION,
                    "cannot encode caption input: " + StageFailureException.reasonOf(e), e);
        }
        return out.toByteArray();
    }
}
