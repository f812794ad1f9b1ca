package com.idp.assessment.agent;

import com.idp.assessment.config.AssessmentProperties;
import com.idp.assessment.exception.InvocationException;
import com.idp.assessment.exception.InvocationTimeoutException;
import com.idp.assessment.exception.ThrottlingException;
import com.idp.assessment.model.DynamicSegment;
import com.idp.assessment.model.PageImage;
import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.StaticSegment;
import com.idp.assessment.model.TaskKind;
import com.idp.assessment.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.content.Media;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.client.HttpClientErrorException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * {@link AssessmentInvoker} backed by the Spring AI {@link ChatClient}.
 * <p>
 * The static segment (text and page images) is sent first in the user message and the
 * task-specific segment after it, so providers with prefix caching can reuse the shared part.
 * Provider errors are mapped onto the invocation exception family:
 * <ul>
 *   <li>rate limiting ({@link TransientAiException}, HTTP 429, throttling error codes) to {@link ThrottlingException}</li>
 *   <li>socket and read timeouts to {@link InvocationTimeoutException}</li>
 *   <li>everything else, including empty answers, to {@link InvocationException}</li>
 * </ul>
 */
@Service
public class ChatClientAssessmentInvoker implements AssessmentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAssessmentInvoker.class);

    static final List<String> THROTTLING_MARKERS = List.of(
            "throttlingexception",
            "provisionedthroughputexceededexception",
            "servicequotaexceededexception",
            "toomanyrequestsexception",
            "requestlimitexceeded",
            "rate limit");

    private final ChatClient chatClient;
    private final String systemPrompt;

    public ChatClientAssessmentInvoker(@Qualifier("assessmentChatClient") ChatClient chatClient,
                                       AssessmentProperties properties) {
        this.chatClient = chatClient;
        this.systemPrompt = properties.systemPrompt();
    }

    @Override
    public RawResponse invoke(StaticSegment staticSegment, DynamicSegment dynamicSegment, TaskKind kind) {
        Media[] media = staticSegment.images().stream()
                .map(ChatClientAssessmentInvoker::toMedia)
                .toArray(Media[]::new);
        String userText = staticSegment.text() + dynamicSegment.text();

        ChatResponse chatResponse;
        try {
            chatResponse = chatClient.prompt()
                    .system(systemPrompt)
                    .user(u -> u.text(userText).media(media))
                    .call()
                    .chatResponse();
        } catch (RuntimeException e) {
            throw translate(e, kind);
        }

        String content = (chatResponse != null && chatResponse.getResult() != null)
                ? chatResponse.getResult().getOutput().getText()
                : null;
        if (content == null || content.isBlank()) {
            throw new InvocationException("Empty or null content in model response for " + kind + " task");
        }
        TokenUsage usage = usage(chatResponse);
        log.debug("ChatClientAssessmentInvoker: {} task answered, {} input / {} output tokens",
                kind, usage.inputTokens(), usage.outputTokens());
        return new RawResponse(content, usage);
    }

    private static Media toMedia(PageImage image) {
        return new Media(MimeTypeUtils.parseMimeType(image.mimeType()), new ByteArrayResource(image.data()));
    }

    private static TokenUsage usage(ChatResponse chatResponse) {
        var metadata = chatResponse.getMetadata();
        if (metadata == null) {
            return TokenUsage.NONE;
        }
        Usage usage = metadata.getUsage();
        if (usage == null) {
            return TokenUsage.NONE;
        }
        long input = usage.getPromptTokens() != null ? usage.getPromptTokens().longValue() : 0L;
        long output = usage.getCompletionTokens() != null ? usage.getCompletionTokens().longValue() : 0L;
        return new TokenUsage(input, output);
    }

    /** Maps a provider failure onto the invocation exception family. */
    static InvocationException translate(RuntimeException e, TaskKind kind) {
        String message = kind + " task: " + rootCauseMessage(e);
        if (isThrottling(e)) {
            return new ThrottlingException(message, e);
        }
        if (isTimeout(e)) {
            return new InvocationTimeoutException(message, e);
        }
        return new InvocationException(message, e);
    }

    static boolean isThrottling(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TransientAiException || t instanceof HttpClientErrorException.TooManyRequests) {
                return true;
            }
            if (t.getMessage() != null && t.getMessage().startsWith("429")) {
                return true;
            }
            String text = (t.getClass().getSimpleName() + " " + t.getMessage()).toLowerCase(Locale.ROOT);
            for (String marker : THROTTLING_MARKERS) {
                if (text.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
