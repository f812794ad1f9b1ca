package com.idp.assessment.agent;

import com.idp.assessment.exception.InvocationException;
import com.idp.assessment.exception.InvocationTimeoutException;
import com.idp.assessment.exception.ThrottlingException;
import com.idp.assessment.model.TaskKind;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for mapping provider errors onto the invocation exception family.
 */
class ChatClientAssessmentInvokerTest {

    @Test
    void rateLimitErrorsAreThrottling() {
        assertThat(ChatClientAssessmentInvoker.translate(new TransientAiException("overloaded"), TaskKind.GROUP))
                .isInstanceOf(ThrottlingException.class);
        assertThat(ChatClientAssessmentInvoker.translate(
                HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", null, null, null),
                TaskKind.SIMPLE_BATCH))
                .isInstanceOf(ThrottlingException.class);
        assertThat(ChatClientAssessmentInvoker.isThrottling(
                new RuntimeException("wrapped", new IllegalStateException("ThrottlingException: Rate exceeded"))))
                .isTrue();
    }

    @Test
    void socketTimeoutsAreTimeouts() {
        RuntimeException e = new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"));

        InvocationException translated = ChatClientAssessmentInvoker.translate(e, TaskKind.LIST_ITEM);

        assertThat(translated).isInstanceOf(InvocationTimeoutException.class);
        assertThat(translated.getMessage()).isEqualTo("LIST_ITEM task: Read timed out");
        assertThat(translated.getCause()).isSameAs(e);
    }

    /**
     * Anything else fails the task without retry.
     */
    @Test
    void otherErrorsAreGenericFailures() {
        InvocationException translated = ChatClientAssessmentInvoker.translate(
                new IllegalArgumentException("invalid model id"), TaskKind.DOCUMENT);

        assertThat(translated).isExactlyInstanceOf(InvocationException.class);
        assertThat(ChatClientAssessmentInvoker.isThrottling(new RuntimeException("status 4290 unrelated"))).isFalse();
    }
}
