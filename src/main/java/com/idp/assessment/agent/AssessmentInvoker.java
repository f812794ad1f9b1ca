package com.idp.assessment.agent;

import com.idp.assessment.exception.InvocationException;
import com.idp.assessment.exception.InvocationTimeoutException;
import com.idp.assessment.exception.ThrottlingException;
import com.idp.assessment.model.DynamicSegment;
import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.StaticSegment;
import com.idp.assessment.model.TaskKind;

/**
 * Calls the inference service for one task. Implementations must be safe to call from
 * several worker threads at once.
 */
@FunctionalInterface
public interface AssessmentInvoker {

    /**
     * @param staticSegment  shared, cacheable part of the request
     * @param dynamicSegment task-specific part of the request
     * @param kind           kind of the task, for logging and routing
     * @return the unparsed model response
     * @throws ThrottlingException         when the service rejects the call for rate reasons
     * @throws InvocationTimeoutException  when the call timed out
     * @throws InvocationException         for any other failure
     */
    RawResponse invoke(StaticSegment staticSegment, DynamicSegment dynamicSegment, TaskKind kind);
}
