package me.golemcore.llm.domain.system.toolloop;

import me.golemcore.llm.domain.model.StreamPart;
import me.golemcore.llm.domain.model.ToolLoopOutcome;
import me.golemcore.llm.domain.model.ToolLoopRequest;
import me.golemcore.llm.domain.model.ToolLoopResult;
import reactor.core.publisher.Flux;

/**
 * Multi-step tool loop: the model is called, requested tools are executed and
 * their results fed back until the model answers without tool calls.
 */
public interface ToolLoopSystem {

    /**
     * Runs the loop to completion.
     *
     * @throws me.golemcore.llm.domain.exception.ToolApprovalRequiredException
     *             if a call needs approval
     * @throws me.golemcore.llm.domain.exception.MaxStepsExceededException
     *             if the model keeps requesting tools past the step budget
     * @throws me.golemcore.llm.domain.exception.CancelledException
     *             if the cancellation token fires
     * @throws me.golemcore.llm.domain.exception.ToolLoopExecutionException
     *             on provider failure
     */
    ToolLoopResult run(ToolLoopRequest request);

    /**
     * Runs the loop until it finishes or blocks on approval.
     */
    ToolLoopOutcome runUntilBlocked(ToolLoopRequest request);

    /**
     * Streams the loop as normalized parts. Ends with {@code FINISH} when the
     * loop completes, or with {@code ERROR} on blocking, step exhaustion,
     * provider failure or cancellation.
     */
    Flux<StreamPart> streamParts(ToolLoopRequest request);
}
