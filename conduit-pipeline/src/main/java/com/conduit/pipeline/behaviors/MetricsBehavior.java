package com.conduit.pipeline.behaviors;

import com.conduit.pipeline.Behavior;
import com.conduit.pipeline.Next;
import com.conduit.pipeline.PipelineCancelledException;
import com.conduit.pipeline.PipelineContext;
import com.conduit.pipeline.PipelineTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Records a timer per request for the rest of the chain, tagged with the message type and outcome
 * ({@code success}, {@code failure}, {@code timeout}, {@code cancelled}).
 */
public final class MetricsBehavior implements Behavior {

    public static final String TIMER_NAME = "conduit.chain.execution";

    private final MeterRegistry registry;

    /** Uses a private in-memory registry. */
    public MetricsBehavior() {
        this(new SimpleMeterRegistry());
    }

    public MetricsBehavior(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public Object execute(PipelineContext context, Next next) throws Exception {
        Object message = context.getMessage();
        String type = message != null ? message.getClass().getSimpleName() : "null";
        Timer.Sample sample = Timer.start(registry);
        String outcome = "failure";
        try {
            Object result = next.proceed(context);
            outcome = "success";
            return result;
        } catch (PipelineTimeoutException e) {
            outcome = "timeout";
            throw e;
        } catch (PipelineCancelledException e) {
            outcome = "cancelled";
            throw e;
        } finally {
            sample.stop(Timer.builder(TIMER_NAME)
                    .tag("messageType", type)
                    .tag("outcome", outcome)
                    .register(registry));
        }
    }
}
