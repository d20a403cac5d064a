package boxless.email.app.config;

import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code sync.backend} binds to {@link SyncBackend#DURABLE_QUEUE}, using the same
 * relaxed enum binding as {@link SyncProperties}, so durable-queue and DURABLE_QUEUE both match.
 */
public class DurableQueueBackendCondition implements Condition {

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return Binder.get(context.getEnvironment())
                .bind("sync.backend", SyncBackend.class)
                .map(backend -> backend == SyncBackend.DURABLE_QUEUE)
                .orElse(false);
    }
}
