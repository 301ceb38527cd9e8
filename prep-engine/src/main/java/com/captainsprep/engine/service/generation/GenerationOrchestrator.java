package com.captainsprep.engine.service.generation;

import com.captainsprep.engine.model.RetrievalContext;
import com.captainsprep.engine.service.retrieval.RagContextService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Facade for one content kind. Calls the primary generator and, when it fails to produce a
 * parseable item, answers with the deterministic fallback instead so callers always receive an
 * item.
 */
public class GenerationOrchestrator<T> implements ItemGenerator<T> {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final String kind;
    private final ItemGenerator<T> primary;
    private final ItemGenerator<T> fallback;
    private final RagContextService ragContextService;
    private final Counter fallbackCounter;
    private final boolean mockOnly;

    public GenerationOrchestrator(String kind,
                                  ItemGenerator<T> primary,
                                  ItemGenerator<T> fallback,
                                  RagContextService ragContextService,
                                  MeterRegistry meterRegistry) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.primary = primary == null ? fallback : primary;
        this.mockOnly = primary == null;
        this.ragContextService = ragContextService;
        this.fallbackCounter = Counter.builder("prep.generation.fallbacks")
                .tag("kind", kind)
                .description("Generation calls answered by the fallback producer")
                .register(meterRegistry);
    }

    public String kind() {
        return kind;
    }

    public boolean mockOnly() {
        return mockOnly;
    }

    @Override
    public T generate(String topic, String context) {
        if (mockOnly) {
            return fallback.generate(topic, context);
        }
        try {
            return primary.generate(topic, context);
        } catch (ParseFailureException ex) {
            log.warn("Unparseable {} output for topic '{}', using fallback: {}", kind, topic, ex.getMessage());
            log.debug("Raw {} response: {}", kind, ex.rawResponse());
        } catch (GenerationUnavailableException ex) {
            log.warn("{} generation unavailable for topic '{}', using fallback: {}", kind, topic, ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("{} generation failed for topic '{}', using fallback", kind, topic, ex);
        }
        fallbackCounter.increment();
        return fallback.generate(topic, context);
    }

    /**
     * Retrieves context for {@code topic} within {@code scope} and generates from it.
     */
    public T generateGrounded(String topic, Set<String> scope) {
        RetrievalContext context = ragContextService == null
                ? RetrievalContext.empty()
                : ragContextService.buildContext(topic, scope);
        return generate(topic, context.context());
    }
}
