package io.atom.governor.domain.repository;

import io.atom.governor.domain.model.Agent;
import io.atom.governor.domain.model.MaturityLevel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.DoubleUnaryOperator;

/**
 * Repository interface for Agent persistence.
 */
public interface AgentRepository {

    /**
     * Save an agent, assigning an id when missing.
     *
     * @param agent the agent to save
     * @return the saved agent
     */
    Mono<Agent> save(Agent agent);

    /**
     * Find an agent by ID.
     *
     * @param id the agent ID
     * @return the agent or empty
     */
    Mono<Agent> findById(String id);

    /**
     * Find the agent registered for a module and class.
     *
     * @param modulePath module path
     * @param className class name
     * @return the agent or empty
     */
    Mono<Agent> findByModule(String modulePath, String className);

    Flux<Agent> findAll();

    Flux<Agent> findByCategory(String category);

    /**
     * Atomically rewrite the confidence score of a single agent row.
     * Concurrent updates to the same agent are applied one after the other.
     *
     * @param id the agent ID
     * @param update function from the current score (default applied when unset) to the new score
     * @return the updated agent or empty when absent
     */
    Mono<Agent> updateConfidence(String id, DoubleUnaryOperator update);

    /**
     * Compare-and-set the maturity status of an agent.
     *
     * @param id the agent ID
     * @param expected status the caller read
     * @param target new status
     * @return the updated agent, empty when absent, or an error when the status changed concurrently
     */
    Mono<Agent> transitionStatus(String id, MaturityLevel expected, MaturityLevel target);
}
