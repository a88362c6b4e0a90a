/**
 * Coordination runtime.
 *
 * <p>{@link io.agentledger.runtime.Manager} owns the workspace lifecycle and task submission;
 * {@link io.agentledger.runtime.Router} routes tasks by capability, serializes delegations per
 * worker and consolidates finished artifacts into the ledger, including recovery on restart.
 */
package io.agentledger.runtime;
