/**
 * AgentLedger source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentledger.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentledger.cli.AgentLedgerCommand} maps commands to manager APIs.</li>
 *   <li>{@code io.agentledger.runtime.Manager} starts agents, allocates task ids and submits work.</li>
 *   <li>{@code io.agentledger.runtime.Router} routes, delegates and consolidates into the ledger.</li>
 *   <li>{@code io.agentledger.storage.TaskRegistry} is the authoritative task state.</li>
 * </ul>
 */
package io.agentledger;
