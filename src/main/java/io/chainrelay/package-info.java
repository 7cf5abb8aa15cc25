/**
 * ChainRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.chainrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.chainrelay.cli.ChainRelayCommand} maps commands to orchestrator calls.</li>
 *   <li>{@code io.chainrelay.runtime.ExecutionOrchestrator} drives an intent from policy to connector result.</li>
 *   <li>{@code io.chainrelay.observability.AuditLog} is the hash-chained record of every run.</li>
 * </ul>
 */
package io.chainrelay;
