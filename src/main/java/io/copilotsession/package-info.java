/**
 * copilot-session source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.copilotsession.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.copilotsession.cli.CopilotSessionCommand} wires configuration, store, validator and browser.</li>
 *   <li>{@code io.copilotsession.runtime.AuthFlow} decides between reuse, refresh and a new login.</li>
 *   <li>{@code io.copilotsession.storage.SessionStore} owns the sessions document.</li>
 * </ul>
 */
package io.copilotsession;
