/**
 * Login orchestration.
 *
 * <p>{@link io.copilotsession.runtime.AuthFlow} decides between reusing a stored session,
 * refreshing one through the browser, and adding a new account. It is the only place where
 * component failures are turned into the "no result" the CLI reports as exit code 1.
 */
package io.copilotsession.runtime;
