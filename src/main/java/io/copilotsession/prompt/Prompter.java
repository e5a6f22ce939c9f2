package io.copilotsession.prompt;

import io.copilotsession.model.SessionSummary;

import java.util.List;
import java.util.Optional;

/**
 * Operator dialogs. An empty result always means the operator cancelled, or the dialog could
 * not be shown; callers treat both the same.
 */
public interface Prompter {
    /**
     * Main selector with the use / new / refresh actions.
     */
    Optional<SessionChoice> chooseSession(List<SessionSummary> valid, List<SessionSummary> expired);

    /**
     * Plain account picker without action buttons; a pick comes back as {@link SessionAction#USE_SESSION}.
     */
    Optional<SessionChoice> chooseAccount(List<SessionSummary> accounts);
}
