package org.hexwar.runtime.progression;

import org.hexwar.runtime.model.Unit;

import java.util.Optional;

/**
 * Result of a lazy refresh check.
 *
 * @param unit      the unit as stored after the check.
 * @param refreshed whether a refresh actually happened.
 * @param capture   the capture completed by the refresh, if any.
 */
public record RefreshOutcome(Unit unit, boolean refreshed, Optional<CaptureCompletion> capture) {

    static RefreshOutcome unchanged(Unit unit) {
        return new RefreshOutcome(unit, false, Optional.empty());
    }
}
