package com.tableadvisor.common.model;

/**
 * Externally visible phase of the advisor overlay.
 *
 * <ul>
 *   <li>{@link #WAITING}: not the user's turn; old advice is cleared from the headline.</li>
 *   <li>{@link #READY}: turn is imminent; a predicted action may be shown.</li>
 *   <li>{@link #ACTING}: the user's turn; carries an {@link ActingKind}.</li>
 * </ul>
 */
public enum UiPhase {
    WAITING,
    READY,
    ACTING
}
