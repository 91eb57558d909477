package com.tableadvisor.common.pixel;

import com.tableadvisor.common.model.PixelSignal;

/**
 * Edge between two consecutive frames' primary-control presence.
 * The capture loop turns {@code appeared} and {@code disappeared} into engine control events.
 */
public record ControlTransition(boolean appeared, boolean disappeared, boolean present) {

    public static ControlTransition between(boolean previouslyPresent, PixelSignal current) {
        boolean present = current != null && current.primaryControlPresent();
        return new ControlTransition(!previouslyPresent && present, previouslyPresent && !present, present);
    }

    public boolean changed() {
        return appeared || disappeared;
    }
}
