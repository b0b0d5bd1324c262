package com.questrail.radar.experiment;

/**
 * Turns one {@link Subcycle} into a presentation, e.g. a chart or a text
 * listing. Implementations must not modify the subcycle.
 */
@FunctionalInterface
public interface SubcycleRenderer<R>
{
    R render(Subcycle subcycle);
}
