package com.questrail.radar.console.interp;

/**
 * Application state carried by every scope next to its variables.
 *
 * <p>A child scope receives a {@link #copy()} of its parent's state, never a
 * live alias. Changes made by a callee become visible to a caller only through
 * {@link #mergeFrom}.</p>
 */
public interface DomainState
{
    /** State of an interpreter without an application catalog. */
    DomainState NONE = new DomainState() {
        @Override
        public DomainState copy() {
            return this;
        }

        @Override
        public void mergeFrom(DomainState callee) {
        }
    };

    DomainState copy();

    /**
     * Takes over every value {@code callee} changed more recently than this
     * state did.
     */
    void mergeFrom(DomainState callee);
}
