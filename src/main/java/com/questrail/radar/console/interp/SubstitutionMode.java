package com.questrail.radar.console.interp;

/**
 * Which substitutions apply to a word; {@code subst} can switch each off.
 */
record SubstitutionMode(boolean commands, boolean variables, boolean backslashes)
{
    static final SubstitutionMode ALL = new SubstitutionMode(true, true, true);
}
