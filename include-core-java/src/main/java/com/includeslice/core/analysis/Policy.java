package com.includeslice.core.analysis;

/**
 * Tunes what counts as a use.
 *
 * Marking more things used reduces false "unused include" findings; marking fewer
 * things makes "missing include" findings stricter. Coding styles differ on which
 * includes are required, so each of these is a choice rather than a fix.
 *
 * @param construction does construction count as use of the type when the type is not named?
 *                     e.g. {@code printVector({x, y, z})} - is {@code std::vector} used?
 * @param members      is member access tracked as a reference?
 * @param operators    are operator calls tracked as references?
 */
public record Policy(boolean construction, boolean members, boolean operators) {

    public static final Policy DEFAULT = new Policy(false, false, false);

    public Policy withConstruction(boolean value) { return new Policy(value, members, operators); }
    public Policy withMembers(boolean value)      { return new Policy(construction, value, operators); }
    public Policy withOperators(boolean value)    { return new Policy(construction, members, value); }
}
