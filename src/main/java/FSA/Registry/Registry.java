package FSA.Registry;

import java.util.BitSet;

/**
 * Assigns addresses to subsets of original states during subset construction.
 * Subsets are compared by membership, so callers must not mutate a subset after {@link #put}.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get address of a subset.
     * @param subset set of original state indices
     * @return address or MISSING_ELEMENT if the subset was never registered.
     */
    int get(BitSet subset);

    /**
     * Register a new subset under the next free address.
     * @param subset set of original state indices
     * @return the assigned address
     */
    int put(BitSet subset);

    /**
     * Subset registered at {@code address}.
     */
    BitSet getSubset(int address);

    /**
     * Number of registered subsets; also the next address to be assigned.
     */
    int size();
}
