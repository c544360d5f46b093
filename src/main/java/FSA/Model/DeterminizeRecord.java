package FSA.Model;

import java.util.BitSet;
import java.util.List;
import java.util.StringJoiner;

/**
 * Work-queue entry of subset construction: a subset of original states and the address of the
 * deterministic state standing for it.
 */
public record DeterminizeRecord(BitSet subset, int address) {

    /**
     * Subset spelled out with {@code labels}, where bit {@code i} stands for {@code labels.get(i)}.
     */
    public String describe(List<String> labels) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            joiner.add(labels.get(i));
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return address + ": " + subset;
    }
}
