package FSA.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class AddressRegistry implements Registry {
    private final Object2IntMap<BitSet> key2Address;
    private final List<BitSet> address2Key;

    public AddressRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.address2Key = new ArrayList<>();
    }

    @Override
    public int get(BitSet subset) {
        return key2Address.getInt(subset);
    }

    @Override
    public int put(BitSet subset) {
        int address = key2Address.getInt(subset);
        if (address != MISSING_ELEMENT) {
            return address;
        }
        address = address2Key.size();
        key2Address.put(subset, address);
        address2Key.add(subset);
        return address;
    }

    @Override
    public BitSet getSubset(int address) {
        return (BitSet) address2Key.get(address).clone();
    }

    @Override
    public int size() {
        return address2Key.size();
    }

    @Override
    public String toString() {
        return "Address(" + size() + ")";
    }
}
