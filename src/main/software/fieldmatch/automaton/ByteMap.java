package software.fieldmatch.automaton;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import static software.fieldmatch.automaton.Constants.ALPHABET_SIZE;
import static software.fieldmatch.automaton.Constants.BYTE_CEILING;

/**
 * Maps symbol values (the 256 byte values plus the value terminator) to the next ByteState. Designed to perform well
 * given the constraints that most ByteStates will have a very small number of transitions, and that for support of
 * wildcards, we need to efficiently represent the condition where wide ranges of byte values (including *all* of
 * them) will transition to a common next ByteState.
 */
class ByteMap {

    /*
     * Each map entry represents one or more symbol values that share a step. Null means no step (a dead end). The key
     * is a single integer which is the ceiling value; all symbol values below that and greater than or equal to the
     * floor value map to the associated ByteState or null. The floor value for any step is the ceiling from the
     * previous entry, or zero for the zeroth entry in the map. The last ceiling is always ALPHABET_SIZE.
     */
    private volatile NavigableMap<Integer, ByteState> map = new TreeMap<>();

    ByteMap() {
        map.put(ALPHABET_SIZE, null);
    }

    private ByteMap(final NavigableMap<Integer, ByteState> map) {
        this.map = map;
    }

    /**
     * Returns the ByteState the given symbol leads to.
     *
     * @param symbol a byte value in 0..255, or the value terminator
     * @return the next state, or {@code null} if the symbol leads nowhere
     */
    ByteState getStep(final int symbol) {
        assert symbol >= 0 && symbol < ALPHABET_SIZE : "symbol out of range: " + symbol;
        return map.higherEntry(symbol).getValue();
    }

    void putStep(final int symbol, final ByteState step) {
        putStepForRange(symbol, symbol + 1, step);
    }

    /**
     * Sends every byte value, but never the terminator, to the given step.
     */
    void putStepForAllBytes(final ByteState step) {
        putStepForRange(0, BYTE_CEILING, step);
    }

    /**
     *  Updates the symbols in [floor, ceiling) to lead to the given step and leaves the map in a consistent state.
     *  The entries holding the floor and the ceiling are split so that the map has a boundary at each, then every
     *  boundary strictly between them is dropped and the range is written as a single entry. Finally we merge entries
     *  mapping to the same step. The update is made on a copy which is then published, so concurrent readers always
     *  see a complete map.
     */
    void putStepForRange(final int floor, final int ceiling, final ByteState step) {
        if (floor < 0 || ceiling > ALPHABET_SIZE || floor >= ceiling) {
            throw new IllegalArgumentException("Invalid symbol range [" + floor + ", " + ceiling + ")");
        }
        final NavigableMap<Integer, ByteState> newMap = new TreeMap<>(map);

        if (!newMap.containsKey(ceiling)) {
            newMap.put(ceiling, newMap.higherEntry(ceiling).getValue());
        }
        if (floor > 0 && !newMap.containsKey(floor)) {
            newMap.put(floor, newMap.higherEntry(floor).getValue());
        }
        newMap.subMap(floor, false, ceiling, false).clear();
        newMap.put(ceiling, step);

        mergeAdjacentInMapIfNeeded(newMap);
        map = newMap;
    }

    /**
     * Merge adjacent entries with identical steps in inputMap.
     *
     * @param inputMap The map on which we merge adjacent entries with identical steps.
     */
    private static void mergeAdjacentInMapIfNeeded(final NavigableMap<Integer, ByteState> inputMap) {
        Iterator<Map.Entry<Integer, ByteState>> iterator = inputMap.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Integer, ByteState> next1 = iterator.next();
            Map.Entry<Integer, ByteState> next2 = inputMap.higherEntry(next1.getKey());
            if (next2 != null && next1.getValue() == next2.getValue()) {
                iterator.remove();
            }
        }
    }

    /**
     * Expands this map into one slot per symbol.
     *
     * @return an array of length ALPHABET_SIZE, each slot holding the step for that symbol or null
     */
    ByteState[] unpack() {
        final ByteState[] unpacked = new ByteState[ALPHABET_SIZE];
        int floor = 0;
        for (Map.Entry<Integer, ByteState> entry : map.entrySet()) {
            final int ceiling = entry.getKey();
            final ByteState step = entry.getValue();
            for (int i = floor; i < ceiling; i++) {
                unpacked[i] = step;
            }
            floor = ceiling;
        }
        return unpacked;
    }

    /**
     * Builds a map from one step per symbol; the inverse of {@link #unpack()}.
     *
     * @param unpacked an array of length ALPHABET_SIZE
     * @return the equivalent ceiling-keyed map
     */
    static ByteMap pack(final ByteState[] unpacked) {
        return new ByteMap(packMap(unpacked));
    }

    /**
     * Replaces every step in this map with the steps of the given unpacked array.
     *
     * @param unpacked an array of length ALPHABET_SIZE
     */
    void putSteps(final ByteState[] unpacked) {
        map = packMap(unpacked);
    }

    private static NavigableMap<Integer, ByteState> packMap(final ByteState[] unpacked) {
        if (unpacked.length != ALPHABET_SIZE) {
            throw new IllegalArgumentException("Expected " + ALPHABET_SIZE + " steps, got " + unpacked.length);
        }
        final NavigableMap<Integer, ByteState> packed = new TreeMap<>();
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            if (i == ALPHABET_SIZE - 1 || unpacked[i] != unpacked[i + 1]) {
                packed.put(i + 1, unpacked[i]);
            }
        }
        assert packed.lastKey() == ALPHABET_SIZE;
        return packed;
    }

    boolean isEmpty() {
        return numberOfSteps() == 0;
    }

    int numberOfSteps() {
        return getSteps().size();
    }

    boolean hasStep(final ByteState step) {
        return getSteps().contains(step);
    }

    /**
     * Get all distinct states this map can lead to.
     *
     * @return All distinct non-null steps, in ceiling order.
     */
    Set<ByteState> getSteps() {
        Set<ByteState> result = new LinkedHashSet<>(map.size());
        for (ByteState step : map.values()) {
            if (step != null) {
                result.add(step);
            }
        }
        return result;
    }

    /**
     * Get the ceiling values contained in this map.
     *
     * @return Ceiling values.
     */
    Set<Integer> getCeilings() {
        return Collections.unmodifiableSet(map.keySet());
    }

    // for testing
    NavigableMap<Integer, ByteState> getMap() {
        return map;
    }

    @Override
    public String toString() {
        final NavigableMap<Integer, ByteState> thisMap = map;
        StringBuilder sb = new StringBuilder();

        int floor = 0;
        for (Map.Entry<Integer, ByteState> entry : thisMap.entrySet()) {
            int ceiling = entry.getKey();
            ByteState step = entry.getValue();
            if (step != null) {
                sb.append(symbolName(floor));
                if (ceiling - floor > 1) {
                    sb.append("..").append(symbolName(ceiling - 1));
                }
                sb.append("->").append(step.getId()).append(" // ");
            }
            floor = ceiling;
        }
        return sb.toString();
    }

    private static String symbolName(int symbol) {
        if (symbol == Constants.VALUE_TERMINATOR) {
            return "<END>";
        }
        return symbol >= 0x20 && symbol < 0x7f ? String.valueOf((char) symbol) : String.format("0x%02X", symbol);
    }
}
