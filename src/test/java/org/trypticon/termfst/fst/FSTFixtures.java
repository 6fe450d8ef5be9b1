package org.trypticon.termfst.fst;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.packed.PackedInts;
import org.trypticon.termfst.InfoStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

/**
 * Shared helpers for building, walking and checking FSTs in tests.
 */
class FSTFixtures {
    private FSTFixtures() {
    }

    static IntsRef key(String term) {
        return IntsRef.deepCopyOf(Util.toIntsRef(new BytesRef(term), new IntsRefBuilder()));
    }

    static <T> Builder<T> builder(FST.INPUT_TYPE inputType, Outputs<T> outputs, boolean pack,
                                  boolean allowArrayArcs, InfoStream infoStream) {
        return new Builder<>(inputType, 0, 0, true, true, Integer.MAX_VALUE, outputs,
                pack, PackedInts.COMPACT, allowArrayArcs, 15, infoStream);
    }

    static <T> FST<T> build(FST.INPUT_TYPE inputType, Outputs<T> outputs, boolean pack,
                            boolean allowArrayArcs, SortedMap<IntsRef, T> entries) throws IOException {
        Builder<T> builder = builder(inputType, outputs, pack, allowArrayArcs, InfoStream.NO_OUTPUT);
        for (Map.Entry<IntsRef, T> entry : entries.entrySet()) {
            builder.add(entry.getKey(), entry.getValue());
        }
        return builder.finish();
    }

    static SortedMap<IntsRef, Long> catCarDog() {
        SortedMap<IntsRef, Long> entries = new TreeMap<>();
        entries.put(key("cat"), 1L);
        entries.put(key("car"), 2L);
        entries.put(key("dog"), 3L);
        return entries;
    }

    /**
     * Random keys mixing a tiny alphabet (lots of shared prefixes and suffixes)
     * with labels drawn from the whole range.
     */
    static SortedMap<IntsRef, Long> randomEntries(Random random, int count, int maxLength, int maxLabel,
                                                  boolean includeEmpty) {
        SortedMap<IntsRef, Long> entries = new TreeMap<>();
        if (includeEmpty) {
            entries.put(new IntsRef(), (long) random.nextInt(1000));
        }
        int[] alphabet = new int[6];
        for (int i = 0; i < alphabet.length; i++) {
            alphabet[i] = random.nextInt(maxLabel + 1);
        }
        while (entries.size() < count) {
            int length = 1 + random.nextInt(maxLength);
            int[] ints = new int[length];
            boolean narrow = random.nextBoolean();
            for (int i = 0; i < length; i++) {
                ints[i] = narrow ? alphabet[random.nextInt(alphabet.length)] : random.nextInt(maxLabel + 1);
            }
            entries.put(new IntsRef(ints, 0, length), (long) random.nextInt(1000));
        }
        return entries;
    }

    static int maxLabel(FST.INPUT_TYPE inputType) {
        switch (inputType) {
            case BYTE1:
                return 0xFF;
            case BYTE2:
                return 0xFFFF;
            default:
                return 0x10FFFF;
        }
    }

    /** Walks the key arc by arc, finishing with the end label. */
    static <T> T walk(FST<T> fst, IntsRef key) throws IOException {
        FST.BytesReader in = fst.getBytesReader();
        FST.Arc<T> arc = fst.getFirstArc(new FST.Arc<>());
        T output = fst.outputs.getNoOutput();
        for (int i = 0; i < key.length; i++) {
            if (fst.findTargetArc(key.ints[key.offset + i], arc, arc, in) == null) {
                return null;
            }
            output = fst.outputs.add(output, arc.output());
        }
        if (fst.findTargetArc(FST.END_LABEL, arc, arc, in) == null) {
            return null;
        }
        return fst.outputs.add(output, arc.output());
    }

    static <T> void assertAccepts(FST<T> fst, SortedMap<IntsRef, T> entries) throws IOException {
        for (Map.Entry<IntsRef, T> entry : entries.entrySet()) {
            assertThat("walk " + entry.getKey(), walk(fst, entry.getKey()), is(entry.getValue()));
            assertThat("get " + entry.getKey(), Util.get(fst, entry.getKey()), is(entry.getValue()));
        }
    }

    static <T> void assertRejectsOthers(FST<T> fst, SortedMap<IntsRef, T> entries, Random random,
                                        int maxLabel) throws IOException {
        for (IntsRef key : entries.keySet()) {
            IntsRefBuilder longer = new IntsRefBuilder();
            longer.copyInts(key);
            longer.append(random.nextInt(maxLabel + 1));
            if (!entries.containsKey(longer.get())) {
                assertThat("walk " + longer.get(), walk(fst, longer.get()), nullValue());
            }
            if (key.length > 1) {
                IntsRef prefix = new IntsRef(key.ints, key.offset, key.length - 1);
                if (!entries.containsKey(prefix)) {
                    assertThat("walk " + prefix, walk(fst, prefix), nullValue());
                }
            }
        }
    }

    static byte[] save(FST<?> fst) throws IOException {
        ByteBuffersDataOutput out = new ByteBuffersDataOutput();
        fst.save(out);
        return out.toArrayCopy();
    }

    static <T> FST<T> load(byte[] bytes, Outputs<T> outputs, int maxBlockBits) throws IOException {
        return new FST<>(new ByteArrayDataInput(bytes), outputs, maxBlockBits);
    }

    /**
     * Visits every node reachable from the start node and checks its arcs:
     * labels strictly increase, the last arc is flagged last, binary search or
     * linear scan agrees with a plain scan, and the last target arc matches.
     *
     * @return the number of distinct nodes with arcs.
     */
    static <T> int checkAllNodes(FST<T> fst, int maxLabel, Random random) throws IOException {
        FST.BytesReader in = fst.getBytesReader();
        Deque<FST.Arc<T>> stack = new ArrayDeque<>();
        stack.push(fst.getFirstArc(new FST.Arc<>()));
        Set<Long> seen = new HashSet<>();
        int nodes = 0;
        while (!stack.isEmpty()) {
            FST.Arc<T> follow = stack.pop();
            if (!FST.targetHasArcs(follow) || !seen.add(follow.target())) {
                continue;
            }
            nodes++;

            List<FST.Arc<T>> arcs = new ArrayList<>();
            FST.Arc<T> arc = fst.readFirstRealTargetArc(follow.target(), new FST.Arc<>(), in);
            while (true) {
                arcs.add(new FST.Arc<T>().copyFrom(arc));
                if (arc.isLast()) {
                    break;
                }
                fst.readNextRealArc(arc, in);
            }
            for (int i = 1; i < arcs.size(); i++) {
                assertThat("labels increase at " + arcs.get(i),
                        arcs.get(i).label(), greaterThan(arcs.get(i - 1).label()));
            }

            FST.Arc<T> last = fst.readLastTargetArc(follow, new FST.Arc<>(), in);
            assertThat(last.label(), is(arcs.get(arcs.size() - 1).label()));
            assertThat(last.isLast(), is(true));

            Set<Integer> candidates = new TreeSet<>();
            candidates.add(0);
            candidates.add(maxLabel);
            for (FST.Arc<T> a : arcs) {
                candidates.add(a.label());
                candidates.add(Math.max(0, a.label() - 1));
                candidates.add(Math.min(maxLabel, a.label() + 1));
            }
            for (int i = 0; i < 8; i++) {
                candidates.add(random.nextInt(maxLabel + 1));
            }
            for (int label : candidates) {
                FST.Arc<T> expected = null;
                for (FST.Arc<T> a : arcs) {
                    if (a.label() == label) {
                        expected = a;
                    }
                }
                FST.Arc<T> found = fst.findTargetArc(label, follow, new FST.Arc<>(), in);
                if (expected == null) {
                    assertThat("label " + label + " from " + follow, found, nullValue());
                } else {
                    assertThat("label " + label + " from " + follow, found, notNullValue());
                    assertSameArc(expected, found);
                }
            }

            for (FST.Arc<T> a : arcs) {
                stack.push(a);
            }
        }
        return nodes;
    }

    static <T> void assertSameArc(FST.Arc<T> expected, FST.Arc<T> actual) {
        assertThat(actual.label(), is(expected.label()));
        assertThat(actual.target(), is(expected.target()));
        assertThat(actual.output(), is(expected.output()));
        assertThat(actual.nextFinalOutput(), is(expected.nextFinalOutput()));
        assertThat(actual.flags(), is(expected.flags()));
    }
}
