package org.trypticon.termfst.fst;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.packed.PackedInts;
import org.junit.Test;
import org.trypticon.termfst.InfoStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;
import static org.trypticon.termfst.fst.FSTFixtures.build;
import static org.trypticon.termfst.fst.FSTFixtures.catCarDog;
import static org.trypticon.termfst.fst.FSTFixtures.load;
import static org.trypticon.termfst.fst.FSTFixtures.save;

public class FSTPackTests {
    private final PositiveIntOutputs outputs = PositiveIntOutputs.getSingleton();

    @Test
    public void testPackedCatCarDog() throws Exception {
        SortedMap<IntsRef, Long> entries = catCarDog();
        FST<Long> packed = build(FST.INPUT_TYPE.BYTE1, outputs, true, true, entries);
        FST<Long> plain = build(FST.INPUT_TYPE.BYTE1, outputs, false, true, entries);
        assertThat(packed.isPacked(), is(true));
        assertThat(plain.isPacked(), is(false));
        assertThat(packed.getNodeCount(), is(plain.getNodeCount()));
        assertThat(packed.getArcCount(), is(plain.getArcCount()));
        assertThat(packed.getArcWithOutputCount(), is(plain.getArcWithOutputCount()));
        FSTFixtures.assertAccepts(packed, entries);
        assertThat(Util.get(packed, FSTFixtures.key("ca")), is((Long) null));
        assertThat(Util.get(packed, FSTFixtures.key("cats")), is((Long) null));
    }

    @Test
    public void testPackedSaveAndLoad() throws Exception {
        Random random = new Random(42);
        SortedMap<IntsRef, Long> entries = FSTFixtures.randomEntries(random, 500, 7, 0xFF, true);
        FST<Long> packed = build(FST.INPUT_TYPE.BYTE1, outputs, true, true, entries);
        byte[] saved = save(packed);
        for (int maxBlockBits : new int[] { 30, 5 }) {
            FST<Long> loaded = load(saved, outputs, maxBlockBits);
            assertThat(loaded.isPacked(), is(true));
            FSTFixtures.assertAccepts(loaded, entries);
            FSTFixtures.assertRejectsOthers(loaded, entries, random, 0xFF);
            FSTFixtures.checkAllNodes(loaded, 0xFF, random);
        }
    }

    @Test
    public void testFreshlyPackedCanBeSavedTwice() throws Exception {
        FST<Long> packed = build(FST.INPUT_TYPE.BYTE1, outputs, true, true, catCarDog());
        assertThat(save(packed), is(save(packed)));
    }

    @Test
    public void testLoadedPackedCannotBeSaved() throws Exception {
        FST<Long> packed = build(FST.INPUT_TYPE.BYTE1, outputs, true, true, catCarDog());
        FST<Long> loaded = load(save(packed), outputs, 30);
        try {
            save(loaded);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), is("cannot save a packed FST which was read from storage"));
        }
    }

    @Test
    public void testLoadedUnpackedCanBeSavedAgain() throws Exception {
        FST<Long> plain = build(FST.INPUT_TYPE.BYTE1, outputs, false, true, catCarDog());
        byte[] saved = save(plain);
        assertThat(save(load(saved, outputs, 30)), is(saved));
    }

    @Test
    public void testPackNeedsPackableFST() throws Exception {
        FST<Long> plain = build(FST.INPUT_TYPE.BYTE1, outputs, false, true, catCarDog());
        try {
            plain.pack(3, 10, PackedInts.COMPACT);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), is("this FST was not built with willPackFST=true"));
        }
    }

    @Test
    public void testPackReportsProgress() throws Exception {
        RecordingInfoStream infoStream = new RecordingInfoStream();
        Builder<Long> builder = FSTFixtures.builder(FST.INPUT_TYPE.BYTE1, outputs, true, true, infoStream);
        for (Map.Entry<IntsRef, Long> entry : catCarDog().entrySet()) {
            builder.add(entry.getKey(), entry.getValue());
        }
        builder.finish();
        assertThat(infoStream.components, hasItem("FST"));
        assertThat(infoStream.components, hasItem("FSTPack"));
        assertThat(infoStream.lines.get(0), startsWith("built 3 terms into 6 nodes"));
    }

    @Test
    public void testPackWithDeepSharedSuffixes() throws Exception {
        // many keys pointing at a handful of popular nodes so some get dereferenced
        SortedMap<IntsRef, Long> entries = new TreeMap<>();
        long value = 0;
        for (char first = 'a'; first <= 'z'; first++) {
            for (char second = 'a'; second <= 'z'; second++) {
                entries.put(FSTFixtures.key("" + first + second + "ing"), value++);
                entries.put(FSTFixtures.key("" + first + second + "ed"), value++);
            }
        }
        FST<Long> packed = build(FST.INPUT_TYPE.BYTE1, outputs, true, true, entries);
        FST<Long> plain = build(FST.INPUT_TYPE.BYTE1, outputs, false, true, entries);
        assertThat(packed.getNodeCount(), is(plain.getNodeCount()));
        FSTFixtures.assertAccepts(packed, entries);
        FSTFixtures.assertAccepts(load(save(packed), outputs, 30), entries);
    }

    private static class RecordingInfoStream implements InfoStream {
        private final List<String> components = new ArrayList<>();
        private final List<String> lines = new ArrayList<>();

        @Override
        public void message(String component, String line) {
            components.add(component);
            lines.add(line);
        }

        @Override
        public boolean isEnabled(String component) {
            return true;
        }
    }
}
