package org.trypticon.termfst.fst;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteArrayDataOutput;
import org.apache.lucene.util.BytesRef;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for the {@link Outputs} implementations.
 */
public class OutputsTests {
    private final PositiveIntOutputs ints = PositiveIntOutputs.getSingleton();
    private final ByteSequenceOutputs byteSequences = ByteSequenceOutputs.getSingleton();
    private final NoOutputs none = NoOutputs.getSingleton();

    @Test
    public void testPositiveIntAlgebra() {
        assertThat(ints.common(5L, 3L), is(3L));
        assertThat(ints.common(5L, ints.getNoOutput()), sameInstance(ints.getNoOutput()));
        assertThat(ints.subtract(5L, 3L), is(2L));
        assertThat(ints.subtract(5L, 5L), sameInstance(ints.getNoOutput()));
        assertThat(ints.subtract(5L, ints.getNoOutput()), is(5L));
        assertThat(ints.add(2L, 3L), is(5L));
        assertThat(ints.add(ints.getNoOutput(), 3L), is(3L));
        assertThat(ints.add(3L, ints.getNoOutput()), is(3L));
    }

    @Test
    public void testPositiveIntMergeUnsupported() {
        assertThat(ints.canMerge(), is(false));
        assertThat(byteSequences.canMerge(), is(false));
        assertThat(none.canMerge(), is(true));
        try {
            ints.merge(1L, 2L);
            throw new AssertionError("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            assertThat(e.getMessage().contains("PositiveIntOutputs"), is(true));
        }
    }

    @Test
    public void testPositiveIntReadSkipConsumeSameBytes() throws Exception {
        byte[] buffer = new byte[64];
        ByteArrayDataOutput out = new ByteArrayDataOutput(buffer);
        ints.write(300L, out);
        ints.write(ints.getNoOutput(), out);
        ints.writeFinalOutput(Long.MAX_VALUE, out);
        out.writeByte((byte) 77);
        int length = out.getPosition();

        ByteArrayDataInput in = new ByteArrayDataInput(buffer, 0, length);
        assertThat(ints.read(in), is(300L));
        assertThat(ints.read(in), sameInstance(ints.getNoOutput()));
        assertThat(ints.readFinalOutput(in), is(Long.MAX_VALUE));
        assertThat(in.readByte(), is((byte) 77));

        in = new ByteArrayDataInput(buffer, 0, length);
        ints.skipOutput(in);
        ints.skipOutput(in);
        ints.skipFinalOutput(in);
        assertThat(in.readByte(), is((byte) 77));
    }

    @Test
    public void testByteSequenceAlgebra() {
        BytesRef foobar = new BytesRef("foobar");
        BytesRef food = new BytesRef("food");
        BytesRef foo = new BytesRef("foo");
        assertThat(byteSequences.common(foobar, food), is(foo));
        assertThat(byteSequences.common(foo, foobar), sameInstance(foo));
        assertThat(byteSequences.common(foobar, new BytesRef("bar")), sameInstance(byteSequences.getNoOutput()));
        assertThat(byteSequences.subtract(foobar, foo), is(new BytesRef("bar")));
        assertThat(byteSequences.subtract(foo, new BytesRef("foo")), sameInstance(byteSequences.getNoOutput()));
        assertThat(byteSequences.add(foo, new BytesRef("bar")), is(foobar));
        assertThat(byteSequences.add(byteSequences.getNoOutput(), foo), sameInstance(foo));
    }

    @Test
    public void testByteSequenceReadSkipConsumeSameBytes() throws Exception {
        byte[] buffer = new byte[64];
        ByteArrayDataOutput out = new ByteArrayDataOutput(buffer);
        byteSequences.write(new BytesRef("hello"), out);
        byteSequences.write(byteSequences.getNoOutput(), out);
        out.writeByte((byte) 9);
        int length = out.getPosition();

        ByteArrayDataInput in = new ByteArrayDataInput(buffer, 0, length);
        assertThat(byteSequences.read(in), is(new BytesRef("hello")));
        assertThat(byteSequences.read(in), sameInstance(byteSequences.getNoOutput()));
        assertThat(in.readByte(), is((byte) 9));

        in = new ByteArrayDataInput(buffer, 0, length);
        byteSequences.skipOutput(in);
        byteSequences.skipOutput(in);
        assertThat(in.readByte(), is((byte) 9));
    }

    @Test
    public void testNoOutputsWritesNothing() throws Exception {
        byte[] buffer = new byte[8];
        ByteArrayDataOutput out = new ByteArrayDataOutput(buffer);
        none.write(none.getNoOutput(), out);
        none.writeFinalOutput(none.getNoOutput(), out);
        assertThat(out.getPosition(), is(0));
        assertThat(none.read(new ByteArrayDataInput(buffer)), sameInstance(none.getNoOutput()));
        assertThat(none.merge(none.getNoOutput(), none.getNoOutput()), sameInstance(none.getNoOutput()));
        assertThat(none.getNoOutput().hashCode(), is(42));
    }
}
