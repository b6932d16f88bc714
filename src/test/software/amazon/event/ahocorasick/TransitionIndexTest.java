package software.amazon.event.ahocorasick;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class TransitionIndexTest {

    @Test
    public void emptyIndexShouldFindNothing() {
        TransitionIndex index = TransitionIndex.of(Collections.emptyList());

        assertSame(TransitionIndex.EMPTY, index);
        assertEquals(0, index.size());
        assertEquals(0, index.height());
        assertNull(index.find((byte) 'a'));
    }

    @Test
    public void shouldFindEveryChild() {
        TrieState root = new TrieState();
        byte[] symbols = "zmaqbyc".getBytes();
        for (byte symbol : symbols) {
            root.getOrCreateChild(symbol, new byte[] { symbol });
        }

        TransitionIndex index = TransitionIndex.of(root.getChildren());

        assertEquals(symbols.length, index.size());
        for (byte symbol : symbols) {
            assertSame(root.getChild(symbol), index.find(symbol));
        }
        assertNull(index.find((byte) 'd'));
        assertNull(index.find((byte) '0'));
        assertNull(index.find((byte) '~'));
    }

    @Test
    public void shouldOrderSymbolsAsUnsignedBytes() {
        TrieState root = new TrieState();
        byte[] symbols = { (byte) 0xFF, (byte) 0x80, 0x00, 0x7F, 0x01 };
        for (byte symbol : symbols) {
            root.getOrCreateChild(symbol, new byte[] { symbol });
        }

        TransitionIndex index = TransitionIndex.of(root.getChildren());

        assertEquals("TI: 0,1,127,128,255", index.toString());
        for (byte symbol : symbols) {
            assertSame(root.getChild(symbol), index.find(symbol));
        }
        assertNull(index.find((byte) 0xFE));
    }

    @Test
    public void shouldHandleFullByteFanOut() {
        TrieState root = new TrieState();
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 256; i++) {
            values.add(i);
        }
        Collections.shuffle(values, new Random(7));
        for (int value : values) {
            root.getOrCreateChild((byte) value, new byte[] { (byte) value });
        }

        TransitionIndex index = TransitionIndex.of(root.getChildren());

        assertEquals(256, index.size());
        assertEquals(9, index.height());
        for (int i = 0; i < 256; i++) {
            TrieState found = index.find((byte) i);
            assertEquals(i, found.getSymbol() & 0xFF);
        }
    }

    @Test
    public void heightShouldBeLogarithmic() {
        TrieState root = new TrieState();
        for (int i = 0; i < 7; i++) {
            root.getOrCreateChild((byte) i, new byte[] { (byte) i });
        }
        assertEquals(3, TransitionIndex.of(root.getChildren()).height());
    }
}
