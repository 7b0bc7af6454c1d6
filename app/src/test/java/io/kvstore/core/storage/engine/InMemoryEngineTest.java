package io.kvstore.core.storage.engine;

import io.kvstore.core.error.ConflictException;
import io.kvstore.core.error.EngineException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEngineTest {

    @Test
    void swapReturnsPrevious() {
        InMemoryEngine engine = new InMemoryEngine();
        assertNull(engine.swap(b(1), b(10)));
        assertArrayEquals(b(10), engine.swap(b(1), b(11)));
        assertArrayEquals(b(11), engine.swap(b(1), null));
        assertNull(engine.get(b(1)));
        assertEquals(0, engine.size());
    }

    @Test
    void returnedValuesAreCopies() {
        InMemoryEngine engine = new InMemoryEngine();
        byte[] value = b(7);
        engine.swap(b(1), value);
        value[0] = 99;
        byte[] read = engine.get(b(1));
        read[0] = 42;
        assertArrayEquals(b(7), engine.get(b(1)));
    }

    @Test
    void scansUnsignedOrderBothWays() {
        InMemoryEngine engine = new InMemoryEngine();
        engine.write(List.of(
                WriteOp.put(b(0x80), b(1)),
                WriteOp.put(b(0x01), b(2)),
                WriteOp.put(b(0x7F), b(3)),
                WriteOp.put(b(0xFF), b(4))));

        assertEquals(List.of(0x01, 0x7F, 0x80), firstBytes(engine.scan(null, b(0xFF), false)));
        assertEquals(List.of(0xFF, 0x80, 0x7F), firstBytes(engine.scan(b(0x7F), null, true)));
    }

    @Test
    void writeAppliesInOrder() {
        InMemoryEngine engine = new InMemoryEngine();
        engine.write(List.of(WriteOp.put(b(1), b(1)), WriteOp.delete(b(1)), WriteOp.put(b(2), b(2))));
        assertNull(engine.get(b(1)));
        assertArrayEquals(b(2), engine.get(b(2)));
    }

    @Test
    void transactionConflictsWhenReadKeyChanges() {
        InMemoryEngine engine = new InMemoryEngine();
        engine.swap(b(1), b(1));
        try (EngineTransaction tx = engine.beginTransaction()) {
            assertArrayEquals(b(1), tx.get(b(1)));
            engine.swap(b(1), b(2));
            tx.put(b(1), b(3));
            assertThrows(ConflictException.class, tx::commit);
            tx.rollback();
        }
        assertArrayEquals(b(2), engine.get(b(1)));
    }

    @Test
    void transactionCommitsWhenUntouched() {
        InMemoryEngine engine = new InMemoryEngine();
        try (EngineTransaction tx = engine.beginTransaction()) {
            tx.put(b(1), b(1));
            tx.put(b(2), b(2));
            tx.delete(b(2));
            assertNull(engine.get(b(1)));
            tx.commit();
        }
        assertArrayEquals(b(1), engine.get(b(1)));
        assertNull(engine.get(b(2)));
    }

    @Test
    void rangeDeleteRemovesHalfOpenRangeAndConflictsReaders() {
        InMemoryEngine engine = new InMemoryEngine();
        for (int i = 1; i <= 4; i++) {
            engine.swap(b(i), b(i));
        }
        try (EngineTransaction tx = engine.beginTransaction()) {
            assertArrayEquals(b(2), tx.get(b(2)));
            engine.deleteRange(b(2), b(4));
            tx.put(b(9), b(9));
            assertThrows(ConflictException.class, tx::commit);
            tx.rollback();
        }
        assertEquals(List.of(1, 4), firstBytes(engine.scan(null, null, false)));
    }

    @Test
    void closedEngineRejectsCalls() {
        InMemoryEngine engine = new InMemoryEngine();
        engine.close();
        assertThrows(EngineException.class, () -> engine.get(b(1)));
    }

    private static byte[] b(int v) {
        return new byte[] {(byte) v};
    }

    private static List<Integer> firstBytes(RawCursor cursor) {
        List<Integer> out = new ArrayList<>();
        try (cursor) {
            while (cursor.hasNext()) {
                out.add(cursor.next().key()[0] & 0xFF);
            }
        }
        return out;
    }
}
