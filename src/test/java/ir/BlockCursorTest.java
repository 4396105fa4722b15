package ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockCursorTest {

    @Test
    void testStepBackFromStartAndAdvanceAgain() {
        BasicBlock block = new BasicBlock("bb");
        Argument a = new Argument(IrType.I32, "a", 0);
        new IrBuilder(block).ret(a);
        BlockCursor cursor = BlockCursor.begin(block);

        cursor.stepBack();
        assertEquals(-1, cursor.getIndex());
        assertThrows(IllegalStateException.class, cursor::get);
        cursor.advance();
        assertEquals(Opcode.RET, cursor.get().getOpcode());
        cursor.advance();
        assertTrue(cursor.atEnd());
    }

    @Test
    void testCopiesMoveIndependently() {
        BasicBlock block = new BasicBlock("bb");
        BlockCursor cursor = new BlockCursor(block, 2);
        BlockCursor copy = cursor.copy();
        copy.advance();

        assertEquals(2, cursor.getIndex());
        assertFalse(cursor.samePosition(copy));
        cursor.moveTo(copy);
        assertTrue(cursor.samePosition(copy));
        assertThrows(IllegalArgumentException.class, () -> cursor.moveTo(BlockCursor.begin(new BasicBlock("other"))));
    }
}
