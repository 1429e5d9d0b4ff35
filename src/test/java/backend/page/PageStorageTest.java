package backend.page;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.holodsm.backend.PageManager.PageStorage;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class PageStorageTest {
    private static final int PAGE_SIZE = 64 * 1024;

    private PageStorage storage;

    @Before
    public void setUp() {
        storage = new PageStorage(PAGE_SIZE);
    }

    @Test
    public void testLongRoundTrip() throws Exception {
        storage.putLong(0, 42);
        assertEquals(42, storage.getLong(0));

        storage.putLong(PAGE_SIZE - 8, -7);
        assertEquals(-7, storage.getLong(PAGE_SIZE - 8));
    }

    @Test
    public void testLittleEndianLayout() throws Exception {
        storage.putLong(0, 0x0102030405060708L);
        byte[] image = storage.toByteArray();
        assertEquals(0x08, image[0]);
        assertEquals(0x01, image[7]);
    }

    @Test
    public void testFloatIsStoredBitwise() throws Exception {
        storage.putFloat(4, 1.5f);
        assertEquals(1.5f, storage.getFloat(4), 0.0f);

        int bits = Float.floatToIntBits(1.5f);
        byte[] image = storage.toByteArray();
        assertEquals((byte) bits, image[4]);
        assertEquals((byte) (bits >>> 24), image[7]);
    }

    @Test
    public void testWriteNearPageEndFails() {
        for (int offset = PAGE_SIZE - 7; offset < PAGE_SIZE; offset++) {
            try {
                storage.putLong(offset, 1);
                fail("偏移 " + offset + " 应该越界");
            } catch (DSMException e) {
                assertEquals(ErrorType.OUT_OF_BOUNDS, e.getErrorType());
            }
        }
    }

    @Test
    public void testNegativeOffsetFails() {
        try {
            storage.getLong(-1);
            fail("负偏移应该越界");
        } catch (DSMException e) {
            assertEquals(ErrorType.OUT_OF_BOUNDS, e.getErrorType());
        }
    }

    @Test
    public void testLoadRejectsWrongSize() throws Exception {
        try {
            storage.load(new byte[PAGE_SIZE / 2]);
            fail("大小不一致的镜像应该被拒绝");
        } catch (DSMException e) {
            assertEquals(ErrorType.PROTOCOL, e.getErrorType());
        }

        byte[] image = new byte[PAGE_SIZE];
        image[0] = 9;
        storage.load(image);
        assertEquals(9, storage.getLong(0));
        assertArrayEquals(image, storage.toByteArray());
    }
}
