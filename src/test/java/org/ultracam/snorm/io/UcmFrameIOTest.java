package org.ultracam.snorm.io;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.ultracam.snorm.Frame;
import org.ultracam.snorm.Window;

public class UcmFrameIOTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Window window(int llx, int lly, int nx, int ny, float offset) {
        float[][] data = new float[ny][nx];
        for (int row = 0; row < ny; row++) {
            for (int column = 0; column < nx; column++) {
                data[row][column] = offset + row * 0.5f - column * 1.25f;
            }
        }
        return new Window(data, llx, lly, 2, 1);
    }

    private static Frame frame() {
        Map<String, HeaderItem> header = new LinkedHashMap<>();
        header.put("Instrument", new HeaderItem(HeaderItem.Type.DIR, null, "Instrument settings"));
        header.put("Instrument.Gain", new HeaderItem(HeaderItem.Type.DOUBLE, 1.13, "Electrons per count"));
        header.put("Instrument.Speed", new HeaderItem(HeaderItem.Type.INT, -3, ""));
        header.put("Instrument.Serial", new HeaderItem(HeaderItem.Type.UINT, 4000000000L, "Serial number"));
        header.put("Run.Exposure", new HeaderItem(HeaderItem.Type.FLOAT, 2.5f, "Seconds"));
        header.put("Run.Object", new HeaderItem(HeaderItem.Type.STRING, "Flat field é", "Target"));
        header.put("Run.Dark", new HeaderItem(HeaderItem.Type.BOOL, Boolean.TRUE, "Shutter closed"));
        header.put("Run.Time", new HeaderItem(HeaderItem.Type.TIME, new HeaderItem.Time(55000, 12.25), "Mid exposure"));
        header.put("Run.Offsets", new HeaderItem(HeaderItem.Type.DVECTOR, new double[]{0.5, -1.5}, "Offsets"));
        header.put("Run.Flags", new HeaderItem(HeaderItem.Type.UCHAR, (byte) 7, "Flags"));
        header.put("Run.Port", new HeaderItem(HeaderItem.Type.USINT, 60000, "Port"));
        header.put("Run.Order", new HeaderItem(HeaderItem.Type.IVECTOR, new int[]{3, 1, 2}, "Read order"));
        header.put("Run.Weights", new HeaderItem(HeaderItem.Type.FVECTOR, new float[]{0.25f}, "Weights"));
        List<List<Window>> ccds = Arrays.asList(
                Arrays.asList(window(1, 1, 8, 4, 100), window(101, 51, 3, 2, 50)),
                Collections.<Window>emptyList(),
                Collections.singletonList(window(21, 11, 5, 6, 10)));
        return new Frame(header, ccds, 2, 1, 1080, 1032);
    }

    @Test
    public void testWriteAndRead() throws IOException {
        Path path = folder.getRoot().toPath().resolve("frame.ucm");
        Frame frame = frame();
        UcmFrameIO io = new UcmFrameIO();
        io.write(frame, path);
        Frame read = io.read(path);

        assertEquals(3, read.getNumberOfCcds());
        assertEquals(2, read.getWindows(0).size());
        assertEquals(0, read.getWindows(1).size());
        assertEquals(1080, read.getNxtot());
        assertEquals(1032, read.getNytot());
        assertEquals(frame.getWindows(2), read.getWindows(2));
        assertEquals(Arrays.asList(frame.getHeader().keySet().toArray()), Arrays.asList(read.getHeader().keySet().toArray()));
        assertEquals(4000000000L, read.getHeader().get("Instrument.Serial").getValue());
        assertEquals("Flat field é", read.getHeader().get("Run.Object").getValue());
        assertNull(read.getHeader().get("Instrument").getValue());
        assertArrayEquals(new int[]{3, 1, 2}, (int[]) read.getHeader().get("Run.Order").getValue());
        assertEquals(frame, read);
    }

    @Test
    public void testWrittenLittleEndian() throws IOException {
        Path path = folder.getRoot().toPath().resolve("frame.ucm");
        new UcmFrameIO().write(frame(), path);
        byte[] bytes = Files.readAllBytes(path);
        assertEquals(UcmFrameIO.MAGIC, ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getInt());
    }

    @Test
    public void testReadBigEndianUnsignedShorts() throws IOException {
        ByteBuffer bb = ByteBuffer.allocate(256).order(ByteOrder.BIG_ENDIAN);
        bb.putInt(UcmFrameIO.MAGIC);
        bb.putInt(1);
        putString(bb, "Run.Number");
        bb.putInt(HeaderItem.Type.INT.getCode());
        putString(bb, "Run number");
        bb.putInt(42);
        bb.putInt(1);
        bb.putInt(1);
        for (int value : new int[]{5, 7, 3, 2, 1, 1, 1024, 1024, 1}) {
            bb.putInt(value);
        }
        for (int value : new int[]{0, 1, 65535, 1000, 2, 3}) {
            bb.putShort((short) value);
        }
        Path path = folder.getRoot().toPath().resolve("big.ucm");
        Files.write(path, Arrays.copyOf(bb.array(), bb.position()));

        Frame frame = new UcmFrameIO().read(path);
        assertEquals(42, frame.getHeader().get("Run.Number").getValue());
        Window window = frame.getWindows(0).get(0);
        assertEquals(5, window.getLlx());
        assertEquals(7, window.getLly());
        assertEquals(3, window.getNx());
        assertEquals(2, window.getNy());
        assertArrayEquals(new float[]{0, 1, 65535}, window.getData()[0], 0);
        assertArrayEquals(new float[]{1000, 2, 3}, window.getData()[1], 0);
    }

    @Test
    public void testBadMagic() throws IOException {
        Path path = folder.getRoot().toPath().resolve("bad.ucm");
        Files.write(path, new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
        try {
            new UcmFrameIO().read(path);
            fail("Not a ucm file");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("first 4 bytes"));
        }
    }

    @Test(expected = IOException.class)
    public void testTruncated() throws IOException {
        Path path = folder.getRoot().toPath().resolve("frame.ucm");
        new UcmFrameIO().write(frame(), path);
        byte[] bytes = Files.readAllBytes(path);
        Files.write(path, Arrays.copyOf(bytes, bytes.length - 10));
        new UcmFrameIO().read(path);
    }

    @Test
    public void testUnsupportedHeaderType() throws IOException {
        ByteBuffer bb = ByteBuffer.allocate(64).order(ByteOrder.LITTLE_ENDIAN);
        bb.putInt(UcmFrameIO.MAGIC);
        bb.putInt(1);
        putString(bb, "Run.Date");
        bb.putInt(HeaderItem.Type.DATE.getCode());
        putString(bb, "");
        Path path = folder.getRoot().toPath().resolve("date.ucm");
        Files.write(path, Arrays.copyOf(bb.array(), bb.position()));
        try {
            new UcmFrameIO().read(path);
            fail("Dates are not supported");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("Run.Date"));
        }
    }

    @Test
    public void testFormatSelection() {
        assertTrue(FrameIO.forName("flat.fits") instanceof FitsFrameIO);
        assertTrue(FrameIO.forName("FLAT.FIT") instanceof FitsFrameIO);
        assertTrue(FrameIO.forName("flat") instanceof UcmFrameIO);
        assertEquals("flat.ucm", FrameIO.resolve("flat").toString());
        assertEquals("flat.ucm", FrameIO.resolve("flat.ucm").toString());
        assertEquals("flat.fts", FrameIO.resolve("flat.fts").toString());
    }

    private static void putString(ByteBuffer bb, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.ISO_8859_1);
        bb.putInt(bytes.length);
        bb.put(bytes);
    }
}
