package org.ultracam.snorm.io;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ultracam.snorm.Frame;
import org.ultracam.snorm.Window;

/**
 * Reads and writes the ULTRACAM native "ucm" frame format.
 *
 * A ucm file starts with a magic number, whose byte order gives the byte
 * order of the rest of the file, followed by the header entries and then, per
 * CCD, the number of windows and for each window its geometry and pixels.
 * Strings are stored as an int length followed by the characters. Pixels are
 * stored as 32-bit floats ({@code iout} 0) or unsigned 16-bit integers
 * ({@code iout} 1). Files are always written little-endian with float pixels.
 *
 * @author ultracam
 */
public class UcmFrameIO implements FrameIO {

    private static final Logger LOG = Logger.getLogger(UcmFrameIO.class.getName());

    public static final int MAGIC = 47561009;
    private static final int IOUT_FLOAT = 0;
    private static final int IOUT_USHORT = 1;

    @Override
    public Frame read(Path path) throws IOException {
        ByteBuffer bb = ByteBuffer.wrap(Files.readAllBytes(path));
        try {
            Frame frame = decode(bb, path);
            LOG.log(Level.FINE, "Read {0} from {1}", new Object[]{frame, path});
            return frame;
        } catch (BufferUnderflowException x) {
            throw new IOException("Truncated ucm file: " + path, x);
        } catch (IllegalArgumentException x) {
            throw new IOException("Invalid window geometry in " + path, x);
        }
    }

    private Frame decode(ByteBuffer bb, Path path) throws IOException {
        if (bb.remaining() < 4) {
            throw new IOException("Too short to be a ucm file: " + path);
        }
        bb.order(ByteOrder.LITTLE_ENDIAN);
        if (bb.getInt(0) != MAGIC) {
            bb.order(ByteOrder.BIG_ENDIAN);
            if (bb.getInt(0) != MAGIC) {
                throw new IOException("Could not recognise first 4 bytes of " + path + " as a ucm file");
            }
        }
        bb.position(4);

        int nItems = bb.getInt();
        if (nItems < 0) {
            throw new IOException("Invalid number of header items " + nItems + " in " + path);
        }
        Map<String, HeaderItem> header = new LinkedHashMap<>();
        for (int i = 0; i < nItems; i++) {
            String name = readString(bb);
            int code = bb.getInt();
            HeaderItem.Type type;
            try {
                type = HeaderItem.Type.forCode(code);
            } catch (IllegalArgumentException x) {
                throw new IOException("Header item " + name + " has unrecognised type " + code, x);
            }
            if (!type.isSupported()) {
                throw new IOException("Header item " + name + ": type " + type + " not enabled");
            }
            String comment = readString(bb);
            header.put(name, new HeaderItem(type, readValue(bb, name, type), comment));
        }

        int nccd = bb.getInt();
        if (nccd < 0) {
            throw new IOException("Invalid number of CCDs " + nccd + " in " + path);
        }
        List<List<Window>> ccds = new ArrayList<>(nccd);
        int xbin = 1;
        int ybin = 1;
        int nxtot = 0;
        int nytot = 0;
        for (int ccd = 0; ccd < nccd; ccd++) {
            int nwin = bb.getInt();
            if (nwin < 0) {
                throw new IOException("Invalid number of windows " + nwin + " for CCD " + (ccd + 1));
            }
            List<Window> windows = new ArrayList<>(nwin);
            for (int w = 0; w < nwin; w++) {
                int llx = bb.getInt();
                int lly = bb.getInt();
                int nx = bb.getInt();
                int ny = bb.getInt();
                xbin = bb.getInt();
                ybin = bb.getInt();
                nxtot = bb.getInt();
                nytot = bb.getInt();
                int iout = bb.getInt();
                windows.add(new Window(readPixels(bb, nx, ny, iout), llx, lly, xbin, ybin));
            }
            ccds.add(windows);
        }
        return new Frame(header, ccds, xbin, ybin, nxtot, nytot);
    }

    private static float[][] readPixels(ByteBuffer bb, int nx, int ny, int iout) throws IOException {
        int bytesPerPixel;
        if (iout == IOUT_FLOAT) {
            bytesPerPixel = 4;
        } else if (iout == IOUT_USHORT) {
            bytesPerPixel = 2;
        } else {
            throw new IOException("Data output type iout = " + iout + " not recognised");
        }
        if (nx < 0 || ny < 0 || (long) nx * ny * bytesPerPixel > bb.remaining()) {
            throw new IOException("Invalid or truncated window of " + nx + "x" + ny + " pixels");
        }
        float[][] data = new float[ny][nx];
        for (int row = 0; row < ny; row++) {
            for (int column = 0; column < nx; column++) {
                data[row][column] = iout == IOUT_FLOAT ? bb.getFloat() : (bb.getShort() & 0xffff);
            }
        }
        return data;
    }

    private static String readString(ByteBuffer bb) throws IOException {
        int length = bb.getInt();
        if (length < 0 || length > bb.remaining()) {
            throw new IOException("Invalid string length " + length);
        }
        byte[] bytes = new byte[length];
        bb.get(bytes);
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    private static Object readValue(ByteBuffer bb, String name, HeaderItem.Type type) throws IOException {
        switch (type) {
            case DOUBLE:
                return bb.getDouble();
            case INT:
                return bb.getInt();
            case UINT:
                return bb.getInt() & 0xffffffffL;
            case FLOAT:
                return bb.getFloat();
            case STRING:
                return readString(bb);
            case BOOL:
                return bb.get() != 0;
            case DIR:
                return null;
            case TIME:
                int mjd = bb.getInt();
                return new HeaderItem.Time(mjd, bb.getDouble());
            case DVECTOR: {
                double[] result = new double[readLength(bb, 8)];
                bb.asDoubleBuffer().get(result);
                bb.position(bb.position() + 8 * result.length);
                return result;
            }
            case UCHAR:
                return bb.get();
            case USINT:
                return bb.getShort() & 0xffff;
            case IVECTOR: {
                int[] result = new int[readLength(bb, 4)];
                bb.asIntBuffer().get(result);
                bb.position(bb.position() + 4 * result.length);
                return result;
            }
            case FVECTOR: {
                float[] result = new float[readLength(bb, 4)];
                bb.asFloatBuffer().get(result);
                bb.position(bb.position() + 4 * result.length);
                return result;
            }
            default:
                throw new IOException("Header item " + name + ": type " + type + " not enabled");
        }
    }

    private static int readLength(ByteBuffer bb, int elementSize) throws IOException {
        int length = bb.getInt();
        if (length < 0 || (long) length * elementSize > bb.remaining()) {
            throw new IOException("Invalid vector length " + length);
        }
        return length;
    }

    @Override
    public void write(Frame frame, Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ChannelWriter out = new ChannelWriter(channel);
            out.putInt(MAGIC);
            out.putInt(frame.getHeader().size());
            for (Map.Entry<String, HeaderItem> entry : frame.getHeader().entrySet()) {
                HeaderItem item = entry.getValue();
                if (!item.getType().isSupported()) {
                    throw new IOException("Header item " + entry.getKey() + ": type " + item.getType() + " not enabled");
                }
                out.putString(entry.getKey());
                out.putInt(item.getType().getCode());
                out.putString(item.getComment());
                try {
                    writeValue(out, entry.getKey(), item);
                } catch (ClassCastException x) {
                    throw new IOException("Header item " + entry.getKey() + " of type " + item.getType() + " has a value of class "
                            + (item.getValue() == null ? null : item.getValue().getClass().getSimpleName()), x);
                }
            }
            out.putInt(frame.getNumberOfCcds());
            for (List<Window> windows : frame.getCcds()) {
                out.putInt(windows.size());
                for (Window window : windows) {
                    out.putInt(window.getLlx());
                    out.putInt(window.getLly());
                    out.putInt(window.getNx());
                    out.putInt(window.getNy());
                    out.putInt(window.getXbin());
                    out.putInt(window.getYbin());
                    out.putInt(frame.getNxtot());
                    out.putInt(frame.getNytot());
                    out.putInt(IOUT_FLOAT);
                    for (float[] row : window.getData()) {
                        for (float pixel : row) {
                            out.putFloat(pixel);
                        }
                    }
                }
            }
            out.flush();
        }
        LOG.log(Level.FINE, "Wrote {0} to {1}", new Object[]{frame, path});
    }

    private static void writeValue(ChannelWriter out, String name, HeaderItem item) throws IOException {
        Object value = item.getValue();
        switch (item.getType()) {
            case DOUBLE:
                out.putDouble(((Number) value).doubleValue());
                break;
            case INT:
                out.putInt(((Number) value).intValue());
                break;
            case UINT:
                out.putInt((int) ((Number) value).longValue());
                break;
            case FLOAT:
                out.putFloat(((Number) value).floatValue());
                break;
            case STRING:
                out.putString((String) value);
                break;
            case BOOL:
                out.put((byte) (((Boolean) value) ? 1 : 0));
                break;
            case DIR:
                break;
            case TIME:
                HeaderItem.Time time = (HeaderItem.Time) value;
                out.putInt(time.getMjd());
                out.putDouble(time.getHour());
                break;
            case DVECTOR:
                double[] doubles = (double[]) value;
                out.putInt(doubles.length);
                for (double d : doubles) {
                    out.putDouble(d);
                }
                break;
            case UCHAR:
                out.put(((Number) value).byteValue());
                break;
            case USINT:
                out.putShort((short) ((Number) value).intValue());
                break;
            case IVECTOR:
                int[] ints = (int[]) value;
                out.putInt(ints.length);
                for (int i : ints) {
                    out.putInt(i);
                }
                break;
            case FVECTOR:
                float[] floats = (float[]) value;
                out.putInt(floats.length);
                for (float f : floats) {
                    out.putFloat(f);
                }
                break;
            default:
                throw new IOException("Header item " + name + ": type " + item.getType() + " not enabled");
        }
    }

    /**
     * Little-endian output through a fixed size buffer, flushed to the channel
     * whenever it fills.
     */
    private static class ChannelWriter {

        private final WritableByteChannel channel;
        private final ByteBuffer buffer = ByteBuffer.allocate(1 << 16).order(ByteOrder.LITTLE_ENDIAN);

        ChannelWriter(WritableByteChannel channel) {
            this.channel = channel;
        }

        private void ensure(int bytes) throws IOException {
            if (buffer.remaining() < bytes) {
                flush();
            }
        }

        void flush() throws IOException {
            buffer.flip();
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            buffer.clear();
        }

        void put(byte b) throws IOException {
            ensure(1);
            buffer.put(b);
        }

        void putShort(short s) throws IOException {
            ensure(2);
            buffer.putShort(s);
        }

        void putInt(int i) throws IOException {
            ensure(4);
            buffer.putInt(i);
        }

        void putFloat(float f) throws IOException {
            ensure(4);
            buffer.putFloat(f);
        }

        void putDouble(double d) throws IOException {
            ensure(8);
            buffer.putDouble(d);
        }

        void putString(String s) throws IOException {
            byte[] bytes = s.getBytes(StandardCharsets.ISO_8859_1);
            putInt(bytes.length);
            for (byte b : bytes) {
                put(b);
            }
        }
    }
}
