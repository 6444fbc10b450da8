package org.ultracam.snorm.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.util.ArrayFuncs;
import nom.tam.util.BufferedFile;
import org.ultracam.snorm.Frame;
import org.ultracam.snorm.Window;

/**
 * Stores a frame as a FITS file with one image HDU per window. The window
 * geometry is kept in the keywords {@code CCD} (starting at 1), {@code NCCD},
 * {@code LLX}, {@code LLY}, {@code XBIN}, {@code YBIN}, {@code NXTOT} and
 * {@code NYTOT}. HDUs without data are skipped when reading.
 *
 * @author ultracam
 */
public class FitsFrameIO implements FrameIO {

    private static final Logger LOG = Logger.getLogger(FitsFrameIO.class.getName());

    @Override
    public Frame read(Path path) throws IOException {
        List<List<Window>> ccds = new ArrayList<>();
        int xbin = 0;
        int ybin = 0;
        int nxtot = 0;
        int nytot = 0;
        try (Fits fits = new Fits(path.toFile())) {
            for (BasicHDU<?> hdu = fits.readHDU(); hdu != null; hdu = fits.readHDU()) {
                int[] axes = hdu.getAxes();
                if (!(hdu instanceof ImageHDU) || axes == null || axes.length == 0) {
                    continue;
                }
                if (axes.length != 2) {
                    throw new IOException("Expected 2-D image in " + path + ", found " + axes.length + " axes");
                }
                Header header = hdu.getHeader();
                int ccd = header.getIntValue("CCD", 1);
                int nccd = header.getIntValue("NCCD", ccd);
                if (ccd < 1 || ccd > nccd) {
                    throw new IOException("Invalid CCD number " + ccd + " of " + nccd + " in " + path);
                }
                int hduXbin = header.getIntValue("XBIN", 1);
                int hduYbin = header.getIntValue("YBIN", 1);
                if (xbin == 0) {
                    xbin = hduXbin;
                    ybin = hduYbin;
                } else if (xbin != hduXbin || ybin != hduYbin) {
                    throw new IOException("Inconsistent binning factors in " + path);
                }
                nxtot = Math.max(nxtot, header.getIntValue("NXTOT", 0));
                nytot = Math.max(nytot, header.getIntValue("NYTOT", 0));
                while (ccds.size() < nccd) {
                    ccds.add(new ArrayList<>());
                }
                float[][] data = toFloat(((ImageHDU) hdu).getKernel(), hdu.getBScale(), hdu.getBZero());
                Window window = new Window(data, header.getIntValue("LLX", 1), header.getIntValue("LLY", 1), hduXbin, hduYbin);
                ccds.get(ccd - 1).add(window);
            }
        } catch (FitsException x) {
            throw new IOException("Error reading FITS frame " + path, x);
        } catch (IllegalArgumentException x) {
            throw new IOException("Invalid window geometry in " + path, x);
        }
        if (xbin == 0) {
            throw new IOException("No image data in " + path);
        }
        LOG.log(Level.FINE, "Read {0} CCDs from {1}", new Object[]{ccds.size(), path});
        try {
            return new Frame(Collections.emptyMap(), ccds, xbin, ybin, nxtot, nytot);
        } catch (IllegalArgumentException x) {
            throw new IOException("Invalid window geometry in " + path, x);
        }
    }

    private static float[][] toFloat(Object kernel, double bscale, double bzero) throws IOException {
        if (kernel == null) {
            throw new IOException("Image HDU without data");
        }
        float[][] data = (float[][]) ArrayFuncs.convertArray(kernel, float.class);
        if (bscale != 1.0 || bzero != 0.0) {
            for (float[] row : data) {
                for (int i = 0; i < row.length; i++) {
                    row[i] = (float) (row[i] * bscale + bzero);
                }
            }
        }
        return data;
    }

    @Override
    public void write(Frame frame, Path path) throws IOException {
        try (Fits fits = new Fits()) {
            int nccd = frame.getNumberOfCcds();
            for (int ccd = 0; ccd < nccd; ccd++) {
                for (Window window : frame.getWindows(ccd)) {
                    BasicHDU<?> hdu = Fits.makeHDU(window.getData());
                    hdu.addValue("CCD", ccd + 1, "CCD number, starting at 1");
                    hdu.addValue("NCCD", nccd, "Number of CCDs in the frame");
                    hdu.addValue("LLX", window.getLlx(), "X of lower-left pixel");
                    hdu.addValue("LLY", window.getLly(), "Y of lower-left pixel");
                    hdu.addValue("XBIN", window.getXbin(), "X binning factor");
                    hdu.addValue("YBIN", window.getYbin(), "Y binning factor");
                    hdu.addValue("NXTOT", frame.getNxtot(), "Unbinned detector width");
                    hdu.addValue("NYTOT", frame.getNytot(), "Unbinned detector height");
                    fits.addHDU(hdu);
                }
            }
            if (fits.getNumberOfHDUs() == 0) {
                throw new IOException("Frame has no windows to write to " + path);
            }
            Files.deleteIfExists(path);
            try (BufferedFile bf = new BufferedFile(path.toFile(), "rw")) {
                fits.write(bf);
            }
        } catch (FitsException x) {
            throw new IOException("Error writing FITS frame " + path, x);
        }
        LOG.log(Level.FINE, "Wrote {0} to {1}", new Object[]{frame, path});
    }
}
