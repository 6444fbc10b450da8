package org.ultracam.snorm.io;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import org.ultracam.snorm.Frame;

/**
 * Reads and writes frames in one file format.
 *
 * @author ultracam
 */
public interface FrameIO {

    String UCM_EXTENSION = ".ucm";

    Frame read(Path path) throws IOException;

    void write(Frame frame, Path path) throws IOException;

    /**
     * Choose the format from a file name. FITS names are used as given; any
     * other name is taken as a ucm file, with ".ucm" appended if missing.
     *
     * @param name The file name
     * @return The format to use
     */
    static FrameIO forName(String name) {
        return isFits(name) ? new FitsFrameIO() : new UcmFrameIO();
    }

    /**
     * The path a file name resolves to, with ".ucm" appended to ucm names that
     * lack it.
     *
     * @param name The file name
     * @return The path
     */
    static Path resolve(String name) {
        String trimmed = name.trim();
        if (isFits(trimmed) || trimmed.endsWith(UCM_EXTENSION)) {
            return Paths.get(trimmed);
        } else {
            return Paths.get(trimmed + UCM_EXTENSION);
        }
    }

    static boolean isFits(String name) {
        String lower = name.trim().toLowerCase(Locale.ROOT);
        return lower.endsWith(".fits") || lower.endsWith(".fit") || lower.endsWith(".fts");
    }
}
