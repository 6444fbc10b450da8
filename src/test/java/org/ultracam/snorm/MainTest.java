package org.ultracam.snorm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.ultracam.snorm.io.UcmFrameIO;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream prompts = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();

    private Main main(String stdin) {
        return new Main(new BufferedReader(new StringReader(stdin)), new PrintStream(prompts, true));
    }

    private int execute(String... args) {
        return main("").execute(args, new PrintStream(errors, true));
    }

    private String errors() {
        return new String(errors.toByteArray(), StandardCharsets.UTF_8);
    }

    private String[] args(String input, String output, String y1, String y2) {
        return new String[]{"null", "2", input, output, "5", "95", y1, y2, "10", "90", "-3", "3"};
    }

    @Test
    public void testSuccess() throws Exception {
        File input = new File(folder.getRoot(), "flat.ucm");
        File output = new File(folder.getRoot(), "norm.ucm");
        new UcmFrameIO().write(SpectralFlatNormalizerTest.flatField(), input.toPath());
        assertEquals(Main.EXIT_OK, execute(args(input.getPath(), output.getPath(), "1", "5")));
        assertTrue(output.exists());
    }

    @Test
    public void testValidationError() {
        String[] args = args("flat", "norm", "1", "5");
        args[5] = "5";
        assertEquals(Main.EXIT_VALIDATION, execute(args));
        assertTrue(errors(), errors().contains("x1 must be less than x2"));
    }

    @Test
    public void testMalformedNumber() {
        String[] args = args("flat", "norm", "1", "5");
        args[1] = "two";
        assertEquals(Main.EXIT_VALIDATION, execute(args));
    }

    @Test
    public void testConfigurationError() throws Exception {
        File input = new File(folder.getRoot(), "flat.ucm");
        new UcmFrameIO().write(SpectralFlatNormalizerTest.flatField(), input.toPath());
        assertEquals(Main.EXIT_CONFIGURATION, execute(args(input.getPath(), new File(folder.getRoot(), "norm").getPath(), "4", "9")));
    }

    @Test
    public void testFitError() throws Exception {
        File input = new File(folder.getRoot(), "flat.ucm");
        new UcmFrameIO().write(SpectralFlatNormalizerTest.flatField(), input.toPath());
        String[] args = args(input.getPath(), new File(folder.getRoot(), "norm").getPath(), "1", "5");
        // a degree 90 polynomial needs more than the 81 samples in [10, 90]
        args[10] = "-91";
        assertEquals(Main.EXIT_FIT, execute(args));
    }

    @Test
    public void testIOError() {
        File input = new File(folder.getRoot(), "missing.ucm");
        assertEquals(Main.EXIT_IO, execute(args(input.getPath(), new File(folder.getRoot(), "norm").getPath(), "1", "5")));
    }

    @Test
    public void testPrompting() throws Exception {
        NormalizationConfig config = main("5\n95\n1\n5\n10\n90\n4\n\n").parse(new String[]{"/null", "1", "flat", "norm"});
        assertEquals(5, config.getX1());
        assertEquals(95, config.getX2());
        assertEquals(4, config.getNcoeff());
        assertEquals(NormalizationConfig.DEFAULT_THRESHOLD, config.getThreshold(), 0);
        String shown = new String(prompts.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(shown, shown.contains("[3.0]"));
    }

    @Test
    public void testThresholdDefaultsWithoutPrompt() throws Exception {
        String[] args = {"null", "1", "flat", "norm", "5", "95", "1", "5", "10", "90", "-3"};
        NormalizationConfig config = main("").parse(args);
        assertEquals(NormalizationConfig.DEFAULT_THRESHOLD, config.getThreshold(), 0);
        assertEquals(0, prompts.size());
    }

    @Test
    public void testEndOfInput() throws Exception {
        try {
            main("5\n").parse(new String[]{"null", "1", "flat", "norm"});
            fail("Input ran out");
        } catch (ValidationException x) {
            assertTrue(x.getMessage().contains("No value"));
        }
    }

    @Test(expected = ValidationException.class)
    public void testTooManyArguments() throws Exception {
        main("").parse(new String[]{"null", "1", "flat", "norm", "5", "95", "1", "5", "10", "90", "-3", "3", "extra"});
    }
}
