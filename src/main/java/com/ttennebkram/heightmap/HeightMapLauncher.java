package com.ttennebkram.heightmap;

import com.ttennebkram.heightmap.config.HeightMapSettings;
import com.ttennebkram.heightmap.config.SettingsSerializer;
import com.ttennebkram.heightmap.error.HeightMapException;
import com.ttennebkram.heightmap.grid.HeightGrid;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.util.MatConverter;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command line entry point.
 *
 * With no image argument, runs the pipeline on a built-in 5x5 gradient and prints the
 * resulting heights. With an image, loads it as grayscale through OpenCV, runs the pipeline
 * and optionally writes the heights (float TIFF/EXR, otherwise a normalized 16-bit image).
 */
public class HeightMapLauncher {

    private static final Logger log = LoggerFactory.getLogger(HeightMapLauncher.class);

    static final int[][] SAMPLE_IMAGE = {
        {10, 20, 30, 40, 50},
        {15, 25, 35, 45, 55},
        {20, 30, 40, 50, 60},
        {25, 35, 45, 55, 65},
        {30, 40, 50, 60, 70}
    };
    static final float SAMPLE_SCALE = 13.25f;

    private static final String USAGE = String.join("\n",
            "Usage: heightmap [options] [image]",
            "  --settings <file>   JSON filter settings",
            "  --scale <float>     intensity to height multiplier (default 13.25)",
            "  --width <int>       output width (default: image width)",
            "  --height <int>      output height (default: image height)",
            "  --output <file>     write heights (.tif/.tiff/.exr as float, others 16-bit normalized)");

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parse arguments and run. Returns the process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, nu.pattern.OpenCV::loadLocally);
    }

    /**
     * Same as {@link #run(String[], PrintStream, PrintStream)} with the step that loads the
     * OpenCV native library supplied by the caller.
     */
    static int run(String[] args, PrintStream out, PrintStream err, Runnable openCvLoader) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        try {
            HeightMapSettings settings = options.settingsPath == null
                    ? HeightMapSettings.defaults()
                    : SettingsSerializer.load(options.settingsPath);
            HeightMapGenerator generator = new HeightMapGenerator(settings);

            if (options.imagePath == null) {
                runSample(generator, options, out);
            } else {
                loadOpenCv(openCvLoader);
                runImage(generator, options, out);
            }
            return 0;
        } catch (HeightMapException | IOException e) {
            log.error("Height map generation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void runSample(HeightMapGenerator generator, Options options, PrintStream out) {
        IntensityGrid image = IntensityGrid.of(SAMPLE_IMAGE);
        int width = options.width > 0 ? options.width : image.width();
        int height = options.height > 0 ? options.height : image.height();
        float scale = options.scale != null ? options.scale : SAMPLE_SCALE;

        HeightGrid heights = generator.generate(image, scale, width, height);
        print(heights, out);
    }

    private static void loadOpenCv(Runnable openCvLoader) {
        try {
            openCvLoader.run();
        } catch (RuntimeException | LinkageError e) {
            throw new HeightMapException("Could not load the OpenCV native library: " + e, e);
        }
    }

    private static void runImage(HeightMapGenerator generator, Options options, PrintStream out) throws IOException {
        Mat mat = Imgcodecs.imread(options.imagePath, Imgcodecs.IMREAD_GRAYSCALE);
        IntensityGrid image;
        try {
            if (mat.empty()) {
                throw new IOException("Could not read image: " + options.imagePath);
            }
            image = MatConverter.toIntensityGrid(mat);
        } finally {
            mat.release();
        }
        log.info("Loaded {} as {}", options.imagePath, image);

        int width = options.width > 0 ? options.width : image.width();
        int height = options.height > 0 ? options.height : image.height();
        float scale = options.scale != null ? options.scale : 1.0f;
        HeightGrid heights = generator.generate(image, scale, width, height);
        out.printf(Locale.ROOT, "%dx%d heights, min %.2f, max %.2f%n",
                heights.width(), heights.height(), heights.min(), heights.max());

        if (options.outputPath != null) {
            write(heights, options.outputPath);
            log.info("Wrote {} to {}", heights, options.outputPath);
        }
    }

    private static void write(HeightGrid heights, String path) throws IOException {
        Mat floats = MatConverter.toMat(heights);
        Mat encoded = floats;
        try {
            String lower = path.toLowerCase(Locale.ROOT);
            if (!(lower.endsWith(".tif") || lower.endsWith(".tiff") || lower.endsWith(".exr"))) {
                encoded = new Mat();
                Core.normalize(floats, encoded, 0, 65535, Core.NORM_MINMAX, CvType.CV_16UC1);
            }
            if (!Imgcodecs.imwrite(path, encoded)) {
                throw new IOException("Could not write image: " + path);
            }
        } finally {
            if (encoded != floats) {
                encoded.release();
            }
            floats.release();
        }
    }

    /**
     * One row per line, tab separated, two decimals.
     */
    static void print(HeightGrid heights, PrintStream out) {
        for (int row = 0; row < heights.height(); row++) {
            StringBuilder line = new StringBuilder();
            for (int col = 0; col < heights.width(); col++) {
                line.append(String.format(Locale.ROOT, "%.2f", heights.get(row, col))).append('\t');
            }
            out.println(line);
        }
    }

    /**
     * Parsed command line.
     */
    static final class Options {
        Path settingsPath;
        Float scale;
        int width;
        int height;
        String outputPath;
        String imagePath;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--settings":
                        options.settingsPath = Paths.get(value(args, ++i, arg));
                        break;
                    case "--scale":
                        options.scale = parseFloat(value(args, ++i, arg), arg);
                        break;
                    case "--width":
                        options.width = parsePositiveInt(value(args, ++i, arg), arg);
                        break;
                    case "--height":
                        options.height = parsePositiveInt(value(args, ++i, arg), arg);
                        break;
                    case "--output":
                        options.outputPath = value(args, ++i, arg);
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (options.imagePath != null) {
                            throw new IllegalArgumentException("Only one image may be given");
                        }
                        options.imagePath = arg;
                }
            }
            if (options.outputPath != null && options.imagePath == null) {
                throw new IllegalArgumentException("--output needs an input image");
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[index];
        }

        private static float parseFloat(String text, String option) {
            try {
                return Float.parseFloat(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number, got " + text);
            }
        }

        private static int parsePositiveInt(String text, String option) {
            int value;
            try {
                value = Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects an integer, got " + text);
            }
            if (value <= 0) {
                throw new IllegalArgumentException(option + " must be > 0, got " + text);
            }
            return value;
        }
    }
}
