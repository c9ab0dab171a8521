package com.anodi.server.image;

import com.anodi.server.ai.BinaryImage;
import com.anodi.server.ai.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads image files and turns them into binary images with
 * {@link OtsuBinarizer}. Unreadable files fail here, before any histogram
 * work starts.
 */
public class PngImageLoader {

    private static final Logger logger = LoggerFactory.getLogger(PngImageLoader.class);

    public static int[][] readGrey(File file) throws IOException {
        BufferedImage bi = ImageIO.read(file);
        if (bi == null) {
            throw new ValidationException("Not a readable image: " + file);
        }
        int width = bi.getWidth();
        int height = bi.getHeight();
        int[][] pixels = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int clr = bi.getRGB(x, y);
                int red = (clr & 0x00ff0000) >> 16;
                int green = (clr & 0x0000ff00) >> 8;
                int blue = clr & 0x000000ff;
                pixels[y][x] = (red + green + blue) / 3;
            }
        }
        return pixels;
    }

    public static BinaryImage load(File file) throws IOException {
        BinaryImage img = OtsuBinarizer.binarize(readGrey(file));
        logger.debug("Loaded {} as {} ({} foreground pixels)", file, img, img.countOnes());
        return img;
    }

    /**
     * Loads every .png file of a directory, sorted by file name.
     */
    public static List<BinaryImage> loadDirectory(Path dir, List<String> namesOut) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".png"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        List<BinaryImage> images = new ArrayList<>();
        for (Path file : files) {
            images.add(load(file.toFile()));
            if (namesOut != null) {
                namesOut.add(file.getFileName().toString());
            }
        }
        logger.info("Loaded {} images from {}", images.size(), dir);
        return images;
    }
}
