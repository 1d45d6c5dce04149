package com.example.chatfunctions.image;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Separable Gaussian blur over all four ARGB channels. Edges are extended by replicating the border
 * pixels so the blur does not darken or fade the image borders.
 *
 * <p>The file is rewritten in the format its content was decoded as, whatever its name says.
 */
@Component
public class GaussianBlurTransform implements ImageTransform {

    private final double sigma;

    public GaussianBlurTransform(@Value("${app.moderation.blur-sigma:24}") double sigma) {
        if (sigma <= 0) {
            throw new IllegalArgumentException("blur sigma must be positive: " + sigma);
        }
        this.sigma = sigma;
    }

    @Override
    public void blur(Path file) throws IOException {
        String format;
        BufferedImage source;
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) {
                throw new IOException("Cannot open image stream: " + file);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException("Not a readable image: " + file);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                format = reader.getFormatName().toLowerCase(Locale.ROOT);
                source = reader.read(0);
            } finally {
                reader.dispose();
            }
        }
        if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
            throw new IOException("No image writer for format '" + format + "': " + file);
        }

        BufferedImage blurred = blur(source);
        if (!hasAlphaSupport(format)) {
            blurred = copyTo(blurred, BufferedImage.TYPE_INT_RGB);
        }
        if (!ImageIO.write(blurred, format, file.toFile())) {
            throw new IOException("Could not write blurred image as '" + format + "': " + file);
        }
    }

    BufferedImage blur(BufferedImage source) {
        int radius = (int) Math.ceil(3 * sigma);
        float[] weights = kernel(radius);
        BufferedImage padded = pad(copyTo(source, BufferedImage.TYPE_INT_ARGB), radius);

        ConvolveOp horizontal = new ConvolveOp(new Kernel(weights.length, 1, weights), ConvolveOp.EDGE_NO_OP, null);
        ConvolveOp vertical = new ConvolveOp(new Kernel(1, weights.length, weights), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage result = vertical.filter(horizontal.filter(padded, null), null);

        return copyTo(result.getSubimage(radius, radius, source.getWidth(), source.getHeight()),
                BufferedImage.TYPE_INT_ARGB);
    }

    private float[] kernel(int radius) {
        float[] weights = new float[2 * radius + 1];
        double twoSigmaSq = 2 * sigma * sigma;
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            double w = Math.exp(-(i * i) / twoSigmaSq);
            weights[i + radius] = (float) w;
            sum += w;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= (float) sum;
        }
        return weights;
    }

    private static BufferedImage pad(BufferedImage image, int radius) {
        int w = image.getWidth();
        int h = image.getHeight();
        int pw = w + 2 * radius;
        int ph = h + 2 * radius;
        int[] src = image.getRGB(0, 0, w, h, null, 0, w);
        int[] dst = new int[pw * ph];
        for (int y = 0; y < ph; y++) {
            int sy = clamp(y - radius, h);
            for (int x = 0; x < pw; x++) {
                dst[y * pw + x] = src[sy * w + clamp(x - radius, w)];
            }
        }
        BufferedImage padded = new BufferedImage(pw, ph, BufferedImage.TYPE_INT_ARGB);
        padded.setRGB(0, 0, pw, ph, dst, 0, pw);
        return padded;
    }

    private static int clamp(int v, int size) {
        return v < 0 ? 0 : Math.min(v, size - 1);
    }

    private static BufferedImage copyTo(BufferedImage image, int type) {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage copy = new BufferedImage(w, h, type);
        copy.setRGB(0, 0, w, h, image.getRGB(0, 0, w, h, null, 0, w), 0, w);
        return copy;
    }

    private static boolean hasAlphaSupport(String format) {
        return format.equals("png") || format.equals("gif") || format.equals("tif") || format.equals("tiff");
    }
}
