package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.ResizeDimensions;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Optional;

/**
 * Scales the recolored image to an exact size with a smoothing filter.
 * Uses OpenCV when its native library loads, otherwise Java2D bicubic scaling.
 */
@Service
public class ResizeService {
    private static final Logger log = LoggerFactory.getLogger(ResizeService.class);

    private static final boolean OPENCV_AVAILABLE;

    static {
        boolean loaded = false;
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (Exception | UnsatisfiedLinkError e) {
            log.warn("OpenCV unavailable, falling back to Java2D resizing: {}", e.getMessage());
        }
        OPENCV_AVAILABLE = loaded;
    }

    private final boolean useOpenCv;

    public ResizeService() {
        this(true);
    }

    /** @param useOpenCv prefer OpenCV; ignored when the native library did not load */
    public ResizeService(boolean useOpenCv) {
        this.useOpenCv = useOpenCv && OPENCV_AVAILABLE;
    }

    public BufferedImage resize(BufferedImage image, Optional<ResizeDimensions> target) {
        if (target.isEmpty()) {
            return image;
        }
        ResizeDimensions dims = target.get();
        if (dims.width() == image.getWidth() && dims.height() == image.getHeight()) {
            return image;
        }

        log.debug("Resizing {}x{} -> {}", image.getWidth(), image.getHeight(), dims);
        return useOpenCv
                ? resizeWithOpenCv(image, dims.width(), dims.height())
                : resizeWithJava2d(image, dims.width(), dims.height());
    }

    private BufferedImage resizeWithOpenCv(BufferedImage image, int w, int h) {
        Mat src = bufferedImageToMat(image);
        Mat dst = new Mat();
        try {
            // area averaging to shrink, Lanczos to enlarge
            boolean shrinking = w <= image.getWidth() && h <= image.getHeight();
            int interpolation = shrinking ? Imgproc.INTER_AREA : Imgproc.INTER_LANCZOS4;
            Imgproc.resize(src, dst, new Size(w, h), 0, 0, interpolation);
            return matToBufferedImage(dst);
        } finally {
            src.release();
            dst.release();
        }
    }

    private BufferedImage resizeWithJava2d(BufferedImage image, int w, int h) {
        BufferedImage current = image;
        int cw = image.getWidth(), ch = image.getHeight();
        // halve step by step when shrinking so bicubic sampling does not skip source pixels
        do {
            int nextW = cw > w ? Math.max(w, cw / 2) : w;
            int nextH = ch > h ? Math.max(h, ch / 2) : h;
            current = drawScaled(current, nextW, nextH);
            cw = nextW;
            ch = nextH;
        } while (cw != w || ch != h);
        return current;
    }

    private static BufferedImage drawScaled(BufferedImage src, int w, int h) {
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(src, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    private static BufferedImage matToBufferedImage(Mat mat) {
        BufferedImage bgr = new BufferedImage(mat.cols(), mat.rows(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] pixels = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, pixels);

        BufferedImage rgb = new BufferedImage(mat.cols(), mat.rows(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        graphics.drawImage(bgr, 0, 0, null);
        graphics.dispose();
        return rgb;
    }
}
