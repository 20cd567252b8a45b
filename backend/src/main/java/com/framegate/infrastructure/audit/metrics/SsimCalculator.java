package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.PixelBuffer;
import org.springframework.stereotype.Component;

/**
 * Structural similarity over non-overlapping 11x11 blocks, standard SSIM constants
 * (K1=0.01, K2=0.03, L=255), computed per RGBA channel and combined with fixed weights.
 * <p>
 * A pixel is skipped only when it is transparent (alpha &lt; 128) in both images, so a missing
 * or extra limb still counts against the score. Blocks with fewer than 4 counted pixels are
 * ignored; with no valid block at all the images are treated as identical.
 * </p>
 */
@Component
public class SsimCalculator {

    static final int BLOCK_SIZE = 11;
    static final int MIN_PIXELS_PER_BLOCK = 4;
    private static final double L = 255.0;
    private static final double C1 = (0.01 * L) * (0.01 * L);
    private static final double C2 = (0.03 * L) * (0.03 * L);
    private static final double[] CHANNEL_WEIGHTS = {0.3, 0.4, 0.2, 0.1};

    public double compute(PixelBuffer a, PixelBuffer b) {
        if (!a.sameSize(b)) {
            throw new IllegalArgumentException("SSIM needs equal sizes: " + a + " vs " + b);
        }

        double total = 0.0;
        int blocks = 0;
        for (int by = 0; by < a.height(); by += BLOCK_SIZE) {
            for (int bx = 0; bx < a.width(); bx += BLOCK_SIZE) {
                double block = blockSsim(a, b, bx, by);
                if (!Double.isNaN(block)) {
                    total += block;
                    blocks++;
                }
            }
        }
        return blocks == 0 ? 1.0 : total / blocks;
    }

    private double blockSsim(PixelBuffer a, PixelBuffer b, int bx, int by) {
        int maxX = Math.min(bx + BLOCK_SIZE, a.width());
        int maxY = Math.min(by + BLOCK_SIZE, a.height());

        double[] sumA = new double[4];
        double[] sumB = new double[4];
        double[] sumAA = new double[4];
        double[] sumBB = new double[4];
        double[] sumAB = new double[4];
        int n = 0;

        for (int y = by; y < maxY; y++) {
            for (int x = bx; x < maxX; x++) {
                if (!a.isOpaque(x, y) && !b.isOpaque(x, y)) {
                    continue;
                }
                int pa = a.get(x, y);
                int pb = b.get(x, y);
                for (int c = 0; c < 4; c++) {
                    int va = channel(pa, c);
                    int vb = channel(pb, c);
                    sumA[c] += va;
                    sumB[c] += vb;
                    sumAA[c] += (double) va * va;
                    sumBB[c] += (double) vb * vb;
                    sumAB[c] += (double) va * vb;
                }
                n++;
            }
        }

        if (n < MIN_PIXELS_PER_BLOCK) {
            return Double.NaN;
        }

        double weighted = 0.0;
        for (int c = 0; c < 4; c++) {
            double muA = sumA[c] / n;
            double muB = sumB[c] / n;
            double varA = sumAA[c] / n - muA * muA;
            double varB = sumBB[c] / n - muB * muB;
            double cov = sumAB[c] / n - muA * muB;
            double ssim = ((2 * muA * muB + C1) * (2 * cov + C2))
                    / ((muA * muA + muB * muB + C1) * (varA + varB + C2));
            weighted += CHANNEL_WEIGHTS[c] * ssim;
        }
        return weighted;
    }

    private static int channel(int packed, int c) {
        return (packed >>> (24 - 8 * c)) & 0xFF;
    }
}
