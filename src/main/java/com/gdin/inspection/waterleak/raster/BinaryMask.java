package com.gdin.inspection.waterleak.raster;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoublePredicate;

/**
 * 二值掩膜及其形态学操作、8 邻域连通域提取。
 * 结构元素为以中心为锚点的 k×k 矩形；栅格外的像素不参与腐蚀/膨胀。
 */
public final class BinaryMask {

    private final int rows;
    private final int cols;
    private final boolean[] bits;

    private BinaryMask(int rows, int cols, boolean[] bits) {
        this.rows = rows;
        this.cols = cols;
        this.bits = bits;
    }

    public static BinaryMask threshold(Raster scores, DoublePredicate anomalous) {
        double[] v = scores.values();
        boolean[] bits = new boolean[v.length];
        for (int i = 0; i < v.length; i++) {
            bits[i] = anomalous.test(v[i]);
        }
        return new BinaryMask(scores.rows(), scores.cols(), bits);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean get(int row, int col) {
        return bits[row * cols + col];
    }

    public int count() {
        int n = 0;
        for (boolean b : bits) {
            if (b) n++;
        }
        return n;
    }

    public BinaryMask close(int kernelSize) {
        if (kernelSize <= 1) return this;
        return dilate(kernelSize).erode(kernelSize);
    }

    public BinaryMask open(int kernelSize) {
        if (kernelSize <= 1) return this;
        return erode(kernelSize).dilate(kernelSize);
    }

    public BinaryMask dilate(int kernelSize) {
        return morph(kernelSize, true);
    }

    public BinaryMask erode(int kernelSize) {
        return morph(kernelSize, false);
    }

    /**
     * 矩形结构元素可分离：先按行、再按列各做一次一维窗口运算。
     */
    private BinaryMask morph(int kernelSize, boolean dilate) {
        if (kernelSize <= 1) return this;
        int before = (kernelSize - 1) / 2;
        int after = kernelSize - 1 - before;

        boolean[] horizontal = new boolean[bits.length];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int from = Math.max(0, c - before);
                int to = Math.min(cols - 1, c + after);
                horizontal[r * cols + c] = window(bits, r * cols + from, r * cols + to, 1, dilate);
            }
        }

        boolean[] out = new boolean[bits.length];
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                int from = Math.max(0, r - before);
                int to = Math.min(rows - 1, r + after);
                out[r * cols + c] = window(horizontal, from * cols + c, to * cols + c, cols, dilate);
            }
        }
        return new BinaryMask(rows, cols, out);
    }

    private static boolean window(boolean[] src, int first, int last, int step, boolean dilate) {
        for (int i = first; i <= last; i += step) {
            if (src[i] == dilate) {
                return dilate;
            }
        }
        return !dilate;
    }

    /**
     * 按光栅扫描顺序编号的 8 邻域连通域，背景不计入。
     */
    public List<ConnectedComponent> components() {
        int[] labels = new int[bits.length];
        List<ConnectedComponent> result = new ArrayList<>();
        int[] queue = new int[bits.length];
        int next = 1;

        for (int start = 0; start < bits.length; start++) {
            if (!bits[start] || labels[start] != 0) continue;

            int label = next++;
            int head = 0;
            int tail = 0;
            queue[tail++] = start;
            labels[start] = label;

            List<Integer> pixels = new ArrayList<>();
            double sumRow = 0;
            double sumCol = 0;

            while (head < tail) {
                int idx = queue[head++];
                int r = idx / cols;
                int c = idx % cols;
                pixels.add(idx);
                sumRow += r;
                sumCol += c;

                for (int dr = -1; dr <= 1; dr++) {
                    int nr = r + dr;
                    if (nr < 0 || nr >= rows) continue;
                    for (int dc = -1; dc <= 1; dc++) {
                        int nc = c + dc;
                        if ((dr == 0 && dc == 0) || nc < 0 || nc >= cols) continue;
                        int n = nr * cols + nc;
                        if (bits[n] && labels[n] == 0) {
                            labels[n] = label;
                            queue[tail++] = n;
                        }
                    }
                }
            }

            int[] idx = pixels.stream().mapToInt(Integer::intValue).toArray();
            result.add(new ConnectedComponent(label, idx, cols, sumRow / idx.length, sumCol / idx.length));
        }
        return result;
    }
}
