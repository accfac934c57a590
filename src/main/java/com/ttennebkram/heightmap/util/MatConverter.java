package com.ttennebkram.heightmap.util;

import com.ttennebkram.heightmap.error.DegenerateInputException;
import com.ttennebkram.heightmap.grid.HeightGrid;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Converts between OpenCV Mats and pipeline grids.
 * Only single-channel 8-bit images are accepted as input; heights come out as CV_32FC1.
 * The OpenCV native library must already be loaded.
 */
public final class MatConverter {

    private MatConverter() {
    }

    /**
     * Copy a CV_8UC1 Mat into an intensity grid.
     *
     * @param mat The input Mat (not modified or released)
     * @throws DegenerateInputException if the Mat is null, empty or not CV_8UC1
     */
    public static IntensityGrid toIntensityGrid(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new DegenerateInputException("Input Mat is null or empty");
        }
        if (mat.type() != CvType.CV_8UC1) {
            throw new DegenerateInputException("Expected a single-channel 8-bit Mat (CV_8UC1), got "
                    + CvType.typeToString(mat.type()));
        }

        // Submats (ROIs) are not continuous; clone gives a packed copy
        Mat packed = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] samples = new byte[packed.rows() * packed.cols()];
            packed.get(0, 0, samples);
            return IntensityGrid.fromSamples(packed.cols(), packed.rows(), samples);
        } finally {
            if (packed != mat) {
                packed.release();
            }
        }
    }

    /**
     * Copy an intensity grid into a new CV_8UC1 Mat.
     * Caller must release the returned Mat.
     */
    public static Mat toMat(IntensityGrid grid) {
        Mat mat = new Mat(grid.height(), grid.width(), CvType.CV_8UC1);
        mat.put(0, 0, grid.samples());
        return mat;
    }

    /**
     * Copy a height grid into a new CV_32FC1 Mat.
     * Caller must release the returned Mat.
     */
    public static Mat toMat(HeightGrid grid) {
        Mat mat = new Mat(grid.height(), grid.width(), CvType.CV_32FC1);
        mat.put(0, 0, grid.samples());
        return mat;
    }
}
