package org.ultracam.snorm.fit;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;

/**
 * Linear least squares through a Householder QR decomposition of the design
 * matrix.
 *
 * @author ultracam
 */
final class LeastSquares {

    // Diagonal elements of R below this are taken as rank deficiency
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private LeastSquares() {
    }

    static double[] solve(double[][] design, double[] y) throws FitDegeneracyException {
        int nParameters = design.length == 0 ? 0 : design[0].length;
        if (design.length < nParameters || nParameters == 0) {
            throw new FitDegeneracyException(String.format("%d samples cannot constrain %d parameters", design.length, nParameters));
        }
        QRDecomposition qr = new QRDecomposition(new Array2DRowRealMatrix(design, false), SINGULARITY_THRESHOLD);
        DecompositionSolver solver = qr.getSolver();
        if (!solver.isNonSingular()) {
            throw new FitDegeneracyException(String.format("Design matrix of %d samples by %d parameters is rank deficient", design.length, nParameters));
        }
        RealVector solution = solver.solve(new ArrayRealVector(y, false));
        return solution.toArray();
    }
}
