package de.recon.diagnosis.classifier.boosting;

import smile.data.DataFrame;
import smile.data.measure.NominalScale;
import smile.data.type.DataTypes;
import smile.data.type.StructField;
import smile.data.vector.BaseVector;
import smile.data.vector.DoubleVector;
import smile.data.vector.IntVector;

import java.util.List;

/**
 * Column layout shared by training and prediction. Categorical features become nominal
 * integer columns so the trees split them by category, never one-hot.
 */
final class SmileFrames {

    static final String RESPONSE = "diagnosis_class";

    // trees cannot route NaN; missing amounts sort below every real value
    static final double MISSING = -Double.MAX_VALUE / 4;

    private SmileFrames() {
    }

    static DataFrame frame(List<String> featureNames, int[] cardinalities, double[][] x, int[] y) {
        BaseVector<?, ?, ?>[] columns = new BaseVector<?, ?, ?>[featureNames.size() + 1];
        for (int j = 0; j < featureNames.size(); j++) {
            String name = featureNames.get(j);
            if (cardinalities[j] > 0) {
                int[] codes = new int[x.length];
                for (int i = 0; i < x.length; i++) {
                    codes[i] = (int) x[i][j];
                }
                columns[j] = IntVector.of(new StructField(name, DataTypes.IntegerType, levels(cardinalities[j])), codes);
            } else {
                double[] values = new double[x.length];
                for (int i = 0; i < x.length; i++) {
                    values[i] = Double.isNaN(x[i][j]) ? MISSING : x[i][j];
                }
                columns[j] = DoubleVector.of(name, values);
            }
        }
        columns[featureNames.size()] = IntVector.of(RESPONSE, y);
        return DataFrame.of(columns);
    }

    private static NominalScale levels(int cardinality) {
        String[] levels = new String[cardinality];
        for (int c = 0; c < cardinality; c++) {
            levels[c] = String.valueOf(c);
        }
        return new NominalScale(levels);
    }
}
