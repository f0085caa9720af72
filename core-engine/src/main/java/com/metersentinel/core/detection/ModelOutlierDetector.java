package com.metersentinel.core.detection;

import com.metersentinel.core.ml.OutlierModel;
import com.metersentinel.core.model.DetectionMethod;

import java.util.Optional;

/**
 * Applies the trained outlier model's decision function to each reading.
 *
 * @since 1.0.0
 */
public class ModelOutlierDetector implements WindowDetector {

    @Override
    public boolean[] detect(DetectionContext context) {
        boolean[] flags = new boolean[context.size()];
        Optional<OutlierModel> model = context.getOutlierModel();
        if (model.isEmpty()) {
            return flags;
        }
        OutlierModel outlierModel = model.get();
        for (int i = 0; i < flags.length; i++) {
            flags[i] = outlierModel.isOutlier(context.getReadings().get(i));
        }
        return flags;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.MODEL_OUTLIER;
    }
}
