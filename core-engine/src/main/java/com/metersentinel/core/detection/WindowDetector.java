package com.metersentinel.core.detection;

import com.metersentinel.core.model.DetectionMethod;

/**
 * Contract for the independent detectors that vote in the consensus engine.
 *
 * <p>
 * Implementations are <strong>stateless</strong> and order-independent: the
 * same context always produces the same flags, whatever other detectors ran
 * before.
 * </p>
 *
 * @since 1.0.0
 */
public interface WindowDetector {

    /**
     * Flag readings in the context.
     *
     * @param context plausible readings plus optional models
     * @return one flag per reading, in context order
     */
    boolean[] detect(DetectionContext context);

    /**
     * @return the method this detector implements
     */
    DetectionMethod getMethod();
}
