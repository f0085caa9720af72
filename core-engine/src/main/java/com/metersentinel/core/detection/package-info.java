/**
 * Multi-method anomaly detection with consensus voting.
 *
 * <p>
 * Every detector implements
 * {@link com.metersentinel.core.detection.WindowDetector}; the standard five
 * are built by {@link com.metersentinel.core.detection.DetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.metersentinel.core.detection.IqrDetector}: Tukey fences</li>
 * <li>{@link com.metersentinel.core.detection.ZScoreDetector}: ± N × σ</li>
 * <li>{@link com.metersentinel.core.detection.ModelOutlierDetector}: trained
 * forest</li>
 * <li>{@link com.metersentinel.core.detection.MovingAverageDetector}: trailing
 * rolling mean</li>
 * <li>{@link com.metersentinel.core.detection.ForecastResidualDetector}:
 * distance from the forecast</li>
 * </ul>
 *
 * <p>
 * {@link com.metersentinel.core.detection.AnomalyConsensusEngine} combines
 * their votes, then hands confirmed anomalies to the classifier and the
 * severity scorer.
 * </p>
 *
 * @since 1.0.0
 */
package com.metersentinel.core.detection;
