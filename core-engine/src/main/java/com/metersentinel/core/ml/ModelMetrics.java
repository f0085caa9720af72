package com.metersentinel.core.ml;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forecast accuracy on a held-out split.
 *
 * <p>
 * POJO with a no-arg constructor so it round-trips through Jackson in the
 * registry's history log.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelMetrics {

    private double mae;
    private double rmse;
    private double mape;
    private double r2;

    /** No-arg constructor required by Jackson. */
    public ModelMetrics() {
    }

    public ModelMetrics(double mae, double rmse, double mape, double r2) {
        this.mae = mae;
        this.rmse = rmse;
        this.mape = mape;
        this.r2 = r2;
    }

    /**
     * @return metrics keyed by their conventional names
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("MAE", mae);
        map.put("RMSE", rmse);
        map.put("MAPE", mape);
        map.put("R2", r2);
        return map;
    }

    public double getMae() {
        return mae;
    }

    public void setMae(double mae) {
        this.mae = mae;
    }

    public double getRmse() {
        return rmse;
    }

    public void setRmse(double rmse) {
        this.rmse = rmse;
    }

    public double getMape() {
        return mape;
    }

    public void setMape(double mape) {
        this.mape = mape;
    }

    public double getR2() {
        return r2;
    }

    public void setR2(double r2) {
        this.r2 = r2;
    }

    @Override
    public String toString() {
        return String.format("ModelMetrics{MAE=%.4f, RMSE=%.4f, MAPE=%.2f%%, R2=%.4f}", mae, rmse, mape, r2);
    }
}
