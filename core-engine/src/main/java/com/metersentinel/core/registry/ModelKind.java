package com.metersentinel.core.registry;

/**
 * The two kinds of artifact the registry stores, each with its own
 * production pointer.
 *
 * @since 1.0.0
 */
public enum ModelKind {

    FORECASTING("forecasting", "best_forecasting"),
    OUTLIER("outlier", "best_outlier");

    private final String filePrefix;
    private final String pointerName;

    ModelKind(String filePrefix, String pointerName) {
        this.filePrefix = filePrefix;
        this.pointerName = pointerName;
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public String getPointerName() {
        return pointerName;
    }

    /**
     * @param versionId artifact version
     * @return file name of the artifact, e.g. {@code forecasting_v20240101_030000.json}
     */
    public String fileName(String versionId) {
        return filePrefix + "_" + versionId + ".json";
    }
}
