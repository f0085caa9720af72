package com.metersentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the {@code meter-sentinel.yml} configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional; omitted values
 * keep their defaults):
 * </p>
 *
 * <pre>
 * detection:
 *   consensusThreshold: 3
 * classification:
 *   highAbsoluteKw: 7.0
 * severity:
 *   criticalScore: 80
 * validation:
 *   minDays: 30
 * training:
 *   windowDays: 90
 * registry:
 *   retrainingIntervalDays: 7
 * jobs:
 *   retrainingCheckTime: "03:00"
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private DetectionSettings detection = new DetectionSettings();
    private ClassificationSettings classification = new ClassificationSettings();
    private SeveritySettings severity = new SeveritySettings();
    private ValidationSettings validation = new ValidationSettings();
    private TrainingSettings training = new TrainingSettings();
    private RegistrySettings registry = new RegistrySettings();
    private JobSettings jobs = new JobSettings();

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception listing them.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        detection.validate(errors);
        classification.validate(errors);
        severity.validate(errors);
        validation.validate(errors);
        training.validate(errors);
        registry.validate(errors);
        jobs.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Meter Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public ClassificationSettings getClassification() {
        return classification;
    }

    public void setClassification(ClassificationSettings classification) {
        this.classification = classification != null ? classification : new ClassificationSettings();
    }

    public SeveritySettings getSeverity() {
        return severity;
    }

    public void setSeverity(SeveritySettings severity) {
        this.severity = severity != null ? severity : new SeveritySettings();
    }

    public ValidationSettings getValidation() {
        return validation;
    }

    public void setValidation(ValidationSettings validation) {
        this.validation = validation != null ? validation : new ValidationSettings();
    }

    public TrainingSettings getTraining() {
        return training;
    }

    public void setTraining(TrainingSettings training) {
        this.training = training != null ? training : new TrainingSettings();
    }

    public RegistrySettings getRegistry() {
        return registry;
    }

    public void setRegistry(RegistrySettings registry) {
        this.registry = registry != null ? registry : new RegistrySettings();
    }

    public JobSettings getJobs() {
        return jobs;
    }

    public void setJobs(JobSettings jobs) {
        this.jobs = jobs != null ? jobs : new JobSettings();
    }

    @Override
    public String toString() {
        return "SentinelConfig{detection=" + detection + '}';
    }
}
