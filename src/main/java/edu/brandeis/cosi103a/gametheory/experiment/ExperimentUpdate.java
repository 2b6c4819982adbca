package edu.brandeis.cosi103a.gametheory.experiment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Partial update of an experiment; empty fields are left unchanged.
 */
public record ExperimentUpdate(
    Optional<String> name,
    Optional<String> hypothesis,
    Optional<String> description,
    Optional<ExperimentConfig> config,
    Optional<List<String>> tags,
    Optional<ExperimentStatus> status
) {
    public static ExperimentUpdate none() {
        return new ExperimentUpdate(Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static ExperimentUpdate ofStatus(ExperimentStatus status) {
        return none().withStatus(status);
    }

    public ExperimentUpdate withName(String value) {
        return new ExperimentUpdate(Optional.of(value), hypothesis, description, config, tags, status);
    }

    public ExperimentUpdate withHypothesis(String value) {
        return new ExperimentUpdate(name, Optional.of(value), description, config, tags, status);
    }

    public ExperimentUpdate withDescription(String value) {
        return new ExperimentUpdate(name, hypothesis, Optional.of(value), config, tags, status);
    }

    public ExperimentUpdate withConfig(ExperimentConfig value) {
        return new ExperimentUpdate(name, hypothesis, description, Optional.of(value), tags, status);
    }

    public ExperimentUpdate withTags(List<String> value) {
        return new ExperimentUpdate(name, hypothesis, description, config, Optional.of(value), status);
    }

    public ExperimentUpdate withStatus(ExperimentStatus value) {
        return new ExperimentUpdate(name, hypothesis, description, config, tags, Optional.of(value));
    }

    Experiment applyTo(Experiment experiment, Instant now) {
        return new Experiment(
            experiment.id(),
            name.orElse(experiment.name()),
            hypothesis.orElse(experiment.hypothesis()),
            description.orElse(experiment.description()),
            config.orElse(experiment.config()),
            tags.orElse(experiment.tags()),
            status.orElse(experiment.status()),
            experiment.createdAt(),
            now);
    }
}
