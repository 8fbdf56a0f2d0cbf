package com.fabric.shared.capability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered step groups. Groups run one after another; the steps inside one group are
 * independent and run simultaneously.
 */
@Getter
public final class SagaDefinition {

    private final List<List<StepDefinition>> groups;

    private SagaDefinition(List<List<StepDefinition>> groups) {
        this.groups = groups;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<StepDefinition> step(String name) {
        return groups.stream()
                .flatMap(List::stream)
                .filter(s -> s.getName().equals(name))
                .findFirst();
    }

    public int stepCount() {
        return groups.stream().mapToInt(List::size).sum();
    }

    public static final class Builder {

        private final List<List<StepDefinition>> groups = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        public Builder step(StepDefinition step) {
            return parallel(step);
        }

        public Builder parallel(StepDefinition... steps) {
            if (steps.length == 0) {
                throw new IllegalArgumentException("A step group needs at least one step");
            }
            for (StepDefinition step : steps) {
                if (!names.add(step.getName())) {
                    throw new IllegalArgumentException("Duplicate step name: " + step.getName());
                }
            }
            groups.add(List.of(steps));
            return this;
        }

        public SagaDefinition build() {
            if (groups.isEmpty()) {
                throw new IllegalArgumentException("A saga needs at least one step");
            }
            return new SagaDefinition(List.copyOf(groups));
        }
    }
}
