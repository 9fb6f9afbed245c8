package io.netloom.templates;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable generation settings.
 */
public record GeneratorOptions(
    String baseTemplateSet,
    List<Path> templateRoots,
    int parallelism,
    boolean debug
) {

    public static final String DEFAULT_BASE_TEMPLATE_SET = TemplateSetSelector.DEFAULT_BASE_SET;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final int MAX_PARALLELISM = 64;

    public GeneratorOptions {
        Objects.requireNonNull(baseTemplateSet, "Base template set cannot be null");
        if (baseTemplateSet.isBlank()) {
            throw new IllegalArgumentException("Base template set cannot be blank");
        }
        templateRoots = templateRoots == null ? List.of() : List.copyOf(templateRoots);
        if (parallelism < 1 || parallelism > MAX_PARALLELISM) {
            throw new IllegalArgumentException(
                "Parallelism must be between 1 and " + MAX_PARALLELISM + ", got: " + parallelism
            );
        }
    }

    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseTemplateSet = DEFAULT_BASE_TEMPLATE_SET;
        private final List<Path> templateRoots = new ArrayList<>();
        private int parallelism = DEFAULT_PARALLELISM;
        private boolean debug = false;

        public Builder baseTemplateSet(String baseTemplateSet) {
            this.baseTemplateSet = baseTemplateSet;
            return this;
        }

        public Builder templateRoot(Path templateRoot) {
            this.templateRoots.add(templateRoot);
            return this;
        }

        public Builder templateRoots(List<Path> templateRoots) {
            this.templateRoots.clear();
            if (templateRoots != null) {
                this.templateRoots.addAll(templateRoots);
            }
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(baseTemplateSet, templateRoots, parallelism, debug);
        }
    }
}
