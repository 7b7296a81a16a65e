package synthesis.cli;

import java.util.List;
import synthesis.examples.ArithmeticGrammar;
import synthesis.pipeline.Example;
import synthesis.pipeline.SynthesisOptions;

record CliOptions(
    long timeoutMs,
    int maxDepth,
    List<String> variables,
    List<Example> examples,
    boolean json,
    int depth,
    int limit) {
  static final int DEFAULT_ENUMERATION_DEPTH = 2;

  CliOptions {
    variables = List.copyOf(variables);
    examples = List.copyOf(examples);
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("--timeout-ms must be positive");
    }
    if (maxDepth < 0) {
      throw new IllegalArgumentException("--max-depth must be non-negative");
    }
    if (variables.isEmpty()) {
      throw new IllegalArgumentException("--vars must name at least one variable");
    }
    if (depth < 0) {
      throw new IllegalArgumentException("--depth must be non-negative");
    }
    if (limit < 0) {
      throw new IllegalArgumentException("--limit must be non-negative");
    }
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private long timeoutMs = SynthesisOptions.defaults().timeBudget().toMillis();
    private int maxDepth = SynthesisOptions.defaults().maxDepth();
    private List<String> variables = ArithmeticGrammar.DEFAULT_VARIABLES;
    private List<Example> examples = ArithmeticGrammar.defaultExamples();
    private boolean json;
    private int depth = DEFAULT_ENUMERATION_DEPTH;
    private int limit;

    Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    Builder variables(List<String> variables) {
      if (variables != null) {
        this.variables = List.copyOf(variables);
      }
      return this;
    }

    Builder examples(List<Example> examples) {
      if (examples != null) {
        this.examples = List.copyOf(examples);
      }
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder depth(int depth) {
      this.depth = depth;
      return this;
    }

    Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    CliOptions build() {
      for (Example example : examples) {
        for (String name : example.inputs().keySet()) {
          if (!variables.contains(name)) {
            throw new IllegalArgumentException(
                "Example binds " + name + " which is not one of --vars " + variables);
          }
        }
      }
      return new CliOptions(timeoutMs, maxDepth, variables, examples, json, depth, limit);
    }
  }
}
