package synthesis.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One input/output pair: variable bindings and the value a correct program must produce. */
public record Example(Map<String, Object> inputs, Object output) {

  public Example {
    inputs =
        Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(inputs, "inputs")));
    Objects.requireNonNull(output, "output");
  }

  @Override
  public String toString() {
    return inputs + " -> " + output;
  }
}
