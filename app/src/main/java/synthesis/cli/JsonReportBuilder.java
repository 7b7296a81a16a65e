package synthesis.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import synthesis.enumerate.EquivalenceScreen;
import synthesis.pipeline.Example;
import synthesis.pipeline.SynthesisResult;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(SynthesisResult result, CliOptions options, EquivalenceScreen screen) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result, options));
    root.put("examples", examples(options.examples()));
    root.put("search", search(result, screen));
    root.put("solution", result.solved() ? result.solution().render() : null);
    root.put("termination_reason", result.terminationReason());
    return gson.toJson(root);
  }

  private Map<String, Object> meta(SynthesisResult result, CliOptions options) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", result.elapsedMillis());
    meta.put("timeout_ms", options.timeoutMs());
    meta.put("max_depth", options.maxDepth());
    meta.put("variables", options.variables());
    return meta;
  }

  private List<Map<String, Object>> examples(List<Example> examples) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (Example example : examples) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("inputs", example.inputs());
      map.put("output", example.output());
      list.add(map);
    }
    return list;
  }

  private Map<String, Object> search(SynthesisResult result, EquivalenceScreen screen) {
    Map<String, Object> search = new LinkedHashMap<>();
    search.put("candidates_tried", result.candidatesTried());
    search.put("distinct_programs", screen.size());
    search.put("duplicates_rejected", screen.duplicatesRejected());
    return search;
  }
}
