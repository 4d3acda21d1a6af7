package xrd.viewer.processing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running one preprocessing step over a scope of datasets: which datasets were
 * transformed, and why each of the others was left as it was.
 */
public class BatchResult {

  private final String stepName;
  private final List<String> processed;
  private final Map<String, String> failures;

  BatchResult(String stepName) {
    this.stepName = stepName;
    processed = new ArrayList<>();
    failures = new LinkedHashMap<>();
  }

  void addProcessed(String datasetName) {
    processed.add(datasetName);
  }

  void addFailure(String datasetName, String message) {
    failures.put(datasetName, message);
  }

  public String getStepName() {
    return stepName;
  }

  /**
   * @return Names of the datasets the step was committed to, in processing order
   */
  public List<String> getProcessed() {
    return Collections.unmodifiableList(processed);
  }

  /**
   * @return Map from the name of each dataset left untouched to the reason, in processing order
   */
  public Map<String, String> getFailures() {
    return Collections.unmodifiableMap(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(stepName).append(": ").append(processed.size()).append(" processed");
    if (hasFailures()) {
      sb.append(", ").append(failures.size()).append(" failed");
      for (Map.Entry<String, String> failure : failures.entrySet()) {
        sb.append('\n').append(failure.getKey()).append(": ").append(failure.getValue());
      }
    }
    return sb.toString();
  }

}
