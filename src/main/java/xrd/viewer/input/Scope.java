package xrd.viewer.input;

import java.util.Objects;

/**
 * Which datasets of a session an operation applies to: every dataset, or a single one named by
 * the caller.
 */
public final class Scope {

  private static final Scope ALL = new Scope(null);

  private final String datasetName;

  private Scope(String datasetName) {
    this.datasetName = datasetName;
  }

  /**
   * @return Scope covering every dataset in the session
   */
  public static Scope allDatasets() {
    return ALL;
  }

  /**
   * @param datasetName Name of the dataset to operate on
   * @return Scope covering only the named dataset
   */
  public static Scope singleDataset(String datasetName) {
    Objects.requireNonNull(datasetName, "datasetName");
    return new Scope(datasetName);
  }

  public boolean isAllDatasets() {
    return datasetName == null;
  }

  /**
   * @return Name of the targeted dataset, or null if this scope covers all datasets
   */
  public String getDatasetName() {
    return datasetName;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Scope)) {
      return false;
    }
    return Objects.equals(datasetName, ((Scope) other).datasetName);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(datasetName);
  }

  @Override
  public String toString() {
    return isAllDatasets() ? "all datasets" : "dataset " + datasetName;
  }
}
