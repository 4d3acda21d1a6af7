package xrd.viewer.input;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Holds the datasets loaded into a session, in the order they were added. Dataset names are
 * unique within a store; adding a dataset under a name already in use appends a numeric suffix
 * (name-2, name-3, ...).
 *
 * Preprocessing steps get their targets from here through a {@link Scope}, and reset restores
 * each dataset to its state before the first transform since its last reset.
 */
public class DatasetStore {

  private static final Logger logger = Logger.getLogger(DatasetStore.class);

  private final Map<String, Dataset> datasets;

  public DatasetStore() {
    datasets = new LinkedHashMap<>();
  }

  /**
   * Add a trace to the store with no offset and the default color
   *
   * @param requestedName Name to give the dataset
   * @param series Data of the trace
   * @return The new dataset, whose name may have a suffix if the requested one was taken
   */
  public Dataset addDataset(String requestedName, Series series) {
    return addDataset(requestedName, series, 0., null);
  }

  /**
   * Add a trace to the store
   *
   * @param requestedName Name to give the dataset
   * @param series Data of the trace
   * @param offset Vertical display offset
   * @param color Plot color, or null for the default
   * @return The new dataset, whose name may have a suffix if the requested one was taken
   */
  public Dataset addDataset(String requestedName, Series series, double offset, Color color) {
    if (requestedName == null || requestedName.trim().isEmpty()) {
      throw new IllegalArgumentException("Dataset name must not be blank");
    }
    String name = uniqueName(requestedName.trim());
    Dataset dataset = new Dataset(name, series, offset, color);
    datasets.put(name, dataset);
    logger.info("Added dataset " + name + " (" + series.size() + " points)");
    return dataset;
  }

  /**
   * Get a name not yet used in this store, based on the requested one
   *
   * @param requestedName Name to start from
   * @return requestedName if it is free, otherwise requestedName-N for the lowest free N >= 2
   */
  public String uniqueName(String requestedName) {
    String name = requestedName;
    int counter = 2;
    while (datasets.containsKey(name)) {
      name = requestedName + "-" + counter;
      ++counter;
    }
    return name;
  }

  /**
   * Remove a dataset from the store
   *
   * @param name Name of the dataset to remove
   * @return True if a dataset of that name existed
   */
  public boolean removeDataset(String name) {
    return datasets.remove(name) != null;
  }

  /**
   * Get a dataset by name
   *
   * @param name Name of the dataset
   * @return The dataset, or null if none has that name
   */
  public Dataset getDataset(String name) {
    return datasets.get(name);
  }

  /**
   * Get all datasets in the order they were added
   *
   * @return Unmodifiable list of datasets
   */
  public List<Dataset> getDatasets() {
    return Collections.unmodifiableList(new ArrayList<>(datasets.values()));
  }

  public List<String> getNames() {
    return new ArrayList<>(datasets.keySet());
  }

  public int size() {
    return datasets.size();
  }

  public boolean isEmpty() {
    return datasets.isEmpty();
  }

  /**
   * Get the datasets covered by a scope, in the order they were added
   *
   * @param scope All datasets or a single named one
   * @return Targeted datasets (empty if the scope is all datasets and the store is empty)
   * @throws IllegalArgumentException if a single-dataset scope names a dataset not in the store
   */
  public List<Dataset> getTargets(Scope scope) {
    if (scope.isAllDatasets()) {
      return getDatasets();
    }
    Dataset dataset = datasets.get(scope.getDatasetName());
    if (dataset == null) {
      throw new IllegalArgumentException("No dataset named " + scope.getDatasetName());
    }
    return Collections.singletonList(dataset);
  }

  /**
   * Restore a dataset to its values before the first transform since its last reset, discarding
   * the backup. Resetting a dataset with no transforms applied changes nothing.
   *
   * @param name Name of the dataset to reset
   * @return True if data was restored
   * @throws IllegalArgumentException if no dataset has that name
   */
  public boolean reset(String name) {
    Dataset dataset = datasets.get(name);
    if (dataset == null) {
      throw new IllegalArgumentException("No dataset named " + name);
    }
    boolean restored = dataset.reset();
    if (restored) {
      logger.info("Reset dataset " + name + " to its original data");
    }
    return restored;
  }

  /**
   * Reset every dataset in the store
   *
   * @return Number of datasets that had data restored
   */
  public int resetAll() {
    int restored = 0;
    for (Dataset dataset : datasets.values()) {
      if (dataset.reset()) {
        ++restored;
      }
    }
    logger.info("Reset " + restored + " of " + datasets.size() + " datasets");
    return restored;
  }

  /**
   * Get the display curves of all datasets, with offsets applied, for plotting
   *
   * @return Collection of one series per dataset, in the order they were added
   */
  public XYSeriesCollection toXYSeriesCollection() {
    XYSeriesCollection xysc = new XYSeriesCollection();
    for (Dataset dataset : datasets.values()) {
      xysc.addSeries(dataset.toXYSeries());
    }
    return xysc;
  }

}
