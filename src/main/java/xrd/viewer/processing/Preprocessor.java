package xrd.viewer.processing;

import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.apache.log4j.Logger;
import xrd.viewer.input.Dataset;
import xrd.viewer.input.DatasetStore;
import xrd.viewer.input.Scope;
import xrd.viewer.utils.ValidationException;

/**
 * Template for the steps that transform stored traces in place (baseline removal, smoothing,
 * range filtering). Concrete steps are configured through their setters and then run with
 * {@link #runOnData(DatasetStore, Scope)}, which may be called any number of times.
 *
 * Parameters are checked once before any dataset is touched. Each dataset's result is computed
 * from a copy of its data and committed only if the computation succeeds, so a dataset the step
 * fails on keeps its values, history and backup. When the scope covers all datasets such a
 * failure is recorded in the returned {@link BatchResult} and the remaining datasets are still
 * processed; for a single-dataset scope the failure is thrown to the caller.
 *
 * Committing a transform makes the dataset take a backup of its values if it has none, so the
 * store can later reset it to its state before the first step applied to it.
 */
public abstract class Preprocessor {

  private static final Logger logger = Logger.getLogger(Preprocessor.class);

  private final EventListenerList eventHelper;
  private String status;

  Preprocessor() {
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Add an object to the list of objects to be notified when the step's status changes
   *
   * @param listener ChangeListener to be notified (i.e., a progress display)
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return newest status message produced by this step
   *
   * @return String representing status of processing
   */
  public String getStatus() {
    return status;
  }

  /**
   * Get the display name of this step with its current parameters, as recorded in the history
   * of each dataset it is applied to
   *
   * @return Name of step
   */
  public abstract String getName();

  /**
   * Check the current parameters of this step
   *
   * @throws xrd.viewer.utils.InvalidParameterException if a parameter is out of range
   */
  public abstract void checkParameters();

  /**
   * Apply this step to every dataset in the given scope, in the order they were added to the
   * store.
   *
   * @param store Datasets of the session
   * @param scope All datasets, or a single named one
   * @return Names of the datasets transformed and of those left untouched with the reason
   * @throws xrd.viewer.utils.InvalidParameterException if a parameter is out of range (nothing
   * is changed)
   * @throws IllegalArgumentException if a single-dataset scope names no dataset in the store
   * @throws ValidationException if the data of a single-dataset scope cannot be processed
   * (nothing is changed)
   */
  public BatchResult runOnData(DatasetStore store, Scope scope) {
    checkParameters();
    List<Dataset> targets = store.getTargets(scope);
    BatchResult result = new BatchResult(getName());

    fireStateChange("Beginning " + getName() + " on " + targets.size() + " dataset(s)...");
    for (Dataset dataset : targets) {
      fireStateChange("Processing " + dataset.getName() + "...");
      try {
        backend(dataset);
        result.addProcessed(dataset.getName());
      } catch (ValidationException e) {
        if (!scope.isAllDatasets()) {
          throw e;
        }
        logger.warn(getName() + " skipped dataset " + dataset.getName() + ": " + e.getMessage());
        result.addFailure(dataset.getName(), e.getMessage());
      }
    }
    fireStateChange(getName() + " done!");
    return result;
  }

  /**
   * Abstract function that computes the result of this step for one dataset and commits it,
   * overwritten by concrete steps with specific operations. Implementations compute from copies
   * of the dataset's values and only change the dataset once the result is complete.
   *
   * @param dataset Dataset to transform
   */
  protected abstract void backend(Dataset dataset);

}
