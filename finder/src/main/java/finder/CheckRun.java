package finder;

import finder.model.RunReport;

/** The filled result store of a run together with its aggregate report. */
public record CheckRun(ResultStore results, RunReport report) {
}
