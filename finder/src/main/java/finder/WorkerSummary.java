package finder;

import finder.model.CheckFailure;

import java.util.List;

record WorkerSummary(int checked, int skipped, int found, int noneFound, List<CheckFailure> failures) {
    WorkerSummary {
        failures = List.copyOf(failures);
    }
}
