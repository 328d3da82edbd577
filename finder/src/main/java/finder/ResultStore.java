package finder;

import finder.model.CheckKey;
import finder.model.CheckOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe map from (leg hash, date) to the outcome of checking it. Operations on one key are atomic. Writing the
 * same outcome twice is a no-op.
 */
public class ResultStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private final ConcurrentHashMap<CheckKey, CheckOutcome> entries = new ConcurrentHashMap<>();
    private final ResultJournal journal;

    public ResultStore() {
        this(null);
    }

    /** A store that appends every effective write to {@code journal}. */
    public ResultStore(ResultJournal journal) {
        this.journal = journal;
    }

    public Optional<CheckOutcome> get(CheckKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(CheckKey key) {
        return entries.containsKey(key);
    }

    /** True when {@code key} holds an answer from the checker, as opposed to nothing or a failure marker. */
    public boolean isChecked(CheckKey key) {
        CheckOutcome outcome = entries.get(key);
        return outcome != null && !outcome.isFailed();
    }

    /**
     * Stores {@code outcome} for {@code key}. Returns false when the same outcome was already stored. The journal line
     * is written while the key is locked, so its last line for a key always matches the map.
     */
    public boolean put(CheckKey key, CheckOutcome outcome) {
        boolean[] changed = {false};
        entries.compute(key, (k, previous) -> {
            if (outcome.equals(previous)) {
                return previous;
            }
            if (previous != null) {
                log.debug("Replaced {} result for {} with {}", previous.status(), k, outcome.status());
            }
            if (journal != null) {
                journal.append(k, outcome);
            }
            changed[0] = true;
            return outcome;
        });
        return changed[0];
    }

    /** Loads entries without writing them to the journal. */
    void restore(CheckKey key, CheckOutcome outcome) {
        entries.put(key, outcome);
    }

    public int size() {
        return entries.size();
    }

    /** Closes the backing journal, if any. Entries stay readable. */
    @Override
    public void close() throws IOException {
        if (journal != null) {
            journal.close();
        }
    }

    /** Immutable copy of every entry, ordered by key. */
    public Map<CheckKey, CheckOutcome> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(entries));
    }
}
