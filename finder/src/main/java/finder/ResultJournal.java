package finder;

import com.fasterxml.jackson.annotation.JsonInclude;
import finder.model.CheckKey;
import finder.model.CheckOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.LinkedHashMap;

/**
 * Append-only JSON Lines file backing a {@link ResultStore}, one line per stored outcome. Lets an interrupted run be
 * resumed without repeating checks.
 */
public class ResultJournal implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResultJournal.class);

    private static final JsonMapper jsonMapper = JsonMapper.builder()
            .changeDefaultPropertyInclusion(incl -> incl.withValueInclusion(JsonInclude.Include.NON_NULL))
            .build();

    private final File file;
    private final BufferedWriter writer;

    private ResultJournal(File file) throws IOException {
        this.file = file;
        this.writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Rebuilds a store from everything {@code file} already contains and appends further writes to it. The last line
     * for a key wins.
     */
    public static ResultStore load(File file) throws IOException {
        if (file.getParentFile() != null) {
            file.getParentFile().mkdirs();
        }
        var existing = new LinkedHashMap<CheckKey, CheckOutcome>();
        try (BufferedReader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = r.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    Entry entry = jsonMapper.readValue(line, Entry.class);
                    existing.put(new CheckKey(entry.legHash(), entry.date()), entry.outcome());
                } catch (JacksonException e) {
                    log.warn("Skipping unreadable line {} of {}: {}", lineNumber, file, e.getOriginalMessage());
                }
            }
            log.info("Read {} existing results from {}", existing.size(), file);
        } catch (NoSuchFileException e) {
            log.info("Results file {} does not exist", file);
        }

        ResultStore store = new ResultStore(new ResultJournal(file));
        existing.forEach(store::restore);
        return store;
    }

    synchronized void append(CheckKey key, CheckOutcome outcome) {
        try {
            writer.write(jsonMapper.writeValueAsString(new Entry(key.legHash(), key.date(), outcome)));
            writer.write("\n");
            writer.flush(); // Flush after each write for crash safety
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }

    record Entry(String legHash, LocalDate date, CheckOutcome outcome) {
    }
}
