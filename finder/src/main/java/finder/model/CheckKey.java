package finder.model;

import java.time.LocalDate;
import java.util.Comparator;

public record CheckKey(String legHash, LocalDate date) implements Comparable<CheckKey> {
    private static final Comparator<CheckKey> ORDER =
            Comparator.comparing(CheckKey::legHash).thenComparing(CheckKey::date);

    public static CheckKey of(Leg leg, LocalDate date) {
        return new CheckKey(leg.hash(), date);
    }

    @Override
    public int compareTo(CheckKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return legHash + "-" + date;
    }
}
