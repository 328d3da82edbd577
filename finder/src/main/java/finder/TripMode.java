package finder;

public enum TripMode {
    ONE_WAY,
    ROUND_TRIP
}
