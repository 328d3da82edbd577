package finder.model;

public enum TripType {
    DIRECT,
    ONE_STOP,
    ROUND_TRIP
}
