package finder;

import finder.model.AirportDirectory;

import java.util.ServiceLoader;

/**
 * Service-loaded source of {@link CheckerFactory} instances, selected by {@link FinderConfig#checker()}.
 */
public interface AvailabilityCheckerProvider {

    String name();

    CheckerFactory create(FinderConfig config, AirportDirectory airports);

    static AvailabilityCheckerProvider named(String name) {
        for (AvailabilityCheckerProvider provider : ServiceLoader.load(AvailabilityCheckerProvider.class)) {
            if (provider.name().equals(name)) {
                return provider;
            }
        }
        throw new FinderConfigurationException("No availability checker named '" + name + "' on the classpath");
    }
}
