package fr.lapetina.weather.aggregator;

import fr.lapetina.weather.aggregator.domain.source.SourceFactory;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed command-line arguments.
 *
 * <p>Multi-word values are accepted without quoting: every bare token after
 * {@code --city} joins the city name, and tokens after {@code --exclude} are
 * collected until the next flag. A bare token containing a comma, anywhere
 * outside an {@code --exclude} run, is treated as part of the exclusion list.
 *
 * @param city       validated city name
 * @param sequential fetch one source at a time
 * @param exclusions source names to skip
 * @param configPath configuration file or classpath resource
 * @param json       print the report as JSON
 * @param metrics    print Prometheus metrics after the report
 */
public record CommandLineOptions(
        String city,
        boolean sequential,
        List<String> exclusions,
        String configPath,
        boolean json,
        boolean metrics
) {
    public static final int MAX_CITY_LENGTH = 100;

    // Letters in any script, digits, whitespace, any dash, apostrophe, period, underscore
    private static final Pattern CITY_PATTERN = Pattern.compile("^[\\p{L}0-9_\\s\\p{Pd}'.]+$");

    public CommandLineOptions {
        exclusions = exclusions != null ? List.copyOf(exclusions) : List.of();
    }

    /**
     * Parses and validates the arguments.
     *
     * @throws IllegalArgumentException with a user-facing message on invalid input
     */
    public static CommandLineOptions parse(String[] args) {
        List<String> cityParts = new ArrayList<>();
        List<String> excludeParts = new ArrayList<>();
        String configPath = ConfigLoader.DEFAULT_CONFIG;
        boolean sequential = false;
        boolean json = false;
        boolean metrics = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--city=")) {
                cityParts.add(arg.substring("--city=".length()));
            } else if (arg.equals("--city")) {
                while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    String word = args[++i];
                    if (word.contains(",")) {
                        excludeParts.add(word);
                    } else {
                        cityParts.add(word);
                    }
                }
            } else if (arg.startsWith("--exclude=")) {
                excludeParts.add(arg.substring("--exclude=".length()));
            } else if (arg.equals("--exclude")) {
                // Words of one --exclude run form names with spaces, e.g. "Pirate Weather"
                List<String> words = new ArrayList<>();
                while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    words.add(args[++i]);
                }
                excludeParts.add(String.join(" ", words));
            } else if (arg.startsWith("--config=")) {
                configPath = arg.substring("--config=".length());
            } else if (arg.equals("--config")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a path");
                }
                configPath = args[++i];
            } else if (arg.equals("--sequential")) {
                sequential = true;
            } else if (arg.equals("--json")) {
                json = true;
            } else if (arg.equals("--metrics")) {
                metrics = true;
            } else if (arg.startsWith("-")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else if (arg.contains(",")) {
                excludeParts.add(arg);
            } else {
                cityParts.add(arg);
            }
        }

        String city = validateCity(String.join(" ", cityParts));
        List<String> exclusions = SourceFactory.parseExclusions(String.join(",", excludeParts));
        return new CommandLineOptions(city, sequential, exclusions, configPath, json, metrics);
    }

    /**
     * Trims and validates a city name.
     *
     * @return the trimmed name
     * @throws IllegalArgumentException if the name is empty, too long, starts with '-' or has forbidden characters
     */
    public static String validateCity(String city) {
        String trimmed = city == null ? "" : city.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("city name is required and cannot be empty");
        }
        if (trimmed.startsWith("-")) {
            throw new IllegalArgumentException("city name cannot start with '-'");
        }
        if (trimmed.length() > MAX_CITY_LENGTH) {
            throw new IllegalArgumentException("city name must not exceed " + MAX_CITY_LENGTH + " characters");
        }
        if (!CITY_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    "Invalid city name. Allowed: letters (ü, é, ñ), digits, spaces, hyphens, apostrophes, periods");
        }
        return trimmed;
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: weather-aggregator --city <city> [OPTIONS]",
                "",
                "Options:",
                "  --city         City name (required, spaces allowed)",
                "  --sequential   Fetch sources one at a time",
                "  --exclude      Comma-separated source names to skip",
                "  --config       Configuration file (default: " + ConfigLoader.DEFAULT_CONFIG + ")",
                "  --json         Print the report as JSON",
                "  --metrics      Print Prometheus metrics after the report",
                "",
                "Examples:",
                "  weather-aggregator --city New York",
                "  weather-aggregator --city \"O'Brien\"",
                "  weather-aggregator --city Berlin --exclude WeatherAPI.com,wttr.in");
    }
}
